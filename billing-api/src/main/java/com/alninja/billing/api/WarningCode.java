package com.alninja.billing.api;

/**
 * Conditions under which a request is allowed but the client should show a warning.
 */
public enum WarningCode {
    APP_GRACE_PERIOD,
    ORG_GRACE_PERIOD
}
