package com.alninja.billing.api;

/**
 * Reasons a request is refused.  Serialized by name.
 */
public enum ErrorCode {
    GRACE_EXPIRED,
    USER_NOT_AUTHORIZED,
    GIT_EMAIL_REQUIRED,
    ORG_FLAGGED,
    SUBSCRIPTION_CANCELLED,
    PAYMENT_FAILED,
    NO_SUBSCRIPTION,
    ORG_GRACE_EXPIRED
}
