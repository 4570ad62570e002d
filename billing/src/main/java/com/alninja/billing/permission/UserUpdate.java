package com.alninja.billing.permission;

/**
 * Change to an organization's user records requested by a permission decision.
 */
public enum UserUpdate {
    /** Add to users and remove from denied users. */
    ALLOW,
    /** Add to denied users. */
    DENY,
    /** Record when the user was first seen, if not already recorded. */
    UNKNOWN
}
