package com.alninja.billing.permission;

/**
 * How an organization treats a given email address.
 */
public enum UserPermission {
    /** Listed in the organization's users. */
    ALLOWED,
    /** Listed in the organization's denied users. */
    DENIED,
    /** Not listed, but the email's domain is one of the organization's domains. */
    ALLOWED_BY_DOMAIN,
    /** Not listed, but the email's domain is awaiting verification by the organization. */
    ALLOWED_BY_PENDING_DOMAIN,
    /** Not listed, and the organization refuses users from unlisted domains. */
    DENIED_BY_UNKNOWN_DOMAIN,
    /** Not listed and no domain rule applies. */
    UNKNOWN
}
