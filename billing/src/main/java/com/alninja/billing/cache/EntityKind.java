package com.alninja.billing.cache;

/**
 * The independently cached collections.  Each kind is loaded, expired and invalidated on its own.
 */
public enum EntityKind {
    APPS,
    USERS,
    ORGANIZATIONS,
    BLOCKED,
    DUNNING
}
