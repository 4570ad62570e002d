package com.alninja.billing.pipeline;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.EnumSet;
import java.util.Set;

/**
 * What an endpoint asks of the billing pipeline.  Every capability other than {@link #BILLING} implies it.
 */
public enum Capability {
    /** Invalidate the cache, require an app id, resolve and enforce permission. */
    SECURITY,
    /** Record feature usage and metering for organization apps. */
    USAGE_LOGGING,
    /** Log each invocation. */
    LOGGING,
    /** Bind, claim, block and dunning stages plus writebacks. */
    BILLING;

    private Set<Capability> implied() {
        switch (this) {
            case SECURITY:
                return ImmutableSet.of(SECURITY, LOGGING, BILLING);
            case USAGE_LOGGING:
                return ImmutableSet.of(USAGE_LOGGING, BILLING);
            case LOGGING:
                return ImmutableSet.of(LOGGING, BILLING);
            default:
                return ImmutableSet.of(this);
        }
    }

    /** Returns the given capabilities together with everything they imply. */
    public static Set<Capability> expand(Iterable<Capability> capabilities) {
        EnumSet<Capability> expanded = EnumSet.noneOf(Capability.class);
        for (Capability capability : capabilities) {
            expanded.addAll(capability.implied());
        }
        return Sets.immutableEnumSet(expanded);
    }
}
