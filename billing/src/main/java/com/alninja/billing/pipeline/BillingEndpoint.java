package com.alninja.billing.pipeline;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Registration of an endpoint with the billing pipeline: its moniker, used as the feature name in usage logs, and
 * the capabilities it requires.
 */
public final class BillingEndpoint {
    private final String _moniker;
    private final Set<Capability> _capabilities;

    private BillingEndpoint(String moniker, Set<Capability> capabilities) {
        _moniker = checkNotNull(moniker, "moniker");
        checkArgument(!moniker.isEmpty(), "Moniker cannot be empty");
        _capabilities = capabilities;
    }

    public static BillingEndpoint of(String moniker, Capability... capabilities) {
        return new BillingEndpoint(moniker, Capability.expand(Lists.newArrayList(capabilities)));
    }

    /** An endpoint the billing pipeline does not touch. */
    public static BillingEndpoint unbilled(String moniker) {
        return new BillingEndpoint(moniker, ImmutableSet.of());
    }

    public static BillingEndpoint withSecurity(String moniker) {
        return of(moniker, Capability.SECURITY);
    }

    public static BillingEndpoint withUsageLogging(String moniker) {
        return of(moniker, Capability.USAGE_LOGGING);
    }

    public static BillingEndpoint withLogging(String moniker) {
        return of(moniker, Capability.LOGGING);
    }

    public static BillingEndpoint withBilling(String moniker) {
        return of(moniker, Capability.BILLING);
    }

    /** Returns a copy of this endpoint which also requires {@code capability}. */
    public BillingEndpoint and(Capability capability) {
        return new BillingEndpoint(_moniker, Capability.expand(
                ImmutableSet.<Capability>builder().addAll(_capabilities).add(capability).build()));
    }

    public String getMoniker() {
        return _moniker;
    }

    public Set<Capability> getCapabilities() {
        return _capabilities;
    }

    public boolean has(Capability capability) {
        return _capabilities.contains(capability);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("moniker", _moniker)
                .add("capabilities", _capabilities)
                .toString();
    }
}
