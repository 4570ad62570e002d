package com.alninja.billing.pipeline;

import com.alninja.billing.api.BlockedOrganization;
import com.alninja.billing.cache.EntityCache;
import com.google.inject.Inject;

import static com.google.common.base.Preconditions.checkNotNull;

public class BlockingStage {
    private final EntityCache _cache;

    @Inject
    public BlockingStage(EntityCache cache) {
        _cache = checkNotNull(cache, "cache");
    }

    public void apply(BillingContext context) {
        if (context.getOrganization() == null) {
            return;
        }
        BlockedOrganization blocked = _cache.getBlockedStatus(context.getOrganization().getId());
        if (blocked != null) {
            context.bindBlocked(blocked);
        }
    }
}
