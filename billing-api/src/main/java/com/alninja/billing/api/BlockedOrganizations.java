package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Contents of {@code system/blocked.json}: blocked organizations keyed by organization id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BlockedOrganizations {
    public static final BlockedOrganizations EMPTY = new BlockedOrganizations(0, null);

    private final long _updatedAt;
    private final Map<String, BlockedOrganization> _orgs;

    @JsonCreator
    public BlockedOrganizations(@JsonProperty("updatedAt") long updatedAt,
                                @JsonProperty("orgs") @Nullable Map<String, BlockedOrganization> orgs) {
        _updatedAt = updatedAt;
        _orgs = orgs == null
                ? ImmutableMap.of()
                : ImmutableMap.copyOf(Maps.filterEntries(orgs, entry -> entry.getKey() != null && entry.getValue() != null));
    }

    public long getUpdatedAt() {
        return _updatedAt;
    }

    public Map<String, BlockedOrganization> getOrgs() {
        return _orgs;
    }

    @Nullable
    public BlockedOrganization get(String organizationId) {
        return _orgs.get(organizationId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BlockedOrganizations)) {
            return false;
        }
        BlockedOrganizations that = (BlockedOrganizations) o;
        return _updatedAt == that._updatedAt && _orgs.equals(that._orgs);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_updatedAt, _orgs);
    }
}
