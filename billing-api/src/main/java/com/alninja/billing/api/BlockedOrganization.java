package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class BlockedOrganization {
    private final BlockReason _reason;
    private final long _blockedAt;
    private final String _note;

    @JsonCreator
    public BlockedOrganization(@JsonProperty("reason") @Nullable BlockReason reason,
                               @JsonProperty("blockedAt") long blockedAt,
                               @JsonProperty("note") @Nullable String note) {
        _reason = reason;
        _blockedAt = blockedAt;
        _note = note;
    }

    /**
     * Null when the stored reason is not one this version recognizes.  The organization is still blocked.
     */
    @Nullable
    public BlockReason getReason() {
        return _reason;
    }

    public long getBlockedAt() {
        return _blockedAt;
    }

    @Nullable
    public String getNote() {
        return _note;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BlockedOrganization)) {
            return false;
        }
        BlockedOrganization that = (BlockedOrganization) o;
        return _reason == that._reason && _blockedAt == that._blockedAt && Objects.equal(_note, that._note);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_reason, _blockedAt, _note);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("reason", _reason).add("blockedAt", _blockedAt).toString();
    }
}
