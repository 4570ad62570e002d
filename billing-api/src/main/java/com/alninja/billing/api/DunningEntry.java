package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An organization with outstanding payment problems, as listed in {@code system/dunning.json}.  Dunning is
 * advisory: it adds a response header but never blocks a request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DunningEntry {
    private final String _organizationId;
    private final int _dunningStage;
    private final long _startedAt;
    private final long _lastStageChangedAt;

    @JsonCreator
    public DunningEntry(@JsonProperty("organizationId") String organizationId,
                        @JsonProperty("dunningStage") int dunningStage,
                        @JsonProperty("startedAt") long startedAt,
                        @JsonProperty("lastStageChangedAt") long lastStageChangedAt) {
        _organizationId = checkNotNull(organizationId, "organizationId");
        _dunningStage = dunningStage;
        _startedAt = startedAt;
        _lastStageChangedAt = lastStageChangedAt;
    }

    public String getOrganizationId() {
        return _organizationId;
    }

    /** 1, 2 or 3. */
    public int getDunningStage() {
        return _dunningStage;
    }

    public long getStartedAt() {
        return _startedAt;
    }

    public long getLastStageChangedAt() {
        return _lastStageChangedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DunningEntry)) {
            return false;
        }
        DunningEntry that = (DunningEntry) o;
        return _dunningStage == that._dunningStage &&
                _startedAt == that._startedAt &&
                _lastStageChangedAt == that._lastStageChangedAt &&
                _organizationId.equals(that._organizationId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_organizationId, _dunningStage, _startedAt, _lastStageChangedAt);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("organizationId", _organizationId)
                .add("dunningStage", _dunningStage)
                .toString();
    }
}
