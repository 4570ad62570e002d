package com.alninja.billing.writeback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One use of a feature by an organization member, appended to {@code logs/{orgId}_featureLog.json}.
 */
@JsonPropertyOrder({"appId", "timestamp", "email", "feature"})
public final class FeatureLogEntry {
    private final String _appId;
    private final long _timestamp;
    private final String _email;
    private final String _feature;

    @JsonCreator
    public FeatureLogEntry(@JsonProperty("appId") String appId,
                           @JsonProperty("timestamp") long timestamp,
                           @JsonProperty("email") String email,
                           @JsonProperty("feature") String feature) {
        _appId = appId;
        _timestamp = timestamp;
        _email = email;
        _feature = feature;
    }

    public String getAppId() {
        return _appId;
    }

    public long getTimestamp() {
        return _timestamp;
    }

    /** As sent by the client. */
    public String getEmail() {
        return _email;
    }

    public String getFeature() {
        return _feature;
    }
}
