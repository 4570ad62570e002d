package com.alninja.billing.writeback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An organization app used by somebody the organization has not classified yet, appended to
 * {@code logs/{orgId}_unknown.json} on every attempt.
 */
@JsonPropertyOrder({"timestamp", "email", "appId"})
public final class UnknownUserAttempt {
    private final long _timestamp;
    private final String _email;
    private final String _appId;

    @JsonCreator
    public UnknownUserAttempt(@JsonProperty("timestamp") long timestamp,
                              @JsonProperty("email") String email,
                              @JsonProperty("appId") String appId) {
        _timestamp = timestamp;
        _email = email;
        _appId = appId;
    }

    public long getTimestamp() {
        return _timestamp;
    }

    /** Normalized. */
    public String getEmail() {
        return _email;
    }

    public String getAppId() {
        return _appId;
    }
}
