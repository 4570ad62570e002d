package com.alninja.billing.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the fault log.
 */
public final class UnhandledError {
    private final long _timestamp;
    private final String _message;

    @JsonCreator
    public UnhandledError(@JsonProperty("timestamp") long timestamp, @JsonProperty("message") String message) {
        _timestamp = timestamp;
        _message = message;
    }

    public long getTimestamp() {
        return _timestamp;
    }

    public String getMessage() {
        return _message;
    }
}
