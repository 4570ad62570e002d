package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thrown when the caller is not entitled to use the app.  Serializes as {@code {"error": {...}}}.
 */
@JsonIgnoreProperties ({"cause", "localizedMessage", "stackTrace", "message", "suppressed"})
public class PermissionDeniedException extends BillingClientException {
    private final PermissionError _error;

    @JsonCreator
    public PermissionDeniedException(@JsonProperty("error") PermissionError error) {
        super(checkNotNull(error, "error").getCode().name());
        _error = error;
    }

    public PermissionError getError() {
        return _error;
    }
}
