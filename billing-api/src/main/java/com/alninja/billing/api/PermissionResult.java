package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Outcome of a permission check: allowed, allowed with a warning, or denied with an error.
 */
public final class PermissionResult {
    private static final PermissionResult ALLOWED = new PermissionResult(true, null, null);

    private final boolean _allowed;
    private final PermissionWarning _warning;
    private final PermissionError _error;

    @JsonCreator
    private PermissionResult(@JsonProperty("allowed") boolean allowed,
                             @JsonProperty("warning") @Nullable PermissionWarning warning,
                             @JsonProperty("error") @Nullable PermissionError error) {
        checkArgument(allowed ? error == null : error != null && warning == null,
                "Allowed results carry no error and denied results carry only an error");
        _allowed = allowed;
        _warning = warning;
        _error = error;
    }

    public static PermissionResult allowed() {
        return ALLOWED;
    }

    public static PermissionResult allowed(PermissionWarning warning) {
        return new PermissionResult(true, checkNotNull(warning, "warning"), null);
    }

    public static PermissionResult denied(PermissionError error) {
        return new PermissionResult(false, null, checkNotNull(error, "error"));
    }

    public static PermissionResult denied(ErrorCode code) {
        return denied(new PermissionError(code));
    }

    public boolean isAllowed() {
        return _allowed;
    }

    @Nullable
    public PermissionWarning getWarning() {
        return _warning;
    }

    @Nullable
    public PermissionError getError() {
        return _error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PermissionResult)) {
            return false;
        }
        PermissionResult that = (PermissionResult) o;
        return _allowed == that._allowed &&
                Objects.equal(_warning, that._warning) &&
                Objects.equal(_error, that._error);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_allowed, _warning, _error);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("allowed", _allowed)
                .add("warning", _warning)
                .add("error", _error)
                .toString();
    }
}
