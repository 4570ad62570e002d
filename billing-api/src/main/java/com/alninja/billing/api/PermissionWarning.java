package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

public final class PermissionWarning {
    private final WarningCode _code;
    private final Long _timeRemaining;
    private final String _gitEmail;

    @JsonCreator
    public PermissionWarning(@JsonProperty("code") WarningCode code,
                             @JsonProperty("timeRemaining") @Nullable Long timeRemaining,
                             @JsonProperty("gitEmail") @Nullable String gitEmail) {
        _code = checkNotNull(code, "code");
        _timeRemaining = timeRemaining;
        _gitEmail = gitEmail;
    }

    public WarningCode getCode() {
        return _code;
    }

    /** Milliseconds left in the grace period. */
    @Nullable
    public Long getTimeRemaining() {
        return _timeRemaining;
    }

    @Nullable
    public String getGitEmail() {
        return _gitEmail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PermissionWarning)) {
            return false;
        }
        PermissionWarning that = (PermissionWarning) o;
        return _code == that._code &&
                Objects.equal(_timeRemaining, that._timeRemaining) &&
                Objects.equal(_gitEmail, that._gitEmail);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_code, _timeRemaining, _gitEmail);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("code", _code)
                .add("timeRemaining", _timeRemaining)
                .add("gitEmail", _gitEmail)
                .toString();
    }
}
