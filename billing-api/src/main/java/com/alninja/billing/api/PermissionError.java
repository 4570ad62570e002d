package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

public final class PermissionError {
    private final ErrorCode _code;
    private final String _gitEmail;

    @JsonCreator
    public PermissionError(@JsonProperty("code") ErrorCode code, @JsonProperty("gitEmail") @Nullable String gitEmail) {
        _code = checkNotNull(code, "code");
        _gitEmail = gitEmail;
    }

    public PermissionError(ErrorCode code) {
        this(code, null);
    }

    public ErrorCode getCode() {
        return _code;
    }

    /** The email that was refused, when the refusal is specific to a user. */
    @Nullable
    public String getGitEmail() {
        return _gitEmail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PermissionError)) {
            return false;
        }
        PermissionError that = (PermissionError) o;
        return _code == that._code && Objects.equal(_gitEmail, that._gitEmail);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_code, _gitEmail);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("code", _code).add("gitEmail", _gitEmail).toString();
    }
}
