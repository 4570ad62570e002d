package com.alninja.billing.permission;

import com.alninja.billing.api.PermissionResult;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A permission verdict together with the record keeping it calls for.
 */
public final class PermissionDecision {
    private final PermissionResult _result;
    private final UserUpdate _userUpdate;
    private final boolean _logUnknownUser;

    public PermissionDecision(PermissionResult result, @Nullable UserUpdate userUpdate, boolean logUnknownUser) {
        _result = checkNotNull(result, "result");
        _userUpdate = userUpdate;
        _logUnknownUser = logUnknownUser;
    }

    public static PermissionDecision of(PermissionResult result) {
        return new PermissionDecision(result, null, false);
    }

    public PermissionResult getResult() {
        return _result;
    }

    @Nullable
    public UserUpdate getUserUpdate() {
        return _userUpdate;
    }

    public boolean isLogUnknownUser() {
        return _logUnknownUser;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PermissionDecision)) {
            return false;
        }
        PermissionDecision that = (PermissionDecision) o;
        return _logUnknownUser == that._logUnknownUser &&
                _result.equals(that._result) &&
                _userUpdate == that._userUpdate;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_result, _userUpdate, _logUnknownUser);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("result", _result)
                .add("userUpdate", _userUpdate)
                .add("logUnknownUser", _logUnknownUser)
                .toString();
    }
}
