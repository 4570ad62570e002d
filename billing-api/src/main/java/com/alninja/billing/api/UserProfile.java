package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A signed-up user, as stored in {@code system/users.json}.  Read-only to the billing core.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UserProfile {
    private final String _id;
    private final String _email;
    private final String _gitEmail;
    private final String _organizationId;
    private final String _name;
    private final String _provider;
    private final String _providerId;

    @JsonCreator
    public UserProfile(@JsonProperty("id") String id,
                       @JsonProperty("email") @Nullable String email,
                       @JsonProperty("gitEmail") @Nullable String gitEmail,
                       @JsonProperty("organizationId") @Nullable String organizationId,
                       @JsonProperty("name") @Nullable String name,
                       @JsonProperty("provider") @Nullable String provider,
                       @JsonProperty("providerId") @Nullable String providerId) {
        _id = checkNotNull(id, "id");
        _email = email;
        _gitEmail = gitEmail;
        _organizationId = organizationId;
        _name = name;
        _provider = provider;
        _providerId = providerId;
    }

    public String getId() {
        return _id;
    }

    @Nullable
    public String getEmail() {
        return _email;
    }

    @Nullable
    public String getGitEmail() {
        return _gitEmail;
    }

    @Nullable
    public String getOrganizationId() {
        return _organizationId;
    }

    @Nullable
    public String getName() {
        return _name;
    }

    @Nullable
    public String getProvider() {
        return _provider;
    }

    @Nullable
    public String getProviderId() {
        return _providerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UserProfile)) {
            return false;
        }
        UserProfile that = (UserProfile) o;
        return _id.equals(that._id) &&
                Objects.equal(_email, that._email) &&
                Objects.equal(_gitEmail, that._gitEmail) &&
                Objects.equal(_organizationId, that._organizationId) &&
                Objects.equal(_name, that._name) &&
                Objects.equal(_provider, that._provider) &&
                Objects.equal(_providerId, that._providerId);
    }

    @Override
    public int hashCode() {
        return _id.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("id", _id).add("email", _email).toString();
    }
}
