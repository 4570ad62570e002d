package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An app registered with the backend, as stored in {@code system/apps.json}.  Apps are keyed by id and publisher,
 * both compared without regard to case or surrounding whitespace.
 * <p>
 * An app is either sponsored, owned by a user, owned by an organization, or unowned.  Unowned apps may be used for
 * free until {@link #getFreeUntil()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AppInfo {
    private final String _id;
    private final String _name;
    private final String _publisher;
    private final OwnerType _ownerType;
    private final String _ownerId;
    private final boolean _sponsored;
    private final long _created;
    private final long _freeUntil;
    private final String _gitEmail;

    @JsonCreator
    public AppInfo(@JsonProperty("id") String id,
                   @JsonProperty("name") @Nullable String name,
                   @JsonProperty("publisher") @Nullable String publisher,
                   @JsonProperty("ownerType") @Nullable OwnerType ownerType,
                   @JsonProperty("ownerId") @Nullable String ownerId,
                   @JsonProperty("sponsored") boolean sponsored,
                   @JsonProperty("created") long created,
                   @JsonProperty("freeUntil") long freeUntil,
                   @JsonProperty("gitEmail") @Nullable String gitEmail) {
        _id = checkNotNull(id, "id");
        _name = name != null ? name : "";
        _publisher = publisher != null ? publisher : "";
        _ownerType = ownerType;
        _ownerId = ownerId;
        _sponsored = sponsored;
        _created = created;
        _freeUntil = freeUntil;
        _gitEmail = gitEmail;
    }

    /**
     * Creates a new app which nobody owns yet.
     */
    public static AppInfo orphan(String id, String name, String publisher, long created, long freeUntil) {
        return new AppInfo(id, name, publisher, null, null, false, created, freeUntil, null);
    }

    public String getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    public String getPublisher() {
        return _publisher;
    }

    @Nullable
    public OwnerType getOwnerType() {
        return _ownerType;
    }

    @Nullable
    public String getOwnerId() {
        return _ownerId;
    }

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isSponsored() {
        return _sponsored;
    }

    public long getCreated() {
        return _created;
    }

    public long getFreeUntil() {
        return _freeUntil;
    }

    @Nullable
    public String getGitEmail() {
        return _gitEmail;
    }

    @JsonIgnore
    public boolean hasOwner() {
        return _ownerId != null && !_ownerId.isEmpty();
    }

    /** True when the app has no owner and is not sponsored. */
    @JsonIgnore
    public boolean isUnowned() {
        return !hasOwner() && !_sponsored;
    }

    public AppInfo withOwner(OwnerType ownerType, String ownerId) {
        return new AppInfo(_id, _name, _publisher, checkNotNull(ownerType, "ownerType"), checkNotNull(ownerId, "ownerId"),
                _sponsored, _created, _freeUntil, _gitEmail);
    }

    public AppInfo withoutOwner() {
        return new AppInfo(_id, _name, _publisher, null, null, _sponsored, _created, _freeUntil, _gitEmail);
    }

    public AppInfo withName(String name) {
        return new AppInfo(_id, name, _publisher, _ownerType, _ownerId, _sponsored, _created, _freeUntil, _gitEmail);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AppInfo)) {
            return false;
        }
        AppInfo that = (AppInfo) o;
        return _sponsored == that._sponsored &&
                _created == that._created &&
                _freeUntil == that._freeUntil &&
                _id.equals(that._id) &&
                _name.equals(that._name) &&
                _publisher.equals(that._publisher) &&
                _ownerType == that._ownerType &&
                Objects.equal(_ownerId, that._ownerId) &&
                Objects.equal(_gitEmail, that._gitEmail);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_id, _publisher, _ownerId, _freeUntil);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", _id)
                .add("publisher", _publisher)
                .add("ownerType", _ownerType)
                .add("ownerId", _ownerId)
                .add("sponsored", _sponsored)
                .add("freeUntil", _freeUntil)
                .toString();
    }
}
