package com.alninja.billing.claim;

import com.alninja.billing.api.Organization;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An organization entitled to claim an app, and how the requesting user qualified it.
 */
public final class ClaimCandidate {

    public enum MatchType {
        /** The user's email is on the organization's users list. */
        USER,
        /** The user's email domain is one of the organization's domains. */
        DOMAIN
    }

    private final Organization _organization;
    private final MatchType _matchType;

    public ClaimCandidate(Organization organization, MatchType matchType) {
        _organization = checkNotNull(organization, "organization");
        _matchType = checkNotNull(matchType, "matchType");
    }

    public Organization getOrganization() {
        return _organization;
    }

    public MatchType getMatchType() {
        return _matchType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClaimCandidate)) {
            return false;
        }
        ClaimCandidate that = (ClaimCandidate) o;
        return _organization.equals(that._organization) && _matchType == that._matchType;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_organization, _matchType);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("organization", _organization.getId())
                .add("matchType", _matchType)
                .toString();
    }
}
