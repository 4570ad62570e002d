package com.alninja.billing.permission;

import com.alninja.billing.api.Organization;

import javax.annotation.Nullable;

import static com.alninja.billing.core.Normalization.containsNormalized;
import static com.alninja.billing.core.Normalization.domain;
import static com.alninja.billing.core.Normalization.normalize;

/**
 * Classifies an email against an organization's allow list, deny list and domain rules, checked in that order.
 * An email on both lists is therefore allowed.
 */
public class UserPermissionResolver {

    public UserPermission getUserPermission(Organization organization, @Nullable String email) {
        String normalizedEmail = normalize(email);
        if (normalizedEmail.isEmpty()) {
            return UserPermission.UNKNOWN;
        }
        if (containsNormalized(organization.getUsers(), normalizedEmail)) {
            return UserPermission.ALLOWED;
        }
        if (containsNormalized(organization.getDeniedUsers(), normalizedEmail)) {
            return UserPermission.DENIED;
        }

        String emailDomain = domain(email);
        if (!emailDomain.isEmpty()) {
            if (containsNormalized(organization.getDomains(), emailDomain)) {
                return UserPermission.ALLOWED_BY_DOMAIN;
            }
            if (containsNormalized(organization.getPendingDomains(), emailDomain)) {
                return UserPermission.ALLOWED_BY_PENDING_DOMAIN;
            }
        }
        if (organization.isDenyUnknownDomains()) {
            return UserPermission.DENIED_BY_UNKNOWN_DOMAIN;
        }
        return UserPermission.UNKNOWN;
    }
}
