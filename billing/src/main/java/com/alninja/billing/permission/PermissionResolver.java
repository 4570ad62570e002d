package com.alninja.billing.permission;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.api.AppInfo;
import com.alninja.billing.api.BlockReason;
import com.alninja.billing.api.BlockedOrganization;
import com.alninja.billing.api.ErrorCode;
import com.alninja.billing.api.Organization;
import com.alninja.billing.api.OwnerType;
import com.alninja.billing.api.PermissionError;
import com.alninja.billing.api.PermissionResult;
import com.alninja.billing.api.PermissionWarning;
import com.alninja.billing.api.SubscriptionTier;
import com.alninja.billing.api.UserProfile;
import com.alninja.billing.api.WarningCode;
import com.google.inject.Inject;

import javax.annotation.Nullable;
import java.time.Duration;

import static com.alninja.billing.core.Normalization.isBlank;
import static com.alninja.billing.core.Normalization.matches;
import static com.alninja.billing.core.Normalization.normalize;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decides whether a request may use an app, based only on entities already bound to the request.
 * <p>
 * Sponsored apps are always allowed.  Apps owned by a user may only be used with one of that user's email addresses.
 * Apps owned by an organization may be used by anybody the organization accepts, with unknown users getting a grace
 * period counted from when they were first seen.  Unowned apps are free until their grace period runs out.
 * A grace period with no time remaining is expired.
 */
public class PermissionResolver {
    private final UserPermissionResolver _userPermissions;
    private final long _gracePeriodMillis;

    @Inject
    public PermissionResolver(UserPermissionResolver userPermissions, BillingConfiguration configuration) {
        this(userPermissions, Duration.ofMillis(configuration.getGracePeriod().toMilliseconds()));
    }

    public PermissionResolver(UserPermissionResolver userPermissions, Duration gracePeriod) {
        _userPermissions = checkNotNull(userPermissions, "userPermissions");
        checkArgument(!gracePeriod.isNegative(), "Grace period cannot be negative");
        _gracePeriodMillis = gracePeriod.toMillis();
    }

    public PermissionDecision resolve(@Nullable AppInfo app, @Nullable UserProfile user,
                                      @Nullable Organization organization, @Nullable BlockedOrganization blocked,
                                      @Nullable String gitEmail, long now) {
        if (app == null || app.isSponsored()) {
            return PermissionDecision.of(PermissionResult.allowed());
        }
        if (app.getOwnerType() == OwnerType.USER) {
            return PermissionDecision.of(resolvePersonal(app, user, gitEmail));
        }
        if (app.getOwnerType() == OwnerType.ORGANIZATION) {
            return resolveOrganization(organization, blocked, gitEmail, now);
        }
        if (!app.hasOwner()) {
            return PermissionDecision.of(resolveOrphan(app, now));
        }
        return PermissionDecision.of(PermissionResult.allowed());
    }

    private PermissionResult resolvePersonal(AppInfo app, @Nullable UserProfile user, @Nullable String gitEmail) {
        if (isBlank(gitEmail)) {
            return PermissionResult.denied(ErrorCode.GIT_EMAIL_REQUIRED);
        }
        if (isAuthorized(gitEmail, app.getGitEmail())
                || (user != null && (isAuthorized(gitEmail, user.getEmail()) || isAuthorized(gitEmail, user.getGitEmail())))) {
            return PermissionResult.allowed();
        }
        return PermissionResult.denied(new PermissionError(ErrorCode.USER_NOT_AUTHORIZED, gitEmail));
    }

    private static boolean isAuthorized(String gitEmail, @Nullable String authorizedEmail) {
        return !isBlank(authorizedEmail) && matches(gitEmail, authorizedEmail);
    }

    private PermissionDecision resolveOrganization(@Nullable Organization organization,
                                                   @Nullable BlockedOrganization blocked,
                                                   @Nullable String gitEmail, long now) {
        if (organization == null) {
            return PermissionDecision.of(PermissionResult.allowed());
        }
        if (blocked != null) {
            return PermissionDecision.of(PermissionResult.denied(blockedErrorCode(blocked.getReason())));
        }
        if (organization.getPlan() == SubscriptionTier.UNLIMITED) {
            return PermissionDecision.of(PermissionResult.allowed());
        }
        if (isBlank(gitEmail)) {
            return PermissionDecision.of(PermissionResult.denied(ErrorCode.GIT_EMAIL_REQUIRED));
        }

        switch (_userPermissions.getUserPermission(organization, gitEmail)) {
            case ALLOWED:
                return PermissionDecision.of(PermissionResult.allowed());
            case ALLOWED_BY_DOMAIN:
                return new PermissionDecision(PermissionResult.allowed(), UserUpdate.ALLOW, false);
            case ALLOWED_BY_PENDING_DOMAIN:
                return new PermissionDecision(PermissionResult.allowed(), UserUpdate.UNKNOWN, true);
            case DENIED:
                return PermissionDecision.of(PermissionResult.denied(
                        new PermissionError(ErrorCode.USER_NOT_AUTHORIZED, gitEmail)));
            case DENIED_BY_UNKNOWN_DOMAIN:
                return new PermissionDecision(PermissionResult.denied(
                        new PermissionError(ErrorCode.USER_NOT_AUTHORIZED, gitEmail)), UserUpdate.DENY, false);
            case UNKNOWN:
            default:
                return resolveUnknownUser(organization, gitEmail, now);
        }
    }

    private PermissionDecision resolveUnknownUser(Organization organization, String gitEmail, long now) {
        Long firstSeen = organization.getUserFirstSeenTimestamp().get(normalize(gitEmail));
        long seenAt = firstSeen != null ? firstSeen : now;
        long remaining = _gracePeriodMillis - (now - seenAt);

        if (remaining < 0) {
            return PermissionDecision.of(PermissionResult.denied(
                    new PermissionError(ErrorCode.ORG_GRACE_EXPIRED, gitEmail)));
        }

        // Every attempt by an unknown user is logged; first-seen is only recorded once.
        PermissionResult result = PermissionResult.allowed(
                new PermissionWarning(WarningCode.ORG_GRACE_PERIOD, remaining, gitEmail));
        return new PermissionDecision(result, firstSeen == null ? UserUpdate.UNKNOWN : null, true);
    }

    private static PermissionResult resolveOrphan(AppInfo app, long now) {
        long remaining = app.getFreeUntil() - now;
        if (remaining <= 0) {
            return PermissionResult.denied(ErrorCode.GRACE_EXPIRED);
        }
        return PermissionResult.allowed(new PermissionWarning(WarningCode.APP_GRACE_PERIOD, remaining, null));
    }

    /**
     * Returns the warning to attach to a successful response: the permission's own warning if it has one, otherwise
     * a grace period warning for an unowned app that is still free.
     */
    @Nullable
    public PermissionWarning getPermissionWarning(@Nullable AppInfo app, @Nullable PermissionResult permission, long now) {
        if (permission != null && permission.getWarning() != null) {
            return permission.getWarning();
        }
        if (app != null && app.isUnowned()) {
            long remaining = app.getFreeUntil() - now;
            if (remaining > 0) {
                return new PermissionWarning(WarningCode.APP_GRACE_PERIOD, remaining, null);
            }
        }
        return null;
    }

    static ErrorCode blockedErrorCode(@Nullable BlockReason reason) {
        return reason != null ? reason.getErrorCode() : ErrorCode.ORG_FLAGGED;
    }
}
