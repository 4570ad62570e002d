package com.alninja.billing.pipeline;

import com.alninja.billing.api.AppIdRequiredException;
import com.alninja.billing.api.PermissionDeniedException;
import com.alninja.billing.api.PermissionResult;
import com.alninja.billing.permission.PermissionResolver;
import com.google.inject.Inject;

import java.time.Clock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Resolves and enforces permission for endpoints that require security.
 */
public class PermissionStage {
    private final PermissionResolver _resolver;
    private final Clock _clock;

    @Inject
    public PermissionStage(PermissionResolver resolver, Clock clock) {
        _resolver = checkNotNull(resolver, "resolver");
        _clock = checkNotNull(clock, "clock");
    }

    /**
     * @throws AppIdRequiredException if the request does not name an app
     */
    public void apply(NinjaHeaders headers, BillingContext context) {
        if (headers.getAppId() == null) {
            throw new AppIdRequiredException();
        }
        context.decide(_resolver.resolve(context.getApp(), context.getUser(), context.getOrganization(),
                context.getBlocked(), headers.getGitUserEmail(), _clock.millis()));
    }

    /**
     * @throws PermissionDeniedException if the recorded verdict is a denial
     */
    public void enforce(BillingContext context) {
        PermissionResult permission = context.getPermission();
        if (permission != null && !permission.isAllowed()) {
            throw new PermissionDeniedException(permission.getError());
        }
    }
}
