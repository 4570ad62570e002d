package com.alninja.billing.pipeline;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.api.AppInfo;
import com.alninja.billing.api.DunningEntry;
import com.alninja.billing.api.Organization;
import com.alninja.billing.api.OwnerType;
import com.alninja.billing.api.UserProfile;
import com.alninja.billing.cache.EntityCache;
import com.google.common.base.Strings;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Binds the requested app and its owner.  An unknown app whose id is a GUID is registered as a new unowned app with
 * a fresh grace period; an owner that no longer exists is dropped from the app.
 */
public class BindingStage {
    private static final Logger _log = LoggerFactory.getLogger(BindingStage.class);

    private static final Pattern GUID = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private final EntityCache _cache;
    private final long _gracePeriodMillis;
    private final Clock _clock;

    @Inject
    public BindingStage(EntityCache cache, BillingConfiguration configuration, Clock clock) {
        this(cache, Duration.ofMillis(configuration.getGracePeriod().toMilliseconds()), clock);
    }

    public BindingStage(EntityCache cache, Duration gracePeriod, Clock clock) {
        _cache = checkNotNull(cache, "cache");
        _gracePeriodMillis = gracePeriod.toMillis();
        _clock = checkNotNull(clock, "clock");
    }

    public void apply(NinjaHeaders headers, BillingContext context) {
        bindApp(headers, context);
        bindOwnership(context);
    }

    private void bindApp(NinjaHeaders headers, BillingContext context) {
        String appId = headers.getAppId();
        if (appId == null) {
            return;
        }
        AppInfo existing = _cache.getApp(appId, headers.getAppPublisher());
        if (existing != null) {
            context.bindApp(existing);
            return;
        }
        if (!GUID.matcher(appId).matches()) {
            return;
        }
        long now = _clock.millis();
        context.bindNewOrphan(AppInfo.orphan(appId.toLowerCase(Locale.ROOT),
                Strings.nullToEmpty(headers.getAppName()), Strings.nullToEmpty(headers.getAppPublisher()),
                now, now + _gracePeriodMillis));
    }

    private void bindOwnership(BillingContext context) {
        AppInfo app = context.getApp();
        if (app == null || app.isSponsored() || !app.hasOwner()) {
            return;
        }
        if (app.getOwnerType() == OwnerType.USER) {
            UserProfile user = _cache.getUser(app.getOwnerId());
            if (user != null) {
                context.bindUser(user);
            } else {
                _log.info("Owner {} of app {} no longer exists, orphaning the app", app.getOwnerId(), app.getId());
                context.forceOrphan();
            }
        } else if (app.getOwnerType() == OwnerType.ORGANIZATION) {
            Organization organization = _cache.getOrganization(app.getOwnerId());
            if (organization != null) {
                context.bindOrganization(organization);
                DunningEntry dunning = _cache.getDunningEntry(organization.getId());
                if (dunning != null) {
                    context.bindDunning(dunning);
                }
            } else {
                _log.info("Organization {} owning app {} no longer exists, orphaning the app", app.getOwnerId(), app.getId());
                context.forceOrphan();
            }
        }
    }
}
