package com.alninja.billing.cache;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.api.AppInfo;
import com.alninja.billing.api.BlockedOrganization;
import com.alninja.billing.api.BlockedOrganizations;
import com.alninja.billing.api.DunningEntry;
import com.alninja.billing.api.Organization;
import com.alninja.billing.api.UserProfile;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.common.base.Throwables;
import com.google.common.base.Ticker;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static com.alninja.billing.core.Normalization.matches;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Read-through cache of the apps, users, organizations, blocked and dunning collections.
 * <p>
 * Each {@link EntityKind} occupies one slot holding a snapshot of the whole collection.  A missing or expired slot is
 * reloaded in bulk from the {@link EntitySource}; concurrent callers asking for the same kind share a single load and
 * all receive its result.  A load that fails leaves the slot empty and the failure is rethrown to every waiter.
 * <p>
 * {@link #updateApp(AppInfo)} and {@link #updateOrganization(Organization)} patch the current snapshot in place
 * after a successful writeback.  Patching does not reset the slot's age, and a patch to an empty slot is dropped
 * since the next load will see the written document anyway.
 */
public class EntityCache {
    private static final Logger _log = LoggerFactory.getLogger(EntityCache.class);

    private final EntitySource _source;
    private final LoadingCache<EntityKind, Snapshot<?>> _slots;
    private final Map<EntityKind, Timer> _loadTimers = new EnumMap<>(EntityKind.class);
    private final Map<EntityKind, Meter> _loadFailures = new EnumMap<>(EntityKind.class);

    @Inject
    public EntityCache(EntitySource source, BillingConfiguration configuration, MetricRegistry metricRegistry, Clock clock) {
        this(source, Duration.ofMillis(configuration.getCacheTtl().toMilliseconds()), metricRegistry, clock);
    }

    public EntityCache(EntitySource source, Duration ttl, MetricRegistry metricRegistry, Clock clock) {
        _source = checkNotNull(source, "source");
        checkNotNull(clock, "clock");
        checkArgument(!ttl.isNegative() && !ttl.isZero(), "Cache TTL must be positive");

        for (EntityKind kind : EntityKind.values()) {
            String name = kind.name().toLowerCase(Locale.ROOT);
            _loadTimers.put(kind, metricRegistry.timer(MetricRegistry.name("alninja.billing", "EntityCache", name, "load")));
            _loadFailures.put(kind, metricRegistry.meter(MetricRegistry.name("alninja.billing", "EntityCache", name, "load-failures")));
        }

        Ticker ticker = new Ticker() {
            @Override
            public long read() {
                return TimeUnit.MILLISECONDS.toNanos(clock.millis());
            }
        };

        _slots = CacheBuilder.newBuilder()
                .expireAfterWrite(ttl.toMillis(), TimeUnit.MILLISECONDS)
                .ticker(ticker)
                .build(new CacheLoader<EntityKind, Snapshot<?>>() {
                    @Override
                    public Snapshot<?> load(EntityKind kind) throws Exception {
                        return loadSnapshot(kind);
                    }
                });
    }

    private Snapshot<?> loadSnapshot(EntityKind kind) {
        try (Timer.Context ignore = _loadTimers.get(kind).time()) {
            switch (kind) {
                case APPS:
                    return new Snapshot<>(ImmutableList.copyOf(_source.loadApps()));
                case USERS:
                    return new Snapshot<>(ImmutableList.copyOf(_source.loadUsers()));
                case ORGANIZATIONS:
                    return new Snapshot<>(ImmutableList.copyOf(_source.loadOrganizations()));
                case BLOCKED:
                    return new Snapshot<>(checkNotNull(_source.loadBlocked(), "blocked"));
                case DUNNING:
                    return new Snapshot<>(ImmutableList.copyOf(_source.loadDunning()));
                default:
                    throw new UnsupportedOperationException(kind.name());
            }
        } catch (RuntimeException e) {
            _loadFailures.get(kind).mark();
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    private <T> Snapshot<T> slot(EntityKind kind) {
        try {
            return (Snapshot<T>) _slots.getUnchecked(kind);
        } catch (UncheckedExecutionException e) {
            // Rethrow the loader's own exception so callers see the storage failure rather than the cache wrapper.
            Throwables.throwIfUnchecked(e.getCause());
            throw e;
        }
    }

    private List<AppInfo> apps() {
        return this.<List<AppInfo>>slot(EntityKind.APPS).get();
    }

    private List<UserProfile> users() {
        return this.<List<UserProfile>>slot(EntityKind.USERS).get();
    }

    private List<Organization> organizations() {
        return this.<List<Organization>>slot(EntityKind.ORGANIZATIONS).get();
    }

    /**
     * Finds an app by id and publisher, both compared normalized.  A null publisher matches apps with an empty one.
     */
    @Nullable
    public AppInfo getApp(String appId, @Nullable String publisher) {
        return find(apps(), app -> matches(app.getId(), appId) && matches(app.getPublisher(), publisher));
    }

    /**
     * Returns the first app matching each requested id regardless of publisher, keyed by the id as requested.
     * Ids with no match are absent from the result.
     */
    public Map<String, AppInfo> getApps(Collection<String> appIds) {
        List<AppInfo> apps = apps();
        Map<String, AppInfo> result = Maps.newLinkedHashMap();
        for (String appId : appIds) {
            AppInfo app = find(apps, candidate -> matches(candidate.getId(), appId));
            if (app != null) {
                result.put(appId, app);
            }
        }
        return result;
    }

    @Nullable
    public UserProfile getUser(String userId) {
        return find(users(), user -> matches(user.getId(), userId));
    }

    @Nullable
    public Organization getOrganization(String organizationId) {
        return find(organizations(), organization -> matches(organization.getId(), organizationId));
    }

    public List<Organization> getOrganizations() {
        return organizations();
    }

    @Nullable
    public BlockedOrganization getBlockedStatus(String organizationId) {
        BlockedOrganizations blocked = this.<BlockedOrganizations>slot(EntityKind.BLOCKED).get();
        BlockedOrganization exact = blocked.get(organizationId);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, BlockedOrganization> entry : blocked.getOrgs().entrySet()) {
            if (matches(entry.getKey(), organizationId)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Returns the dunning entry of an organization, or null if it is not in dunning.  Dunning is advisory, so a
     * failure to load the dunning collection is logged and reported as "not in dunning" without caching that answer.
     */
    @Nullable
    public DunningEntry getDunningEntry(String organizationId) {
        List<DunningEntry> entries;
        try {
            entries = this.<List<DunningEntry>>slot(EntityKind.DUNNING).get();
        } catch (RuntimeException e) {
            _log.warn("Unable to load dunning status, assuming organization {} is in good standing", organizationId, e);
            return null;
        }
        return find(entries, entry -> matches(entry.getOrganizationId(), organizationId));
    }

    /**
     * Replaces the cached app with the same id and publisher, or appends it if there is none.
     */
    public void updateApp(AppInfo app) {
        checkNotNull(app, "app");
        Snapshot<List<AppInfo>> snapshot = present(EntityKind.APPS);
        if (snapshot != null) {
            snapshot.update(apps -> replaceOrAppend(apps, app,
                    existing -> matches(existing.getId(), app.getId()) && matches(existing.getPublisher(), app.getPublisher())));
        }
    }

    /**
     * Replaces the cached organization with the same id, or appends it if there is none.
     */
    public void updateOrganization(Organization organization) {
        checkNotNull(organization, "organization");
        Snapshot<List<Organization>> snapshot = present(EntityKind.ORGANIZATIONS);
        if (snapshot != null) {
            snapshot.update(organizations -> replaceOrAppend(organizations, organization,
                    existing -> matches(existing.getId(), organization.getId())));
        }
    }

    public void invalidate(EntityKind kind) {
        _slots.invalidate(checkNotNull(kind, "kind"));
    }

    public void invalidateAll() {
        _slots.invalidateAll();
    }

    @SuppressWarnings("unchecked")
    @Nullable
    private <T> Snapshot<T> present(EntityKind kind) {
        return (Snapshot<T>) _slots.getIfPresent(kind);
    }

    @Nullable
    private static <T> T find(List<T> values, Predicate<T> predicate) {
        for (T value : values) {
            if (predicate.test(value)) {
                return value;
            }
        }
        return null;
    }

    private static <T> List<T> replaceOrAppend(List<T> values, T replacement, Predicate<T> sameKey) {
        ImmutableList.Builder<T> builder = ImmutableList.builder();
        boolean replaced = false;
        for (T value : values) {
            if (!replaced && sameKey.test(value)) {
                builder.add(replacement);
                replaced = true;
            } else {
                builder.add(value);
            }
        }
        if (!replaced) {
            builder.add(replacement);
        }
        return builder.build();
    }

    /** One loaded collection.  The reference is swapped on update so readers always see an immutable value. */
    private static final class Snapshot<T> {
        private final AtomicReference<T> _value;

        Snapshot(T value) {
            _value = new AtomicReference<>(value);
        }

        T get() {
            return _value.get();
        }

        void update(UnaryOperator<T> patch) {
            _value.updateAndGet(patch);
        }
    }
}
