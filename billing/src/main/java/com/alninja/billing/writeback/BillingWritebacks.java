package com.alninja.billing.writeback;

import com.alninja.billing.api.AppInfo;
import com.alninja.billing.api.Organization;
import com.alninja.billing.cache.EntityCache;
import com.alninja.billing.common.json.JsonHelper;
import com.alninja.billing.core.DocumentPaths;
import com.alninja.billing.docstore.core.OptimisticDocumentUpdater;
import com.alninja.billing.metering.MeterEventSender;
import com.alninja.billing.metering.MeterEventType;
import com.alninja.billing.permission.UserUpdate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static com.alninja.billing.core.Normalization.matches;
import static com.alninja.billing.core.Normalization.normalize;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Persists billing decisions to the stored documents.
 * <p>
 * Every write is a compare-and-swap of a whole document whose transform depends only on the document it is given,
 * so concurrent writers converge.  Transforms edit the stored JSON directly, leaving fields this service does not know
 * about untouched.  After apps or organizations are written the cached copy is patched to match.
 */
public class BillingWritebacks {
    private final OptimisticDocumentUpdater _updater;
    private final EntityCache _cache;
    private final MeterEventSender _meterEvents;
    private final Clock _clock;

    @Inject
    public BillingWritebacks(OptimisticDocumentUpdater updater, EntityCache cache, MeterEventSender meterEvents, Clock clock) {
        _updater = checkNotNull(updater, "updater");
        _cache = checkNotNull(cache, "cache");
        _meterEvents = checkNotNull(meterEvents, "meterEvents");
        _clock = checkNotNull(clock, "clock");
    }

    /**
     * Stores a newly seen app unless another request stored the same id and publisher first.
     */
    public void writeBackNewOrphan(AppInfo app) {
        JsonNode entry = JsonHelper.toTree(app);
        _updater.update(DocumentPaths.APPS, JsonHelper.newArray(), node -> {
            ArrayNode apps = asArray(node);
            if (indexOfApp(apps, app) < 0) {
                apps.add(entry.deepCopy());
            }
            return apps;
        });
        _cache.updateApp(app);
    }

    /**
     * Records the organization that claimed an app.  An organization that does not want app names stored gets the
     * name cleared; otherwise a stored name is kept and a newly stored app takes the requested name.
     */
    public void writeBackClaimedApp(AppInfo app, Organization organization) {
        boolean clearName = organization.isDoNotStoreAppNames();
        AppInfo effective = clearName ? app.withName("") : app;
        JsonNode entry = JsonHelper.toTree(effective);

        _updater.update(DocumentPaths.APPS, JsonHelper.newArray(), node -> {
            ArrayNode apps = asArray(node);
            int index = indexOfApp(apps, app);
            if (index < 0) {
                apps.add(entry.deepCopy());
                return apps;
            }
            ObjectNode existing = (ObjectNode) apps.get(index);
            existing.put("ownerType", app.getOwnerType() != null ? app.getOwnerType().getValue() : null);
            existing.put("ownerId", app.getOwnerId());
            if (clearName) {
                existing.put("name", "");
            }
            return apps;
        });
        _cache.updateApp(effective);
    }

    /**
     * Removes the owner of a stored app whose owner no longer exists.
     */
    public void writeBackForceOrphanedApp(AppInfo app) {
        _updater.update(DocumentPaths.APPS, JsonHelper.newArray(), node -> {
            ArrayNode apps = asArray(node);
            int index = indexOfApp(apps, app);
            if (index >= 0) {
                ((ObjectNode) apps.get(index)).remove("ownerType");
                ((ObjectNode) apps.get(index)).remove("ownerId");
            }
            return apps;
        });
        _cache.updateApp(app);
    }

    /**
     * Applies a user classification to an organization's lists.  Emails are added as sent, but only if no
     * equivalent email is already present.
     */
    public void writeBackUserUpdate(String organizationId, String gitEmail, UserUpdate update) {
        checkNotNull(update, "update");
        String emailNorm = normalize(gitEmail);
        long now = _clock.millis();

        JsonNode committed = _updater.update(DocumentPaths.ORGANIZATIONS, JsonHelper.newArray(), node -> {
            ArrayNode organizations = asArray(node);
            ObjectNode organization = findOrganization(organizations, organizationId);
            if (organization == null) {
                return organizations;
            }
            switch (update) {
                case ALLOW:
                    addIfAbsent(arrayField(organization, "users"), gitEmail);
                    removeMatching(arrayField(organization, "deniedUsers"), emailNorm);
                    break;
                case DENY:
                    addIfAbsent(arrayField(organization, "deniedUsers"), gitEmail);
                    break;
                case UNKNOWN:
                    ObjectNode firstSeen = objectField(organization, "userFirstSeenTimestamp");
                    if (!firstSeen.has(emailNorm)) {
                        firstSeen.put(emailNorm, now);
                    }
                    break;
                default:
                    throw new UnsupportedOperationException(update.name());
            }
            return organizations;
        });

        ObjectNode updated = findOrganization(asArray(committed), organizationId);
        if (updated != null) {
            _cache.updateOrganization(JsonHelper.convert(updated, Organization.class));
        }
    }

    /**
     * Records when a member of an organization was first seen, if that was not recorded already.
     */
    public void updateFirstSeenTimestamp(String organizationId, String gitEmail) {
        String emailNorm = normalize(gitEmail);
        long now = _clock.millis();
        _updater.update(DocumentPaths.ORGANIZATIONS, JsonHelper.newArray(), node -> {
            ArrayNode organizations = asArray(node);
            ObjectNode organization = findOrganization(organizations, organizationId);
            if (organization != null) {
                JsonNode existing = organization.get("userFirstSeenTimestamp");
                if (existing == null || !existing.has(emailNorm)) {
                    objectField(organization, "userFirstSeenTimestamp").put(emailNorm, now);
                }
            }
            return organizations;
        });
    }

    public void logUnknownUser(String organizationId, String gitEmail, String appId) {
        _updater.append(DocumentPaths.unknownUserLog(organizationId),
                new UnknownUserAttempt(_clock.millis(), normalize(gitEmail), appId));
    }

    public void logActivity(String organizationId, String appId, String gitEmail, String feature) {
        _updater.append(DocumentPaths.featureLog(organizationId),
                new FeatureLogEntry(appId, _clock.millis(), gitEmail, feature));
    }

    /**
     * Counts a pay-as-you-go use in the current month's billing log and reports apps and users seen for the first
     * time this month as meter events.
     */
    public void updateBillingLog(String organizationId, String appId, String publisher, String gitEmail, String customerId) {
        long now = _clock.millis();
        String month = BillingLogKeys.monthKey(now);
        String appKey = BillingLogKeys.appKey(appId, publisher);
        String emailNorm = normalize(gitEmail);
        // Set by whichever attempt commits.
        boolean[] firstUse = new boolean[2];

        _updater.update(DocumentPaths.billingLog(organizationId), JsonHelper.newObject(), node -> {
            ObjectNode log = node.isObject() ? (ObjectNode) node : JsonHelper.newObject();
            ObjectNode monthEntry = objectField(log, month);

            ObjectNode apps = objectField(monthEntry, "apps");
            firstUse[0] = count(apps, appKey, now, entry -> entry.put("id", appId).put("publisher", publisher));

            ObjectNode users = objectField(monthEntry, "users");
            firstUse[1] = count(users, emailNorm, now, entry -> entry.put("email", gitEmail));
            return log;
        });

        if (firstUse[0]) {
            _meterEvents.send(MeterEventType.PAY_AS_YOU_GO_APP, customerId,
                    BillingLogKeys.appEventIdentifier(organizationId, month, appKey));
        }
        if (firstUse[1]) {
            _meterEvents.send(MeterEventType.PAY_AS_YOU_GO_USER, customerId,
                    BillingLogKeys.userEventIdentifier(organizationId, month, emailNorm));
        }
    }

    /** Increments the entry's count, creating it if needed.  Returns true if the entry was created. */
    private static boolean count(ObjectNode entries, String key, long now, Consumer<ObjectNode> identity) {
        JsonNode existing = entries.get(key);
        if (existing != null && existing.isObject()) {
            ((ObjectNode) existing).put("count", existing.path("count").asLong() + 1);
            return false;
        }
        ObjectNode entry = JsonHelper.newObject();
        identity.accept(entry);
        entry.put("firstSeen", now);
        entry.put("count", 1);
        entries.set(key, entry);
        return true;
    }

    private static ArrayNode asArray(JsonNode node) {
        return node.isArray() ? (ArrayNode) node : JsonHelper.newArray();
    }

    private static int indexOfApp(ArrayNode apps, AppInfo app) {
        return indexOf(apps, entry ->
                matches(entry.path("id").asText(null), app.getId()) &&
                matches(entry.path("publisher").asText(null), app.getPublisher()));
    }

    @Nullable
    private static ObjectNode findOrganization(ArrayNode organizations, String organizationId) {
        int index = indexOf(organizations, entry -> organizationId.equals(entry.path("id").asText(null)));
        return index >= 0 ? (ObjectNode) organizations.get(index) : null;
    }

    private static int indexOf(ArrayNode array, Predicate<JsonNode> predicate) {
        for (int i = 0; i < array.size(); i++) {
            JsonNode entry = array.get(i);
            if (entry.isObject() && predicate.test(entry)) {
                return i;
            }
        }
        return -1;
    }

    private static ArrayNode arrayField(ObjectNode parent, String field) {
        JsonNode value = parent.get(field);
        if (value != null && value.isArray()) {
            return (ArrayNode) value;
        }
        return parent.putArray(field);
    }

    private static ObjectNode objectField(ObjectNode parent, String field) {
        JsonNode value = parent.get(field);
        if (value != null && value.isObject()) {
            return (ObjectNode) value;
        }
        return parent.putObject(field);
    }

    private static void addIfAbsent(ArrayNode values, String value) {
        String normalized = normalize(value);
        for (JsonNode existing : values) {
            if (normalize(existing.asText(null)).equals(normalized)) {
                return;
            }
        }
        values.add(value);
    }

    private static void removeMatching(ArrayNode values, String normalized) {
        for (int i = values.size() - 1; i >= 0; i--) {
            if (normalize(values.get(i).asText(null)).equals(normalized)) {
                values.remove(i);
            }
        }
    }
}
