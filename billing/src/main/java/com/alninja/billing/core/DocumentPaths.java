package com.alninja.billing.core;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Locations of the documents the billing core reads and writes.
 */
public abstract class DocumentPaths {
    public static final String APPS = "system/apps.json";
    public static final String USERS = "system/users.json";
    public static final String ORGANIZATIONS = "system/organizations.json";
    public static final String BLOCKED = "system/blocked.json";
    public static final String DUNNING = "system/dunning.json";
    public static final String UNHANDLED_ERRORS = "system/unhandledErrors.json";

    public static String featureLog(String organizationId) {
        return log(organizationId, "featureLog");
    }

    public static String unknownUserLog(String organizationId) {
        return log(organizationId, "unknown");
    }

    public static String billingLog(String organizationId) {
        return log(organizationId, "billingLog");
    }

    private static String log(String organizationId, String suffix) {
        checkArgument(organizationId != null && !organizationId.isEmpty() && organizationId.indexOf('/') < 0,
                "Invalid organization id: %s", organizationId);
        return "logs/" + organizationId + "_" + suffix + ".json";
    }
}
