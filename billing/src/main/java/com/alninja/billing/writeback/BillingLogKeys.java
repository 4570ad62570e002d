package com.alninja.billing.writeback;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Keys of the pay-as-you-go billing log and of the meter events derived from it.
 * <p>
 * The log is an object keyed by UTC month ({@code yyyy-MM}); each month holds {@code apps} keyed by
 * {@code id|publisher} and {@code users} keyed by normalized email, each entry carrying its {@code firstSeen}
 * timestamp and a {@code count}.
 */
public abstract class BillingLogKeys {
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    public static String monthKey(long epochMillis) {
        return MONTH.format(Instant.ofEpochMilli(epochMillis));
    }

    public static String appKey(String appId, String publisher) {
        return appId + "|" + publisher;
    }

    public static String appEventIdentifier(String organizationId, String month, String appKey) {
        return organizationId + "_" + month + "_app_" + appKey;
    }

    public static String userEventIdentifier(String organizationId, String month, String email) {
        return organizationId + "_" + month + "_user_" + email;
    }
}
