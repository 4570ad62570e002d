package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nullable;

/**
 * Organization subscription plans.  {@link #UNLIMITED} skips all per-user checks and {@link #PAY_AS_YOU_GO} is
 * the only metered plan.
 */
public enum SubscriptionTier {
    FREE("free"),
    SMALL("small"),
    MEDIUM("medium"),
    LARGE("large"),
    UNLIMITED("unlimited"),
    PAY_AS_YOU_GO("payAsYouGo");

    private final String _value;

    SubscriptionTier(String value) {
        _value = value;
    }

    @JsonValue
    public String getValue() {
        return _value;
    }

    @JsonCreator
    @Nullable
    public static SubscriptionTier fromValue(@Nullable String value) {
        for (SubscriptionTier tier : values()) {
            if (tier._value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        return null;
    }
}
