package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nullable;

public enum OwnerType {
    USER("user"),
    ORGANIZATION("organization");

    private final String _value;

    OwnerType(String value) {
        _value = value;
    }

    @JsonValue
    public String getValue() {
        return _value;
    }

    /** Returns null for values this version does not recognize. */
    @JsonCreator
    @Nullable
    public static OwnerType fromValue(@Nullable String value) {
        for (OwnerType type : values()) {
            if (type._value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
