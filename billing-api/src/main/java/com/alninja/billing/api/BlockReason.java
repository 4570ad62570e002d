package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nullable;

public enum BlockReason {
    FLAGGED("flagged", ErrorCode.ORG_FLAGGED),
    SUBSCRIPTION_CANCELLED("subscription_cancelled", ErrorCode.SUBSCRIPTION_CANCELLED),
    PAYMENT_FAILED("payment_failed", ErrorCode.PAYMENT_FAILED),
    NO_SUBSCRIPTION("no_subscription", ErrorCode.NO_SUBSCRIPTION);

    private final String _value;
    private final ErrorCode _errorCode;

    BlockReason(String value, ErrorCode errorCode) {
        _value = value;
        _errorCode = errorCode;
    }

    @JsonValue
    public String getValue() {
        return _value;
    }

    /** The denial reported to clients of a blocked organization. */
    public ErrorCode getErrorCode() {
        return _errorCode;
    }

    @JsonCreator
    @Nullable
    public static BlockReason fromValue(@Nullable String value) {
        for (BlockReason reason : values()) {
            if (reason._value.equalsIgnoreCase(value)) {
                return reason;
            }
        }
        return null;
    }
}
