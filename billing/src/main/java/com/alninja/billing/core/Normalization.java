package com.alninja.billing.core;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Locale;

/**
 * Identifier and email comparison rules.  Apps, publishers, emails and domains are all matched without regard to
 * case or surrounding whitespace.
 */
public abstract class Normalization {

    /** Lower-cases and trims.  Null normalizes to the empty string. */
    public static String normalize(@Nullable String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }

    public static boolean matches(@Nullable String a, @Nullable String b) {
        return normalize(a).equals(normalize(b));
    }

    /** True if any element of {@code values} matches {@code value} after normalization. */
    public static boolean containsNormalized(Collection<String> values, @Nullable String value) {
        String normalized = normalize(value);
        for (String candidate : values) {
            if (normalize(candidate).equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the normalized text following the first {@code @} of an email address, or the empty string when there
     * is none.
     */
    public static String domain(@Nullable String email) {
        if (email == null) {
            return "";
        }
        int at = email.indexOf('@');
        if (at < 0) {
            return "";
        }
        int end = email.indexOf('@', at + 1);
        return normalize(end < 0 ? email.substring(at + 1) : email.substring(at + 1, end));
    }

    public static boolean isBlank(@Nullable String value) {
        return normalize(value).isEmpty();
    }
}
