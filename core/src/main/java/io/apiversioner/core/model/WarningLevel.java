package io.apiversioner.core.model;

import java.util.Locale;

/** Severity of a deprecation warning; CRITICAL maps to warn-code 199, the others to 299. */
public enum WarningLevel {
    INFO,
    WARNING,
    CRITICAL;

    /** Parses a level name case-insensitively. */
    public static WarningLevel fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown warning level '" + value + "', expected one of info, warning, critical", e);
        }
    }
}
