package io.apiversioner.core.model;

import java.util.Locale;

/** Grammar a version string is parsed against. All versions of one deployment share a format. */
public enum VersionFormat {
    /** {@code major[.minor[.patch]][-label]}, e.g. {@code 1.2.3-rc.1}. */
    SEMANTIC,
    /** {@code major[.minor]}, e.g. {@code 2.1}. */
    SIMPLE,
    /** ISO-8601 calendar date {@code yyyy-MM-dd}, e.g. {@code 2024-03-15}. */
    DATE;

    /**
     * Parses a format name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static VersionFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("version format must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown version format '" + value + "', expected one of semantic, simple, date", e);
        }
    }
}
