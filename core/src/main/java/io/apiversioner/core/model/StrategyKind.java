package io.apiversioner.core.model;

import java.util.Locale;

/** The request facet a version strategy inspects. */
public enum StrategyKind {
    URL_PATH,
    HEADER,
    QUERY_PARAMETER,
    ACCEPT_HEADER,
    COMPOSITE;

    /** Parses the kebab-case config name, e.g. {@code query-parameter}. */
    public static StrategyKind fromString(String value) {
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown strategy kind '" + value + "'", e);
        }
    }

    /** The kebab-case name used in configuration and discovery. */
    public String configName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
