package io.apiversioner.core.model;

/** Result of {@link Version#compare(Version, Version)}. */
public enum VersionOrdering {
    LESS,
    EQUAL,
    GREATER;

    static VersionOrdering of(int comparison) {
        if (comparison < 0) {
            return LESS;
        }
        return comparison == 0 ? EQUAL : GREATER;
    }
}
