package io.apiversioner.core.engine;

import io.apiversioner.core.model.Version;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Direct fallback relation between versions: each key maps to an ordered list of versions that
 * may serve it, most preferred first. Lookups never chain through entries, so
 * {@code 3.0 → [2.0]} and {@code 2.0 → [1.0]} do not make {@code 1.0} a fallback of {@code 3.0}.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class CompatibilityMatrix {

    private static final CompatibilityMatrix EMPTY = new CompatibilityMatrix(Map.of());

    private final Map<Version, List<Version>> entries;

    private CompatibilityMatrix(Map<Version, List<Version>> entries) {
        this.entries = entries;
    }

    public static CompatibilityMatrix empty() {
        return EMPTY;
    }

    /**
     * Creates a matrix from direct entries.
     *
     * @throws IllegalArgumentException if an entry lists its own key, or versions of more than one
     *                                  format are present
     */
    public static CompatibilityMatrix of(Map<Version, List<Version>> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        Map<Version, List<Version>> copy = new LinkedHashMap<>();
        Version first = null;
        for (Map.Entry<Version, List<Version>> entry : entries.entrySet()) {
            Version key = entry.getKey();
            if (first == null) {
                first = key;
            }
            for (Version fallback : entry.getValue()) {
                if (fallback.equals(key)) {
                    throw new IllegalArgumentException("compatibility entry " + key + " lists itself as a fallback");
                }
                if (fallback.format() != first.format()) {
                    throw new IllegalArgumentException("compatibility matrix mixes " + first.format() + " version "
                            + first + " with " + fallback.format() + " version " + fallback);
                }
            }
            if (key.format() != first.format()) {
                throw new IllegalArgumentException("compatibility matrix mixes " + first.format() + " version " + first
                        + " with " + key.format() + " version " + key);
            }
            copy.put(key, List.copyOf(entry.getValue()));
        }
        return new CompatibilityMatrix(Collections.unmodifiableMap(copy));
    }

    /** Direct fallbacks of {@code version}, most preferred first; empty when none. */
    public List<Version> fallbacks(Version version) {
        return entries.getOrDefault(version, List.of());
    }

    /** True when {@code to} equals {@code from} or is a direct fallback of it. */
    public boolean isCompatible(Version from, Version to) {
        return from.equals(to) || fallbacks(from).contains(to);
    }

    /** Every version mentioned as a key or a fallback, ascending. */
    public SortedSet<Version> versions() {
        SortedSet<Version> all = new TreeSet<>(entries.keySet());
        entries.values().forEach(all::addAll);
        return Collections.unmodifiableSortedSet(all);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
