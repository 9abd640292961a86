package io.apiversioner.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Case-insensitive, immutable request header multimap.
 *
 * <p>
 * A core-owned port type with no framework dependency. Header names are normalized to
 * <strong>lowercase</strong> per RFC 9110 §5.1; lookups ignore case. Values keep their arrival
 * order.
 */
public final class RequestHeaders {

    private static final RequestHeaders EMPTY = new RequestHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    private final TreeMap<String, List<String>> store;

    private RequestHeaders(TreeMap<String, List<String>> store) {
        this.store = store;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        List<String> values = store.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /**
     * All values for a header name (case-insensitive).
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = store.get(name);
        return values != null ? values : List.of();
    }

    /** True if the header exists (case-insensitive). */
    public boolean contains(String name) {
        return store.containsKey(name);
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** All-values-per-name view with lowercase keys. */
    public Map<String, List<String>> toMultiValueMap() {
        return Collections.unmodifiableMap(new TreeMap<>(store));
    }

    // ── Factory methods ──

    /**
     * Creates headers from a single-value map. Keys are normalized to lowercase.
     *
     * @param singleValue header name → single value
     */
    public static RequestHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        singleValue.forEach((key, value) -> {
            if (value != null) {
                map.put(key.toLowerCase(), List.of(value));
            }
        });
        return new RequestHeaders(map);
    }

    /**
     * Creates headers from a multi-value map. Keys are normalized to lowercase; names that
     * differ only in case are merged in iteration order.
     *
     * @param multiValue header name → list of values
     */
    public static RequestHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        multiValue.forEach((key, values) -> {
            if (values == null || values.isEmpty()) {
                return;
            }
            map.merge(key.toLowerCase(), List.copyOf(values), (a, b) -> {
                List<String> merged = new ArrayList<>(a);
                merged.addAll(b);
                return List.copyOf(merged);
            });
        });
        return new RequestHeaders(map);
    }

    public static RequestHeaders empty() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestHeaders that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "RequestHeaders" + store.keySet();
    }
}
