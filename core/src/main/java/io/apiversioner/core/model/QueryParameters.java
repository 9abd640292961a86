package io.apiversioner.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable query-string multimap. Parameter names are case-sensitive; values keep their order of
 * appearance. Decoding is the adapter's job: values arrive here already decoded.
 */
public final class QueryParameters {

    private static final QueryParameters EMPTY = new QueryParameters(Map.of());

    private final Map<String, List<String>> store;

    private QueryParameters(Map<String, List<String>> store) {
        this.store = store;
    }

    /** First value of the parameter, or {@code null} if absent. */
    public String first(String name) {
        List<String> values = store.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /** All values of the parameter, or an empty list. */
    public List<String> all(String name) {
        return store.getOrDefault(name, List.of());
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    public Map<String, List<String>> toMultiValueMap() {
        return store;
    }

    public static QueryParameters empty() {
        return EMPTY;
    }

    /** Creates parameters from a multi-value map; empty value lists are dropped. */
    public static QueryParameters ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        multiValue.forEach((key, values) -> {
            if (values != null && !values.isEmpty()) {
                copy.put(key, List.copyOf(values));
            }
        });
        return new QueryParameters(Collections.unmodifiableMap(copy));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryParameters that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "QueryParameters" + store.keySet();
    }
}
