package io.apiversioner.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative configuration of one version extraction strategy.
 *
 * @param kind         the request facet to inspect
 * @param priority     evaluation order, 1 is evaluated first
 * @param enabled      disabled strategies are never evaluated
 * @param parameters   kind-specific settings (e.g. {@code name}, {@code prefix})
 * @param alternatives fallback header or parameter names, checked in order
 * @param children     nested strategies, COMPOSITE only
 */
public record StrategyConfig(
        StrategyKind kind,
        int priority,
        boolean enabled,
        Map<String, String> parameters,
        List<String> alternatives,
        List<StrategyConfig> children) {

    public StrategyConfig {
        Objects.requireNonNull(kind, "kind must not be null");
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
        children = children != null ? List.copyOf(children) : List.of();
    }

    /** An enabled strategy with only parameters set. */
    public static StrategyConfig of(StrategyKind kind, int priority, Map<String, String> parameters) {
        return new StrategyConfig(kind, priority, true, parameters, List.of(), List.of());
    }

    /** Parameter value, or {@code defaultValue} when absent or blank. */
    public String parameter(String key, String defaultValue) {
        String value = parameters.get(key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }
}
