package io.apiversioner.core.strategy;

import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.model.StrategyKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the version from a query parameter such as {@code ?version=2}. The primary name is checked
 * first, then alternatives; a multi-valued parameter contributes its first value.
 */
public final class QueryParameterStrategy implements VersionStrategy {

    public static final String DEFAULT_PARAMETER = "version";

    private final int priority;
    private final List<String> parameterNames;

    public QueryParameterStrategy(int priority, String parameterName, List<String> alternatives) {
        this.priority = priority;
        List<String> names = new ArrayList<>();
        names.add(parameterName != null ? parameterName : DEFAULT_PARAMETER);
        if (alternatives != null) {
            alternatives.stream().filter(a -> !names.contains(a)).forEach(names::add);
        }
        this.parameterNames = List.copyOf(names);
    }

    @Override
    public String name() {
        return "query-parameter";
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.QUERY_PARAMETER;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public Optional<String> extract(RequestView request) {
        for (String name : parameterNames) {
            String value = request.query().first(name);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }
}
