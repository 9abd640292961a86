package io.apiversioner.core.strategy;

import io.apiversioner.core.model.StrategyConfig;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds {@link VersionStrategy} instances from declarative {@link StrategyConfig}s.
 *
 * <p>
 * Recognized parameters per kind:
 * <ul>
 * <li>URL_PATH: {@code prefix}, {@code api-prefix}</li>
 * <li>HEADER: {@code name}, {@code pattern}; alternatives list extra header names</li>
 * <li>QUERY_PARAMETER: {@code name}; alternatives list extra parameter names</li>
 * <li>ACCEPT_HEADER: {@code parameter}, {@code media-type}, {@code vendor-pattern},
 * {@code vendor}</li>
 * <li>COMPOSITE: children only</li>
 * </ul>
 */
public final class StrategyFactory {

    private StrategyFactory() {}

    /**
     * Creates the enabled strategies of {@code configs}, ordered by ascending priority with
     * declaration order kept for ties.
     *
     * @throws IllegalArgumentException if a configuration is invalid (bad regex, empty composite)
     */
    public static List<VersionStrategy> createAll(List<StrategyConfig> configs) {
        List<VersionStrategy> strategies = new ArrayList<>();
        for (StrategyConfig config : configs) {
            if (config.enabled()) {
                strategies.add(create(config));
            }
        }
        strategies.sort(Comparator.comparingInt(VersionStrategy::priority));
        return List.copyOf(strategies);
    }

    /** Creates one strategy; the {@code enabled} flag is not consulted here. */
    public static VersionStrategy create(StrategyConfig config) {
        return switch (config.kind()) {
            case URL_PATH -> new UrlPathStrategy(
                    config.priority(),
                    config.parameter("prefix", UrlPathStrategy.DEFAULT_PREFIX),
                    config.parameter("api-prefix", null));
            case HEADER -> new HeaderStrategy(
                    config.priority(),
                    config.parameter("name", HeaderStrategy.DEFAULT_HEADER),
                    config.alternatives(),
                    compile(config.parameter("pattern", null), "pattern"));
            case QUERY_PARAMETER -> new QueryParameterStrategy(
                    config.priority(),
                    config.parameter("name", QueryParameterStrategy.DEFAULT_PARAMETER),
                    config.alternatives());
            case ACCEPT_HEADER -> new AcceptHeaderStrategy(
                    config.priority(),
                    config.parameter("parameter", AcceptHeaderStrategy.DEFAULT_PARAMETER),
                    config.parameter("media-type", null),
                    vendorPattern(config));
            case COMPOSITE -> {
                List<VersionStrategy> children = createAll(config.children());
                if (children.isEmpty()) {
                    throw new IllegalArgumentException("composite strategy has no enabled children");
                }
                yield new CompositeStrategy(config.priority(), children);
            }
        };
    }

    private static Pattern vendorPattern(StrategyConfig config) {
        String custom = config.parameter("vendor-pattern", null);
        if (custom != null) {
            return compile(custom, "vendor-pattern");
        }
        return Boolean.parseBoolean(config.parameter("vendor", "false"))
                ? AcceptHeaderStrategy.DEFAULT_VENDOR_PATTERN
                : null;
    }

    private static Pattern compile(String regex, String parameter) {
        if (regex == null) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex in strategy parameter '" + parameter + "': " + regex, e);
        }
    }
}
