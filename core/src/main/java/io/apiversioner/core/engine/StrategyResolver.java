package io.apiversioner.core.engine;

import io.apiversioner.core.error.InvalidVersionException;
import io.apiversioner.core.error.MissingVersionException;
import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.model.Version;
import io.apiversioner.core.model.VersionFormat;
import io.apiversioner.core.strategy.VersionStrategy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the requested version of a request by evaluating strategies in ascending priority.
 *
 * <p>
 * The first strategy yielding a token decides: the token is parsed and returned, and later
 * strategies are never evaluated. A token that fails to parse is an error, never replaced by the
 * default. Without any token the default version applies when configured; otherwise strict mode
 * rejects the request and lenient mode reports it as unspecified.
 *
 * <p>
 * Thread-safe and stateless after construction.
 */
public final class StrategyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyResolver.class);

    private final List<VersionStrategy> strategies;
    private final VersionFormat format;
    private final Version defaultVersion;
    private final boolean strict;

    /**
     * @param strategies     strategies to evaluate; re-sorted by priority, ties keep list order
     * @param format         format tokens are parsed with
     * @param defaultVersion version used when no token is found, nullable
     * @param strict         reject requests without a token when no default exists
     */
    public StrategyResolver(
            List<VersionStrategy> strategies, VersionFormat format, Version defaultVersion, boolean strict) {
        this.format = Objects.requireNonNull(format, "format must not be null");
        List<VersionStrategy> sorted = new ArrayList<>(strategies);
        sorted.sort(Comparator.comparingInt(VersionStrategy::priority));
        this.strategies = List.copyOf(sorted);
        this.defaultVersion = defaultVersion;
        this.strict = strict;
    }

    /**
     * Resolves the requested version.
     *
     * @throws InvalidVersionException if the first extracted token does not parse
     * @throws MissingVersionException in strict mode when no token is found and no default exists
     */
    public RequestedVersion resolve(RequestView request) {
        for (VersionStrategy strategy : strategies) {
            Optional<String> token = strategy.extract(request);
            if (token.isEmpty()) {
                continue;
            }
            String raw = token.get();
            try {
                Version version = Version.parse(raw, format);
                LOG.debug(
                        "Version extracted: strategy={}, token='{}', version={}, path={}",
                        strategy.name(),
                        raw,
                        version,
                        request.path());
                return RequestedVersion.extracted(version, strategy.name(), raw);
            } catch (InvalidVersionException e) {
                throw new InvalidVersionException(raw, format, strategy.name(), request.path(), e);
            }
        }

        if (defaultVersion != null) {
            LOG.debug("No version token found, using default {} (path={})", defaultVersion, request.path());
            return RequestedVersion.defaulted(defaultVersion);
        }
        if (strict) {
            throw new MissingVersionException(strategyNames(), request.path());
        }
        return RequestedVersion.unspecified();
    }

    /** Strategies in evaluation order. */
    public List<VersionStrategy> strategies() {
        return strategies;
    }

    private List<String> strategyNames() {
        return strategies.stream().map(VersionStrategy::name).toList();
    }
}
