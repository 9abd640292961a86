package io.apiversioner.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.apiversioner.core.error.RouteRegistrationException;
import io.apiversioner.core.error.VersionRequestException;
import io.apiversioner.core.model.DeprecationOutcome;
import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.model.ResolutionResult;
import io.apiversioner.core.model.Version;
import io.apiversioner.core.model.VersionSpec;
import io.apiversioner.core.model.VersioningConfig;
import io.apiversioner.core.spi.VersioningListener;
import io.apiversioner.core.strategy.StrategyFactory;
import io.apiversioner.core.strategy.VersionStrategy;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves, per request, which endpoint version serves it and how that version's lifecycle must be
 * signalled.
 *
 * <p>
 * Pipeline:
 * <ol>
 * <li>strip version segments from the path (URL strategies) and look up the route</li>
 * <li>extract the requested version ({@link StrategyResolver})</li>
 * <li>negotiate among the route's versions ({@link VersionNegotiator}); an unspecified request
 * gets the latest registered version</li>
 * <li>evaluate deprecation at the engine clock ({@link DeprecationRegistry})</li>
 * </ol>
 * Request-phase failures surface as {@link VersionRequestException} subclasses.
 *
 * <p>
 * Immutable after construction and safe to share across request threads.
 */
public final class VersioningEngine {

    private static final Logger LOG = LoggerFactory.getLogger(VersioningEngine.class);

    private final VersioningConfig config;
    private final VersionRouteTable routes;
    private final List<VersionStrategy> strategies;
    private final StrategyResolver resolver;
    private final VersionNegotiator negotiator;
    private final DeprecationRegistry deprecationRegistry;
    private final VersioningListener listener;

    /** Creates an engine with the system UTC clock and no listener. */
    public VersioningEngine(VersioningConfig config, VersionRouteTable routes) {
        this(config, routes, null, Clock.systemUTC());
    }

    /**
     * Creates an engine.
     *
     * @param config   versioning configuration
     * @param routes   the built route table; its format must match {@code config}
     * @param listener optional lifecycle listener, nullable
     * @param clock    time source for deprecation evaluation
     * @throws RouteRegistrationException if the table, default version or matrix use another format
     * @throws IllegalArgumentException   if a strategy or the compatibility matrix is invalid
     */
    public VersioningEngine(
            VersioningConfig config, VersionRouteTable routes, VersioningListener listener, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.routes = Objects.requireNonNull(routes, "routes must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        if (routes.format() != config.format()) {
            throw new RouteRegistrationException(
                    "Route table uses " + routes.format() + " versions but configuration declares " + config.format());
        }
        CompatibilityMatrix matrix = CompatibilityMatrix.of(config.compatibility());
        if (!matrix.isEmpty() && matrix.versions().first().format() != config.format()) {
            throw new IllegalArgumentException("compatibility matrix uses "
                    + matrix.versions().first().format() + " versions but configuration declares " + config.format());
        }
        this.strategies = StrategyFactory.createAll(config.strategies());
        this.resolver =
                new StrategyResolver(strategies, config.format(), config.defaultVersion(), config.strict());
        this.negotiator = new VersionNegotiator(matrix, config.defaultVersion());
        this.deprecationRegistry = new DeprecationRegistry(config.headerNames(), config.policy(), clock);
        this.listener = listener; // nullable
        for (VersionSpec spec : routes.specs()) {
            deprecationRegistry.validate(spec);
        }
        LOG.info(
                "Versioning engine ready: format={}, strategies={}, default_version={}, strict={}, "
                        + "strict_sunset={}, versions={}",
                config.format(),
                strategies.stream().map(VersionStrategy::name).toList(),
                config.defaultVersion(),
                config.strict(),
                config.strictSunset(),
                routes.versions());
    }

    /**
     * Resolves the endpoint version serving {@code request}.
     *
     * @throws VersionRequestException (a subclass) when the request cannot be resolved
     */
    public ResolutionResult resolve(RequestView request) {
        try {
            return doResolve(request);
        } catch (VersionRequestException e) {
            LOG.debug("Resolution failed for {} {}: {}", request.method(), request.path(), e.getMessage());
            notifyFailed(request, e);
            throw e;
        }
    }

    /**
     * Response headers for a resolution: deprecation headers in emission order, then the version
     * response header when configured.
     */
    public Map<String, String> responseHeaders(ResolutionResult result) {
        Map<String, String> headers = new LinkedHashMap<>(result.deprecation().headers());
        if (config.responseHeader() != null && !config.responseHeader().isBlank()) {
            headers.put(config.responseHeader(), result.resolvedVersion().toString());
        }
        return headers;
    }

    /** The discovery document describing versions, strategies and endpoint lifecycle. */
    public ObjectNode discovery() {
        return VersionDiscovery.build(config, strategies, routes, deprecationRegistry);
    }

    /** Path used for route lookup after every strategy stripped its version segment. */
    public String routePath(String path) {
        String result = path;
        for (VersionStrategy strategy : strategies) {
            result = strategy.routePath(result);
        }
        return result;
    }

    public VersioningConfig config() {
        return config;
    }

    public VersionRouteTable routes() {
        return routes;
    }

    /** Enabled strategies in evaluation order. */
    public List<VersionStrategy> strategies() {
        return strategies;
    }

    public DeprecationRegistry deprecationRegistry() {
        return deprecationRegistry;
    }

    // --- Resolution ---

    private ResolutionResult doResolve(RequestView request) {
        String lookupPath = routePath(request.path());
        SortedSet<VersionSpec> candidates = routes.lookup(lookupPath, request.method());
        RequestedVersion requested = resolver.resolve(request);

        VersionSpec chosen;
        boolean negotiated;
        if (!requested.isSpecified()) {
            chosen = candidates.last();
            negotiated = false;
        } else {
            List<Version> available = routes.availableVersions(lookupPath, request.method());
            Negotiation negotiation = negotiator.negotiate(requested.version(), available, request.path());
            chosen = findSpec(candidates, negotiation.version());
            negotiated = !negotiation.exact();
            if (negotiated) {
                LOG.info(
                        "version.negotiated request_path={} method={} requested={} resolved={} via_default={}",
                        request.path(),
                        request.method(),
                        requested.version(),
                        negotiation.version(),
                        negotiation.viaDefault());
                notifyNegotiated(request, requested.version(), negotiation);
            }
        }

        DeprecationOutcome outcome = deprecationRegistry.evaluate(chosen);
        boolean rejected = config.strictSunset() && outcome.isSunset();
        ResolutionResult result = new ResolutionResult(
                chosen,
                requested.version(),
                requested.source(),
                requested.strategyName(),
                negotiated,
                outcome,
                rejected);

        LOG.debug(
                "version.resolved request_path={} method={} route={} requested={} resolved={} source={} "
                        + "strategy={} status={}",
                request.path(),
                request.method(),
                chosen.pathTemplate(),
                requested.version(),
                chosen.version(),
                requested.source(),
                requested.strategyName(),
                outcome.status());
        if (outcome.isDeprecated()) {
            LOG.info(
                    "version.deprecated_served request_path={} method={} version={} status={} rejected={}",
                    request.path(),
                    request.method(),
                    chosen.version(),
                    outcome.status(),
                    rejected);
            notifyDeprecatedServed(request, result);
        }
        notifyResolved(request, result);
        return result;
    }

    private static VersionSpec findSpec(SortedSet<VersionSpec> candidates, Version version) {
        for (VersionSpec spec : candidates) {
            if (spec.version().equals(version)) {
                return spec;
            }
        }
        // negotiation only returns members of the candidate versions
        throw new IllegalStateException("negotiated version " + version + " is not a candidate");
    }

    // --- Listener notification helpers ---

    private void notifyResolved(RequestView request, ResolutionResult result) {
        if (listener == null) return;
        try {
            listener.onVersionResolved(new VersioningListener.VersionResolvedEvent(
                    request.path(),
                    request.method(),
                    result.requestedVersion() != null ? result.requestedVersion().toString() : null,
                    result.resolvedVersion().toString(),
                    result.source(),
                    result.strategyName()));
        } catch (Exception e) {
            LOG.warn("VersioningListener.onVersionResolved failed", e);
        }
    }

    private void notifyNegotiated(RequestView request, Version requested, Negotiation negotiation) {
        if (listener == null) return;
        try {
            listener.onVersionNegotiated(new VersioningListener.VersionNegotiatedEvent(
                    request.path(),
                    request.method(),
                    requested.toString(),
                    negotiation.version().toString(),
                    negotiation.viaDefault()));
        } catch (Exception e) {
            LOG.warn("VersioningListener.onVersionNegotiated failed", e);
        }
    }

    private void notifyDeprecatedServed(RequestView request, ResolutionResult result) {
        if (listener == null) return;
        try {
            listener.onDeprecatedVersionServed(new VersioningListener.DeprecatedVersionServedEvent(
                    request.path(),
                    request.method(),
                    result.resolvedVersion().toString(),
                    result.deprecation().status(),
                    result.rejected()));
        } catch (Exception e) {
            LOG.warn("VersioningListener.onDeprecatedVersionServed failed", e);
        }
    }

    private void notifyFailed(RequestView request, VersionRequestException error) {
        if (listener == null) return;
        try {
            listener.onResolutionFailed(new VersioningListener.ResolutionFailedEvent(
                    request.path(), request.method(), error.urn(), error.getMessage()));
        } catch (Exception e) {
            LOG.warn("VersioningListener.onResolutionFailed failed", e);
        }
    }
}
