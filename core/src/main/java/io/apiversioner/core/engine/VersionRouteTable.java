package io.apiversioner.core.engine;

import io.apiversioner.core.error.RouteNotFoundException;
import io.apiversioner.core.error.RouteRegistrationException;
import io.apiversioner.core.error.VersionNotFoundException;
import io.apiversioner.core.model.DeprecationInfo;
import io.apiversioner.core.model.Version;
import io.apiversioner.core.model.VersionFormat;
import io.apiversioner.core.model.VersionSpec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable table of versioned routes: (path template, method) → versions → {@link VersionSpec}.
 *
 * <p>
 * Built exactly once through {@link #builder(VersionFormat)}. Each (template, method, version)
 * triple is unique. Lookups match the request path against the templates and pick the most
 * specific match.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class VersionRouteTable {

    private static final Logger LOG = LoggerFactory.getLogger(VersionRouteTable.class);

    private final VersionFormat format;
    private final Map<RouteKey, SortedSet<VersionSpec>> routes;
    private final List<RouteKey> lookupOrder;

    private VersionRouteTable(VersionFormat format, Map<RouteKey, SortedSet<VersionSpec>> routes) {
        this.format = format;
        this.routes = routes;
        List<RouteKey> order = new ArrayList<>(routes.keySet());
        order.sort(Comparator.comparingInt((RouteKey k) -> RoutePathMatcher.specificity(k.template()))
                .reversed()
                .thenComparingInt(k -> RoutePathMatcher.multiSegmentWildcards(k.template())));
        this.lookupOrder = List.copyOf(order);
    }

    /** Returns a builder whose string versions are parsed with {@code format}. */
    public static Builder builder(VersionFormat format) {
        return new Builder(format);
    }

    /**
     * All versions of the most specific route matching {@code path} and {@code method}, ascending.
     *
     * @throws RouteNotFoundException if no template matches with that method
     */
    public SortedSet<VersionSpec> lookup(String path, String method) {
        String normalized = RoutePathMatcher.normalize(path);
        String upper = method.toUpperCase(Locale.ROOT);
        for (RouteKey key : lookupOrder) {
            if (key.method().equals(upper) && RoutePathMatcher.matches(key.template(), normalized)) {
                return routes.get(key);
            }
        }
        throw new RouteNotFoundException(path, upper);
    }

    /**
     * The spec registered for exactly {@code version} on the matching route.
     *
     * @throws RouteNotFoundException   if no template matches
     * @throws VersionNotFoundException if the route exists without that version
     */
    public VersionSpec lookupExact(String path, String method, Version version) {
        for (VersionSpec spec : lookup(path, method)) {
            if (spec.version().equals(version)) {
                return spec;
            }
        }
        throw new VersionNotFoundException(path, method.toUpperCase(Locale.ROOT), version);
    }

    /** Versions registered for the matching route, ascending. */
    public List<Version> availableVersions(String path, String method) {
        return lookup(path, method).stream().map(VersionSpec::version).toList();
    }

    /** Every registered spec, grouped by route in registration order, versions ascending. */
    public List<VersionSpec> specs() {
        List<VersionSpec> all = new ArrayList<>();
        routes.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    /** Every version registered on any route, ascending. */
    public SortedSet<Version> versions() {
        SortedSet<Version> all = new TreeSet<>();
        routes.values().forEach(specs -> specs.forEach(s -> all.add(s.version())));
        return Collections.unmodifiableSortedSet(all);
    }

    public VersionFormat format() {
        return format;
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    /** Route identity: normalized template and upper-case method. */
    record RouteKey(String template, String method) {}

    /**
     * Collects routes for a {@link VersionRouteTable}. Single use: once {@link #build()} has
     * returned, every further call is rejected.
     */
    public static final class Builder {

        private final VersionFormat format;
        private final Map<RouteKey, Map<Version, VersionSpec>> routes = new LinkedHashMap<>();
        private DeprecationRegistry deprecationRegistry;
        private boolean built;

        Builder(VersionFormat format) {
            this.format = Objects.requireNonNull(format, "format must not be null");
        }

        /** Validates every deprecated spec against {@code registry}'s policy at build time. */
        public Builder deprecationRegistry(DeprecationRegistry registry) {
            ensureOpen();
            this.deprecationRegistry = registry;
            return this;
        }

        /** Starts registering one version of {@code path} and {@code method}. */
        public RouteBuilder route(String path, String method) {
            ensureOpen();
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(method, "method must not be null");
            return new RouteBuilder(this, path, method);
        }

        /**
         * Registers a complete spec.
         *
         * @throws RouteRegistrationException on duplicates, format mismatches, or after build
         */
        public Builder register(VersionSpec spec) {
            ensureOpen();
            if (spec.version().format() != format) {
                throw new RouteRegistrationException("Route " + spec.method() + " " + spec.pathTemplate()
                        + " declares " + spec.version().format() + " version " + spec.version() + ", expected "
                        + format);
            }
            RouteKey key = new RouteKey(RoutePathMatcher.normalize(spec.pathTemplate()), spec.method());
            Map<Version, VersionSpec> versions = routes.computeIfAbsent(key, k -> new LinkedHashMap<>());
            if (versions.containsKey(spec.version())) {
                throw new RouteRegistrationException("Duplicate route " + spec.method() + " " + key.template()
                        + " for version " + spec.version());
            }
            versions.put(spec.version(), spec);
            return this;
        }

        /**
         * Builds the immutable table.
         *
         * @throws RouteRegistrationException if called twice or a spec violates the policy
         */
        public VersionRouteTable build() {
            ensureOpen();
            built = true;
            Map<RouteKey, SortedSet<VersionSpec>> frozen = new LinkedHashMap<>();
            int count = 0;
            for (Map.Entry<RouteKey, Map<Version, VersionSpec>> entry : routes.entrySet()) {
                SortedSet<VersionSpec> specs = new TreeSet<>(VersionSpec.BY_VERSION);
                for (VersionSpec spec : entry.getValue().values()) {
                    if (deprecationRegistry != null) {
                        deprecationRegistry.validate(spec);
                    }
                    specs.add(spec);
                    count++;
                }
                frozen.put(entry.getKey(), Collections.unmodifiableSortedSet(specs));
            }
            LOG.info("Route table built: routes={}, versioned_endpoints={}", frozen.size(), count);
            return new VersionRouteTable(format, Collections.unmodifiableMap(frozen));
        }

        VersionFormat format() {
            return format;
        }

        void ensureOpen() {
            if (built) {
                throw new RouteRegistrationException("Route table already built; no further registration allowed");
            }
        }
    }

    /**
     * Registers one (path, method, version). Each attribute may be set once; {@link #register()}
     * adds the spec to the parent builder and returns it.
     */
    public static final class RouteBuilder {

        private final Builder parent;
        private final String path;
        private final String method;
        private Version version;
        private String handlerRef;
        private DeprecationInfo deprecation;
        private boolean registered;

        private RouteBuilder(Builder parent, String path, String method) {
            this.parent = parent;
            this.path = path;
            this.method = method;
        }

        public RouteBuilder version(Version version) {
            checkUnset(this.version, "version");
            this.version = Objects.requireNonNull(version, "version must not be null");
            return this;
        }

        /** Parses {@code version} with the table's format. */
        public RouteBuilder version(String version) {
            return version(Version.parse(version, parent.format()));
        }

        public RouteBuilder handler(String handlerRef) {
            checkUnset(this.handlerRef, "handler");
            this.handlerRef = Objects.requireNonNull(handlerRef, "handlerRef must not be null");
            return this;
        }

        public RouteBuilder deprecated(DeprecationInfo deprecation) {
            checkUnset(this.deprecation, "deprecated");
            this.deprecation = Objects.requireNonNull(deprecation, "deprecation must not be null");
            return this;
        }

        /**
         * Adds the spec to the table builder.
         *
         * @throws RouteRegistrationException if version or handler is missing, or on duplicates
         */
        public Builder register() {
            parent.ensureOpen();
            if (registered) {
                throw new RouteRegistrationException("Route " + method + " " + path + " already registered");
            }
            if (version == null) {
                throw new RouteRegistrationException("Route " + method + " " + path + " has no version");
            }
            if (handlerRef == null) {
                throw new RouteRegistrationException(
                        "Route " + method + " " + path + " @ " + version + " has no handler");
            }
            registered = true;
            return parent.register(new VersionSpec(path, method, version, handlerRef, deprecation));
        }

        private void checkUnset(Object current, String attribute) {
            parent.ensureOpen();
            if (current != null) {
                throw new RouteRegistrationException(
                        "Route " + method + " " + path + ": '" + attribute + "' already set");
            }
        }
    }
}
