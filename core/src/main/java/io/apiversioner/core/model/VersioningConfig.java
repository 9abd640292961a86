package io.apiversioner.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide versioning configuration. Immutable; built once at startup and shared read-only.
 * Use {@link #builder()} to construct instances.
 *
 * @param format         grammar every version in the deployment is parsed with
 * @param strategies     extraction strategies, in declaration order
 * @param defaultVersion version used when no strategy extracts one, nullable
 * @param strict         reject requests without a version when no default is configured
 * @param strictSunset   reject requests resolved to a sunset version
 * @param compatibility  version → ordered fallback list, direct entries only
 * @param headerNames    deprecation response header names
 * @param policy         registration-time deprecation rules
 * @param responseHeader name of the response header echoing the resolved version, nullable
 *                       to disable it
 */
public record VersioningConfig(
        VersionFormat format,
        List<StrategyConfig> strategies,
        Version defaultVersion,
        boolean strict,
        boolean strictSunset,
        Map<Version, List<Version>> compatibility,
        DeprecationHeaderNames headerNames,
        DeprecationPolicy policy,
        String responseHeader) {

    /** Header echoing the resolved version unless configured otherwise. */
    public static final String DEFAULT_RESPONSE_HEADER = "X-API-Version";

    public VersioningConfig {
        Objects.requireNonNull(format, "format must not be null");
        strategies = strategies != null ? List.copyOf(strategies) : List.of();
        compatibility = compatibility != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(compatibility))
                : Map.of();
        headerNames = headerNames != null ? headerNames : DeprecationHeaderNames.DEFAULTS;
        policy = policy != null ? policy : DeprecationPolicy.LENIENT;
        if (defaultVersion != null && defaultVersion.format() != format) {
            throw new IllegalArgumentException(
                    "default version " + defaultVersion + " is " + defaultVersion.format() + ", expected " + format);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link VersioningConfig}. Defaults: SEMANTIC format, a single URL path
     * strategy, no default version, lenient mode, {@value #DEFAULT_RESPONSE_HEADER} response
     * header.
     */
    public static final class Builder {
        private VersionFormat format = VersionFormat.SEMANTIC;
        private List<StrategyConfig> strategies =
                List.of(StrategyConfig.of(StrategyKind.URL_PATH, 1, Map.of()));
        private Version defaultVersion;
        private boolean strict;
        private boolean strictSunset;
        private Map<Version, List<Version>> compatibility = Map.of();
        private DeprecationHeaderNames headerNames = DeprecationHeaderNames.DEFAULTS;
        private DeprecationPolicy policy = DeprecationPolicy.LENIENT;
        private String responseHeader = DEFAULT_RESPONSE_HEADER;

        Builder() {}

        public Builder format(VersionFormat format) {
            this.format = format;
            return this;
        }

        public Builder strategies(List<StrategyConfig> strategies) {
            this.strategies = strategies;
            return this;
        }

        public Builder defaultVersion(Version defaultVersion) {
            this.defaultVersion = defaultVersion;
            return this;
        }

        /** Parses {@code defaultVersion} with the format set so far; call {@link #format} first. */
        public Builder defaultVersion(String defaultVersion) {
            this.defaultVersion = defaultVersion != null ? Version.parse(defaultVersion, format) : null;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder strictSunset(boolean strictSunset) {
            this.strictSunset = strictSunset;
            return this;
        }

        public Builder compatibility(Map<Version, List<Version>> compatibility) {
            this.compatibility = compatibility;
            return this;
        }

        public Builder headerNames(DeprecationHeaderNames headerNames) {
            this.headerNames = headerNames;
            return this;
        }

        public Builder policy(DeprecationPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder responseHeader(String responseHeader) {
            this.responseHeader = responseHeader;
            return this;
        }

        public VersioningConfig build() {
            return new VersioningConfig(
                    format,
                    strategies,
                    defaultVersion,
                    strict,
                    strictSunset,
                    compatibility,
                    headerNames,
                    policy,
                    responseHeader);
        }
    }
}
