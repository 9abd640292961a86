package io.apiversioner.standalone.config;

import io.apiversioner.core.model.VersionSpec;
import io.apiversioner.core.model.VersioningConfig;
import java.util.List;
import java.util.Objects;

/**
 * Root configuration of the standalone versioning gateway.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param serverHost    bind address of the HTTP server
 * @param serverPort    listen port, {@code 0} picks a free port
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 * @param discoveryPath path serving the version discovery document
 * @param healthEnabled register the liveness endpoint
 * @param healthPath    liveness probe path
 * @param versioning    versioning engine configuration
 * @param routes        versioned endpoints, one entry per (path, method, version)
 */
public record GatewayConfig(
        String serverHost,
        int serverPort,
        String loggingFormat,
        String loggingLevel,
        String discoveryPath,
        boolean healthEnabled,
        String healthPath,
        VersioningConfig versioning,
        List<VersionSpec> routes) {

    public GatewayConfig {
        Objects.requireNonNull(versioning, "versioning must not be null");
        routes = routes != null ? List.copyOf(routes) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link GatewayConfig}. */
    public static final class Builder {
        private String serverHost = "0.0.0.0";
        private int serverPort = 8080;
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";
        private String discoveryPath = "/versions";
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private VersioningConfig versioning = VersioningConfig.builder().build();
        private List<VersionSpec> routes = List.of();

        Builder() {}

        public Builder serverHost(String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder discoveryPath(String discoveryPath) {
            this.discoveryPath = discoveryPath;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder versioning(VersioningConfig versioning) {
            this.versioning = versioning;
            return this;
        }

        public Builder routes(List<VersionSpec> routes) {
            this.routes = routes;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(
                    serverHost,
                    serverPort,
                    loggingFormat,
                    loggingLevel,
                    discoveryPath,
                    healthEnabled,
                    healthPath,
                    versioning,
                    routes);
        }
    }
}
