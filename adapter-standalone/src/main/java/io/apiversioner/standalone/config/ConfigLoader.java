package io.apiversioner.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.apiversioner.core.error.ConfigParseException;
import io.apiversioner.core.model.VersionSpec;
import io.apiversioner.core.model.VersioningConfig;
import io.apiversioner.core.spec.RouteManifestParser;
import io.apiversioner.core.spec.VersioningConfigParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link GatewayConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * server:     {host: 0.0.0.0, port: 8080}
 * logging:    {format: json, level: INFO}
 * discovery:  {path: /versions}
 * health:     {enabled: true, path: /health}
 * versioning: {...}
 * routes:     [...]
 * </pre>
 *
 * <p>
 * The {@code versioning} and {@code routes} blocks are handed to the core parsers, which validate
 * them against the bundled JSON Schemas. Missing gateway keys keep the {@link GatewayConfig.Builder}
 * defaults.
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as set only when it is
 * defined and its trimmed value is non-empty:
 * {@code SERVER_HOST}, {@code SERVER_PORT}, {@code LOG_FORMAT}, {@code LOG_LEVEL},
 * {@code DISCOVERY_PATH}, {@code HEALTH_PATH}, {@code VERSIONING_DEFAULT_VERSION},
 * {@code VERSIONING_STRICT}, {@code VERSIONING_STRICT_SUNSET}.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "api-versioner.yaml";

    private ConfigLoader() {
        // utility class
    }

    /** Loads the configuration with overrides from {@link System#getenv}. */
    public static GatewayConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration with overrides from the supplied lookup; {@code null} from the lookup
     * means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an invalid
     *                             block or override
     */
    public static GatewayConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || !root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return mapToConfig((ObjectNode) root, configPath.toString(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (ConfigParseException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments: {@code --config <path>}, or
     * {@value #DEFAULT_CONFIG_FILE} in the working directory.
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static GatewayConfig mapToConfig(ObjectNode root, String source, Function<String, String> envLookup) {
        GatewayConfig.Builder builder = GatewayConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.serverHost(server.get("host").asText());
        if (server.has("port")) builder.serverPort(server.get("port").asInt());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode discovery = root.path("discovery");
        if (discovery.has("path")) builder.discoveryPath(discovery.get("path").asText());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "SERVER_HOST", builder::serverHost);
        envInt(envLookup, "SERVER_PORT", builder::serverPort);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "DISCOVERY_PATH", builder::discoveryPath);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);

        // versioning overrides are applied to the tree so they pass the same schema checks
        ObjectNode versioningNode = root.has("versioning") && root.get("versioning").isObject()
                ? (ObjectNode) root.get("versioning")
                : root.putObject("versioning");
        envString(envLookup, "VERSIONING_DEFAULT_VERSION", v -> versioningNode.put("default-version", v));
        envBool(envLookup, "VERSIONING_STRICT", v -> versioningNode.put("strict", v));
        envBool(envLookup, "VERSIONING_STRICT_SUNSET", v -> versioningNode.put("strict-sunset", v));

        VersioningConfig versioning = new VersioningConfigParser().parse(versioningNode, source);
        builder.versioning(versioning);

        JsonNode routes = root.get("routes");
        if (routes != null && !routes.isNull()) {
            List<VersionSpec> specs = new RouteManifestParser().parse(routes, versioning.format(), source);
            builder.routes(specs);
        }
        return builder.build();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
