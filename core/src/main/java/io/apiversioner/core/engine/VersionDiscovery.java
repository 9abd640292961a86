package io.apiversioner.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.apiversioner.core.model.DeprecationInfo;
import io.apiversioner.core.model.DeprecationStatus;
import io.apiversioner.core.model.Version;
import io.apiversioner.core.model.VersionSpec;
import io.apiversioner.core.model.VersioningConfig;
import io.apiversioner.core.strategy.VersionStrategy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the version discovery document:
 *
 * <pre>
 * {
 *   "default_version": "1.0",
 *   "format": "semantic",
 *   "strategies": [{"name": "header", "kind": "header", "priority": 1}],
 *   "versions": {
 *     "1.0": {
 *       "is_deprecated": true,
 *       "is_sunset": false,
 *       "deprecation": {"sunset_date": "...", "replacement": "...", "reason": "...",
 *                       "warning_level": "warning", "migration_guide": null},
 *       "endpoints": [{"method": "GET", "path": "/users", "status": "deprecated"}]
 *     }
 *   }
 * }
 * </pre>
 *
 * A version is deprecated (or sunset) when any of its endpoints is. Its {@code deprecation} block
 * is taken from the deprecated endpoint with the earliest sunset date, undated endpoints last.
 */
final class VersionDiscovery {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Comparator<DeprecationInfo> EARLIEST_SUNSET = Comparator.comparing(
            DeprecationInfo::sunsetDate, Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    private VersionDiscovery() {}

    static ObjectNode build(
            VersioningConfig config,
            List<VersionStrategy> strategies,
            VersionRouteTable routes,
            DeprecationRegistry registry) {
        Instant now = registry.clock().instant();
        ObjectNode root = MAPPER.createObjectNode();
        if (config.defaultVersion() != null) {
            root.put("default_version", config.defaultVersion().toString());
        } else {
            root.putNull("default_version");
        }
        root.put("format", config.format().name().toLowerCase(Locale.ROOT));

        ArrayNode strategyArray = root.putArray("strategies");
        for (VersionStrategy strategy : strategies) {
            ObjectNode node = strategyArray.addObject();
            node.put("name", strategy.name());
            node.put("kind", strategy.kind().configName());
            node.put("priority", strategy.priority());
        }

        Map<Version, List<VersionSpec>> byVersion = new TreeMap<>();
        for (VersionSpec spec : routes.specs()) {
            byVersion.computeIfAbsent(spec.version(), v -> new ArrayList<>()).add(spec);
        }

        ObjectNode versions = root.putObject("versions");
        byVersion.forEach((version, specs) -> versions.set(version.toString(), versionNode(specs, now)));
        return root;
    }

    private static ObjectNode versionNode(List<VersionSpec> specs, Instant now) {
        ObjectNode node = MAPPER.createObjectNode();
        boolean deprecated = false;
        boolean sunset = false;
        DeprecationInfo earliest = null;
        ArrayNode endpoints = MAPPER.createArrayNode();

        for (VersionSpec spec : specs) {
            DeprecationStatus status = DeprecationRegistry.statusOf(spec.deprecation(), now);
            if (spec.deprecation() != null) {
                deprecated = true;
                if (earliest == null || EARLIEST_SUNSET.compare(spec.deprecation(), earliest) < 0) {
                    earliest = spec.deprecation();
                }
            }
            sunset |= status == DeprecationStatus.SUNSET;

            ObjectNode endpoint = endpoints.addObject();
            endpoint.put("method", spec.method());
            endpoint.put("path", spec.pathTemplate());
            endpoint.put("status", status.name().toLowerCase(Locale.ROOT));
        }

        node.put("is_deprecated", deprecated);
        node.put("is_sunset", sunset);
        if (earliest != null) {
            node.set("deprecation", deprecationNode(earliest));
        } else {
            node.putNull("deprecation");
        }
        node.set("endpoints", endpoints);
        return node;
    }

    private static ObjectNode deprecationNode(DeprecationInfo info) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("sunset_date", info.sunsetDate() != null ? info.sunsetDate().toString() : null);
        node.put("replacement", info.replacement());
        node.put("reason", info.reason());
        node.put("warning_level", info.warningLevel().name().toLowerCase(Locale.ROOT));
        node.put("migration_guide", info.migrationGuide());
        return node;
    }
}
