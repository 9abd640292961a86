package io.apiversioner.standalone.server;

import io.apiversioner.core.engine.VersionRouteTable;
import io.apiversioner.core.engine.VersioningEngine;
import io.apiversioner.core.model.VersionSpec;
import io.apiversioner.standalone.adapter.JavalinRequestAdapter;
import io.apiversioner.standalone.config.ConfigLoader;
import io.apiversioner.standalone.config.GatewayConfig;
import io.javalin.Javalin;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone gateway.
 *
 * <ol>
 * <li>load configuration from YAML plus environment overlay</li>
 * <li>configure Logback</li>
 * <li>build the route table and the versioning engine</li>
 * <li>register health, discovery and the versioned catch-all route</li>
 * <li>start Javalin</li>
 * </ol>
 *
 * Kept apart from {@link io.apiversioner.standalone.StandaloneMain} so tests can start and stop
 * gateways without going through {@code main()}.
 */
public final class GatewayApp {

    private static final Logger LOG = LoggerFactory.getLogger(GatewayApp.class);

    private static final Set<String> ALLOWED_METHODS =
            Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");

    private static final List<String> CATCH_ALL_PATHS = List.of("/", "/<path>");

    private final Javalin app;
    private final VersioningEngine engine;
    private final GatewayConfig config;

    private GatewayApp(Javalin app, VersioningEngine engine, GatewayConfig config) {
        this.app = app;
        this.engine = engine;
        this.config = config;
    }

    /**
     * Loads configuration named by {@code --config} (or the default file), configures logging and
     * starts a gateway where every handler reference answers with {@link EchoHandler}.
     */
    public static GatewayApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        GatewayConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config, Map.of());
    }

    /**
     * Starts a gateway from an already-loaded configuration.
     *
     * @param config   gateway configuration
     * @param handlers handler reference → handler; unbound references use {@link EchoHandler}
     * @throws io.apiversioner.core.error.VersionStartupException if the routes are inconsistent
     */
    public static GatewayApp start(GatewayConfig config, Map<String, Handler> handlers) {
        long startTime = System.nanoTime();

        VersionRouteTable.Builder tableBuilder = VersionRouteTable.builder(config.versioning().format());
        for (VersionSpec spec : config.routes()) {
            tableBuilder.register(spec);
        }
        VersionRouteTable routes = tableBuilder.build();
        VersioningEngine engine = new VersioningEngine(config.versioning(), routes);

        VersionDispatchHandler dispatch =
                new VersionDispatchHandler(engine, new JavalinRequestAdapter(), handlers, new EchoHandler());

        Javalin app = Javalin.create();
        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }
        app.get(config.discoveryPath(), new DiscoveryHandler(engine));

        Handler methodFilter = ctx -> {
            String method = ctx.method().name();
            if (!ALLOWED_METHODS.contains(method)) {
                ctx.status(405);
                ctx.contentType(ProblemDetail.CONTENT_TYPE);
                ctx.result(ProblemDetail.methodNotAllowed("HTTP method " + method + " is not supported", ctx.path())
                        .toString());
                ctx.skipRemainingHandlers();
            }
        };
        // "/<path>" does not match the root path, so "/" is registered on its own
        for (String path : CATCH_ALL_PATHS) {
            app.before(path, methodFilter);
        }
        for (String method : ALLOWED_METHODS) {
            for (String path : CATCH_ALL_PATHS) {
                app.addHttpHandler(HandlerType.valueOf(method), path, dispatch);
            }
        }
        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Handler failed for {} {}", ctx.method().name(), ctx.path(), e);
            ctx.status(500);
            ctx.contentType(ProblemDetail.CONTENT_TYPE);
            ctx.result(ProblemDetail.internalError("Handler failed: " + e.getMessage(), ctx.path())
                    .toString());
        });

        app.start(config.serverHost(), config.serverPort());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "api-versioner gateway started: port={}, routes={}, versions={}, discovery={}, startupMs={}",
                app.port(),
                routes.specs().size(),
                routes.versions(),
                config.discoveryPath(),
                elapsedMs);
        return new GatewayApp(app, engine, config);
    }

    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public VersioningEngine engine() {
        return engine;
    }

    public GatewayConfig config() {
        return config;
    }

    public void stop() {
        app.stop();
        LOG.info("api-versioner gateway stopped");
    }
}
