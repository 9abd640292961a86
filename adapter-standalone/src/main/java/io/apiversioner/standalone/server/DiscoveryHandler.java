package io.apiversioner.standalone.server;

import io.apiversioner.core.engine.VersioningEngine;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.Objects;

/**
 * Serves the engine's version discovery document as JSON. Rendered per request because endpoint
 * statuses move from deprecated to sunset as the clock passes their sunset dates.
 */
public final class DiscoveryHandler implements Handler {

    private final VersioningEngine engine;

    public DiscoveryHandler(VersioningEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(engine.discovery().toString());
    }
}
