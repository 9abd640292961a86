package io.apiversioner.standalone.server;

import io.apiversioner.core.engine.VersioningEngine;
import io.apiversioner.core.error.VersionRequestException;
import io.apiversioner.core.model.ResolutionResult;
import io.apiversioner.core.spi.RequestViewAdapter;
import io.apiversioner.standalone.adapter.MalformedRequestException;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Catch-all route handler: resolves the request version and dispatches to the handler bound to the
 * resolved endpoint's handler reference.
 *
 * <p>
 * Per request:
 * <ol>
 * <li>wrap the Javalin context and resolve it with the {@link VersioningEngine}</li>
 * <li>on an unreadable request or a resolution failure, answer with an RFC 9457 problem response</li>
 * <li>merge deprecation and version headers into the response</li>
 * <li>refuse sunset versions with 410 when strict-sunset mode is on</li>
 * <li>expose the {@link ResolutionResult} as a context attribute and invoke the bound handler</li>
 * </ol>
 * The resolved version sits in the MDC under {@value #MDC_VERSION_KEY} while the handler runs.
 */
public final class VersionDispatchHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(VersionDispatchHandler.class);

    /** Context attribute holding the {@link ResolutionResult} of the current request. */
    public static final String RESOLUTION_ATTRIBUTE = "api-versioner.resolution";

    static final String MDC_VERSION_KEY = "api.version";

    private final VersioningEngine engine;
    private final RequestViewAdapter<Context> adapter;
    private final Map<String, Handler> handlers;
    private final Handler fallback;

    /**
     * @param engine   the versioning engine
     * @param adapter  request adapter for Javalin contexts
     * @param handlers handler reference → handler bindings
     * @param fallback handler for references without a binding
     */
    public VersionDispatchHandler(
            VersioningEngine engine,
            RequestViewAdapter<Context> adapter,
            Map<String, Handler> handlers,
            Handler fallback) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
        this.handlers = Map.copyOf(handlers);
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    /** Resolution of the request being handled; set before a bound handler is invoked. */
    public static ResolutionResult resolution(Context ctx) {
        ResolutionResult result = ctx.attribute(RESOLUTION_ATTRIBUTE);
        if (result == null) {
            throw new IllegalStateException("No version resolution on this request");
        }
        return result;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        ResolutionResult result;
        try {
            result = engine.resolve(adapter.wrap(ctx));
        } catch (MalformedRequestException e) {
            LOG.debug("Unreadable request {} {}: {}", ctx.method().name(), ctx.path(), e.getMessage());
            problem(ctx, 400, ProblemDetail.badRequest(e.getMessage(), ctx.path()).toString());
            return;
        } catch (VersionRequestException e) {
            LOG.debug("Version resolution refused {} {}: {}", ctx.method().name(), ctx.path(), e.getMessage());
            problem(ctx, ProblemDetail.statusOf(e), ProblemDetail.fromResolutionError(e, ctx.path()).toString());
            return;
        }

        MDC.put(MDC_VERSION_KEY, result.resolvedVersion().toString());
        try {
            adapter.applyHeaders(engine.responseHeaders(result), ctx);
            if (result.rejected()) {
                String replacement =
                        result.spec().deprecation() != null ? result.spec().deprecation().replacement() : null;
                problem(
                        ctx,
                        410,
                        ProblemDetail.versionSunset(result.resolvedVersion(), replacement, ctx.path())
                                .toString());
                return;
            }
            ctx.attribute(RESOLUTION_ATTRIBUTE, result);
            Handler handler = handlers.getOrDefault(result.handlerRef(), fallback);
            handler.handle(ctx);
        } finally {
            MDC.remove(MDC_VERSION_KEY);
        }
    }

    private static void problem(Context ctx, int status, String body) {
        ctx.status(status);
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(body);
    }
}
