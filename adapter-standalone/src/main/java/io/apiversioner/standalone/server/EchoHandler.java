package io.apiversioner.standalone.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.apiversioner.core.model.ResolutionResult;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.Locale;

/**
 * Built-in handler bound to every handler reference without a programmatic binding. Answers with
 * the resolution it was dispatched for:
 *
 * <pre>
 * {"handler": "users-v1", "version": "1.0", "requested_version": "1.0", "negotiated": false, "status": "active"}
 * </pre>
 */
public final class EchoHandler implements Handler {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public void handle(Context ctx) {
        ResolutionResult result = VersionDispatchHandler.resolution(ctx);
        ObjectNode body = MAPPER.createObjectNode();
        body.put("handler", result.handlerRef());
        body.put("version", result.resolvedVersion().toString());
        if (result.requestedVersion() != null) {
            body.put("requested_version", result.requestedVersion().toString());
        } else {
            body.putNull("requested_version");
        }
        body.put("negotiated", result.negotiated());
        body.put("status", result.deprecation().status().name().toLowerCase(Locale.ROOT));

        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body.toString());
    }
}
