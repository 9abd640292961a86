package io.apiversioner.standalone.adapter;

import io.apiversioner.core.model.QueryParameters;
import io.apiversioner.core.model.RequestHeaders;
import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.spi.RequestViewAdapter;
import io.javalin.http.Context;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RequestViewAdapter} for Javalin's {@link Context}.
 *
 * <p>
 * Headers are read from the servlet request so repeated headers keep every value. Query parameters
 * come from {@link Context#queryParamMap()}, already URL-decoded by Javalin. Stateless and
 * thread-safe.
 */
public final class JavalinRequestAdapter implements RequestViewAdapter<Context> {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinRequestAdapter.class);

    @Override
    public RequestView wrap(Context ctx) {
        RequestHeaders headers = buildHeaders(ctx);
        QueryParameters query = buildQuery(ctx);
        String path = ctx.path();
        String method = ctx.method().name();

        LOG.debug("wrap: {} {} (headers={}, query={})", method, path, headers.toMultiValueMap().size(), query);
        return new RequestView(path, method, headers, query);
    }

    @Override
    public void applyHeaders(Map<String, String> headers, Context ctx) {
        headers.forEach(ctx::header);
    }

    /**
     * @throws MalformedRequestException if Javalin cannot decode the query string
     */
    private static QueryParameters buildQuery(Context ctx) {
        try {
            return QueryParameters.ofMulti(ctx.queryParamMap());
        } catch (IllegalArgumentException e) {
            throw new MalformedRequestException("Malformed query string: " + e.getMessage(), e);
        }
    }

    private static RequestHeaders buildHeaders(Context ctx) {
        Map<String, List<String>> all = new LinkedHashMap<>();
        for (String name : Collections.list(ctx.req().getHeaderNames())) {
            List<String> values = new ArrayList<>(Collections.list(ctx.req().getHeaders(name)));
            all.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values);
        }
        return RequestHeaders.ofMulti(all);
    }
}
