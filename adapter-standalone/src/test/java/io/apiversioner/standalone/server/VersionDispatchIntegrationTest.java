package io.apiversioner.standalone.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.apiversioner.core.model.DeprecationInfo;
import io.apiversioner.core.model.StrategyConfig;
import io.apiversioner.core.model.StrategyKind;
import io.apiversioner.core.model.Version;
import io.apiversioner.core.model.VersionFormat;
import io.apiversioner.core.model.VersionSpec;
import io.apiversioner.core.model.VersioningConfig;
import io.apiversioner.standalone.config.GatewayConfig;
import io.javalin.http.Handler;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Starts a gateway on a free port and drives it over HTTP.
 *
 * <pre>
 *   TestClient ← HTTP → Javalin (VersionDispatchHandler → bound handler | EchoHandler)
 * </pre>
 */
@DisplayName("Versioned dispatch over HTTP")
class VersionDispatchIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static GatewayApp gateway;
    private static GatewayApp strictGateway;
    private static HttpClient client;

    private static Version v(String raw) {
        return Version.parse(raw, VersionFormat.SEMANTIC);
    }

    private static List<VersionSpec> routes() {
        DeprecationInfo sunsetV1 = DeprecationInfo.builder()
                .sunsetDate(Instant.parse("2020-01-01T00:00:00Z"))
                .replacement("/v2/users")
                .build();
        DeprecationInfo deprecatedOrders = DeprecationInfo.builder()
                .sunsetDate(Instant.parse("2099-01-01T00:00:00Z"))
                .replacement("/v2/orders")
                .build();
        return List.of(
                new VersionSpec("/", "GET", v("1.0"), "root-v1", null),
                new VersionSpec("/users", "GET", v("1.0"), "users-v1", sunsetV1),
                new VersionSpec("/users", "GET", v("2.0"), "users-v2", null),
                new VersionSpec("/orders", "GET", v("1.0"), "orders-v1", deprecatedOrders),
                new VersionSpec("/orders", "GET", v("2.0"), "orders-v2", null));
    }

    private static GatewayConfig config(boolean strictSunset) {
        VersioningConfig versioning = VersioningConfig.builder()
                .strategies(List.of(
                        StrategyConfig.of(StrategyKind.HEADER, 1, Map.of()),
                        StrategyConfig.of(StrategyKind.URL_PATH, 2, Map.of())))
                .strictSunset(strictSunset)
                .build();
        return GatewayConfig.builder()
                .serverHost("127.0.0.1")
                .serverPort(0)
                .versioning(versioning)
                .routes(routes())
                .build();
    }

    @BeforeAll
    static void startGateways() {
        Handler usersV2 = ctx -> ctx.contentType("application/json")
                .result("{\"users\":[],\"served_by\":\""
                        + VersionDispatchHandler.resolution(ctx).resolvedVersion() + "\"}");
        gateway = GatewayApp.start(config(false), Map.of("users-v2", usersV2));
        strictGateway = GatewayApp.start(config(true), Map.of());
        client = HttpClient.newHttpClient();
    }

    @AfterAll
    static void stopGateways() {
        if (gateway != null) gateway.stop();
        if (strictGateway != null) strictGateway.stop();
    }

    private static HttpResponse<String> get(GatewayApp app, String path, String... headers)
            throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + app.port() + path));
        if (headers.length > 0) {
            request.headers(headers);
        }
        return client.send(request.GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Sends a request line as-is. {@link HttpClient} refuses URIs with broken percent-escapes, so
     * those go over a plain socket.
     */
    private static String rawGet(GatewayApp app, String target) throws IOException {
        try (Socket socket = new Socket("127.0.0.1", app.port())) {
            socket.setSoTimeout(5_000);
            OutputStream out = socket.getOutputStream();
            out.write(("GET " + target + " HTTP/1.1\r\nHost: 127.0.0.1\r\nConnection: close\r\n\r\n")
                    .getBytes(StandardCharsets.US_ASCII));
            out.flush();
            return new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static int statusOf(String rawResponse) {
        return Integer.parseInt(rawResponse.split(" ", 3)[1]);
    }

    @Nested
    @DisplayName("Root path")
    class RootPath {

        @Test
        @DisplayName("root route is served without a version in the path")
        void unversionedRoot() throws Exception {
            HttpResponse<String> response = get(gateway, "/");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(response.body()).get("handler").asText()).isEqualTo("root-v1");
            assertThat(response.headers().firstValue("X-API-Version")).hasValue("1.0");
        }

        @Test
        @DisplayName("header version resolves at the root path")
        void headerAtRoot() throws Exception {
            HttpResponse<String> response = get(gateway, "/", "X-API-Version", "1.0");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(response.body()).get("requested_version").asText()).isEqualTo("1.0");
        }

        @Test
        @DisplayName("unsupported version at the root path is a problem response, not a plain 404")
        void unsupportedAtRoot() throws Exception {
            HttpResponse<String> response = get(gateway, "/", "X-API-Version", "3.0");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(response.headers().firstValue("Content-Type"))
                    .hasValueSatisfying(ct -> assertThat(ct).startsWith(ProblemDetail.CONTENT_TYPE));
        }

        @Test
        @DisplayName("URL version selects the root route too")
        void urlVersionedRoot() throws Exception {
            HttpResponse<String> response = get(gateway, "/v1");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(response.body()).get("handler").asText()).isEqualTo("root-v1");
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("URL version selects the bound handler and echoes the version header")
        void boundHandler() throws Exception {
            HttpResponse<String> response = get(gateway, "/v2/users");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(response.body()).get("served_by").asText()).isEqualTo("2.0");
            assertThat(response.headers().firstValue("X-API-Version")).hasValue("2.0");
            assertThat(response.headers().firstValue("Deprecation")).isEmpty();
        }

        @Test
        @DisplayName("header beats URL and unbound references reach the echo handler")
        void headerPriority() throws Exception {
            HttpResponse<String> response = get(gateway, "/v2/orders", "X-API-Version", "1.0");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.get("handler").asText()).isEqualTo("orders-v1");
            assertThat(body.get("status").asText()).isEqualTo("deprecated");
        }

        @Test
        @DisplayName("deprecated version carries Deprecation, Sunset, Link and Warning headers")
        void deprecationHeaders() throws Exception {
            HttpResponse<String> response = get(gateway, "/v1/orders");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Deprecation")).hasValue("true");
            assertThat(response.headers().firstValue("Sunset")).hasValue("Thu, 01 Jan 2099 00:00:00 GMT");
            assertThat(response.headers().firstValue("Link")).hasValueSatisfying(link -> assertThat(link)
                    .contains("</v2/orders>; rel=\"successor-version\""));
            assertThat(response.headers().firstValue("Warning")).hasValueSatisfying(w -> assertThat(w)
                    .startsWith("299 - \""));
        }

        @Test
        @DisplayName("unversioned request is served the latest version")
        void latest() throws Exception {
            HttpResponse<String> response = get(gateway, "/orders");

            assertThat(MAPPER.readTree(response.body()).get("version").asText()).isEqualTo("2.0");
        }
    }

    @Nested
    @DisplayName("Problem responses")
    class Problems {

        @Test
        @DisplayName("unsupported version → 400 with available versions")
        void unsupported() throws Exception {
            HttpResponse<String> response = get(gateway, "/v1/users", "X-API-Version", "2.5");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(response.headers().firstValue("Content-Type"))
                    .hasValueSatisfying(ct -> assertThat(ct).startsWith(ProblemDetail.CONTENT_TYPE));
            assertThat(body.get("type").asText()).isEqualTo("urn:api-versioner:error:unsupported-version");
            assertThat(body.get("available_versions")).extracting(JsonNode::asText).containsExactly("1.0", "2.0");
        }

        @Test
        @DisplayName("invalid version token → 400")
        void invalid() throws Exception {
            HttpResponse<String> response = get(gateway, "/users", "X-API-Version", "banana");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(MAPPER.readTree(response.body()).get("type").asText())
                    .isEqualTo("urn:api-versioner:error:invalid-version");
        }

        @Test
        @DisplayName("broken percent-escape in the query → 400 even when the version is in the path")
        void malformedQuery() throws Exception {
            String response = rawGet(gateway, "/v2/users?q=100%");

            assertThat(statusOf(response)).isEqualTo(400);
            assertThat(response).contains(ProblemDetail.CONTENT_TYPE).contains(ProblemDetail.URN_BAD_REQUEST);
        }

        @Test
        @DisplayName("escaped percent sign in the query is served normally")
        void escapedPercentInQuery() throws Exception {
            String response = rawGet(gateway, "/v2/users?q=100%25");

            assertThat(statusOf(response)).isEqualTo(200);
            assertThat(response).contains("\"served_by\":\"2.0\"");
        }

        @Test
        @DisplayName("unknown route → 404")
        void unknownRoute() throws Exception {
            HttpResponse<String> response = get(gateway, "/v1/invoices");

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(MAPPER.readTree(response.body()).get("type").asText())
                    .isEqualTo("urn:api-versioner:error:route-not-found");
        }

        @Test
        @DisplayName("sunset version is served in lenient mode")
        void sunsetLenient() throws Exception {
            HttpResponse<String> response = get(gateway, "/v1/users");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(response.body()).get("status").asText()).isEqualTo("sunset");
        }

        @Test
        @DisplayName("sunset version → 410 in strict-sunset mode, headers still merged")
        void sunsetStrict() throws Exception {
            HttpResponse<String> response = get(strictGateway, "/v1/users");

            assertThat(response.statusCode()).isEqualTo(410);
            assertThat(response.headers().firstValue("Deprecation")).hasValue("true");
            assertThat(MAPPER.readTree(response.body()).get("type").asText())
                    .isEqualTo("urn:api-versioner:error:version-sunset");
        }
    }

    @Nested
    @DisplayName("Operational endpoints")
    class Operational {

        @Test
        @DisplayName("health answers UP without version resolution")
        void health() throws Exception {
            HttpResponse<String> response = get(gateway, "/health");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(response.body()).get("status").asText()).isEqualTo("UP");
            assertThat(response.headers().firstValue("X-API-Version")).isEmpty();
        }

        @Test
        @DisplayName("discovery lists versions with their lifecycle")
        void discovery() throws Exception {
            HttpResponse<String> response = get(gateway, "/versions");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.get("versions").get("1.0").get("is_sunset").asBoolean()).isTrue();
            assertThat(body.get("versions").get("2.0").get("is_deprecated").asBoolean()).isFalse();
            assertThat(body.get("strategies").get(0).get("name").asText()).isEqualTo("header");
        }
    }
}
