package io.apiversioner.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.apiversioner.core.error.RouteNotFoundException;
import io.apiversioner.core.error.RouteRegistrationException;
import io.apiversioner.core.error.VersionNotFoundException;
import io.apiversioner.core.model.DeprecationHeaderNames;
import io.apiversioner.core.model.DeprecationInfo;
import io.apiversioner.core.model.DeprecationPolicy;
import io.apiversioner.core.model.Version;
import io.apiversioner.core.model.VersionFormat;
import io.apiversioner.core.model.VersionSpec;
import java.time.Clock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VersionRouteTable")
class VersionRouteTableTest {

    private static Version v(String raw) {
        return Version.parse(raw, VersionFormat.SEMANTIC);
    }

    private static VersionRouteTable sampleTable() {
        VersionRouteTable.Builder builder = VersionRouteTable.builder(VersionFormat.SEMANTIC);
        builder.route("/users", "GET").version("2.0").handler("users-v2").register();
        builder.route("/users", "GET").version("1.0").handler("users-v1").register();
        builder.route("/users", "post").version("1.0").handler("create-v1").register();
        builder.route("/users/{id}", "GET").version("1.0").handler("user-v1").register();
        builder.route("/users/me", "GET").version("1.0").handler("me-v1").register();
        builder.route("/files/**", "GET").version("1.0").handler("files-v1").register();
        return builder.build();
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        private final VersionRouteTable table = sampleTable();

        @Test
        @DisplayName("returns all versions of the route ascending")
        void allVersionsAscending() {
            assertThat(table.lookup("/users", "GET"))
                    .extracting(VersionSpec::handlerRef)
                    .containsExactly("users-v1", "users-v2");
            assertThat(table.availableVersions("/users", "get")).containsExactly(v("1.0"), v("2.0"));
        }

        @Test
        @DisplayName("method distinguishes routes")
        void methodMatters() {
            assertThat(table.lookup("/users", "POST").first().handlerRef()).isEqualTo("create-v1");
            assertThatThrownBy(() -> table.lookup("/users", "DELETE")).isInstanceOf(RouteNotFoundException.class);
        }

        @Test
        @DisplayName("most literal segments wins")
        void mostSpecificWins() {
            assertThat(table.lookup("/users/me", "GET").first().handlerRef()).isEqualTo("me-v1");
            assertThat(table.lookup("/users/42", "GET").first().handlerRef()).isEqualTo("user-v1");
            assertThat(table.lookup("/files/a/b", "GET").first().handlerRef()).isEqualTo("files-v1");
        }

        @Test
        @DisplayName("trailing slash is ignored")
        void trailingSlash() {
            assertThat(table.lookup("/users/", "GET")).hasSize(2);
        }

        @Test
        @DisplayName("unknown path → RouteNotFoundException")
        void unknownPath() {
            assertThatThrownBy(() -> table.lookup("/orders", "GET"))
                    .isInstanceOf(RouteNotFoundException.class)
                    .hasMessageContaining("GET /orders");
        }

        @Test
        @DisplayName("lookupExact → VersionNotFoundException for a missing version")
        void lookupExact() {
            assertThat(table.lookupExact("/users", "GET", v("2.0")).handlerRef()).isEqualTo("users-v2");
            assertThatThrownBy(() -> table.lookupExact("/users", "GET", v("3.0")))
                    .isInstanceOf(VersionNotFoundException.class)
                    .satisfies(e -> assertThat(((VersionNotFoundException) e).version()).isEqualTo(v("3.0")));
        }

        @Test
        @DisplayName("versions() and specs() cover every route")
        void introspection() {
            assertThat(table.versions()).containsExactly(v("1.0"), v("2.0"));
            assertThat(table.specs()).hasSize(6);
        }
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("duplicate (path, method, version) is rejected")
        void duplicate() {
            VersionRouteTable.Builder builder = VersionRouteTable.builder(VersionFormat.SEMANTIC);
            builder.route("/users", "GET").version("1.0").handler("a").register();

            assertThatThrownBy(() -> builder.route("/users/", "get").version("1").handler("b").register())
                    .isInstanceOf(RouteRegistrationException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("setting an attribute twice is rejected")
        void doubleSet() {
            VersionRouteTable.RouteBuilder route =
                    VersionRouteTable.builder(VersionFormat.SEMANTIC).route("/users", "GET").version("1.0");

            assertThatThrownBy(() -> route.version("2.0"))
                    .isInstanceOf(RouteRegistrationException.class)
                    .hasMessageContaining("'version' already set");
            route.handler("h");
            assertThatThrownBy(() -> route.handler("other")).isInstanceOf(RouteRegistrationException.class);
            route.deprecated(DeprecationInfo.builder().build());
            assertThatThrownBy(() -> route.deprecated(DeprecationInfo.builder().build()))
                    .isInstanceOf(RouteRegistrationException.class);
        }

        @Test
        @DisplayName("missing version or handler is rejected")
        void incomplete() {
            VersionRouteTable.Builder builder = VersionRouteTable.builder(VersionFormat.SEMANTIC);

            assertThatThrownBy(() -> builder.route("/users", "GET").handler("h").register())
                    .isInstanceOf(RouteRegistrationException.class)
                    .hasMessageContaining("no version");
            assertThatThrownBy(() -> builder.route("/users", "GET").version("1.0").register())
                    .isInstanceOf(RouteRegistrationException.class)
                    .hasMessageContaining("no handler");
        }

        @Test
        @DisplayName("every call after build() is rejected")
        void afterBuild() {
            VersionRouteTable.Builder builder = VersionRouteTable.builder(VersionFormat.SEMANTIC);
            VersionRouteTable.RouteBuilder pending = builder.route("/late", "GET").version("1.0");
            builder.build();

            assertThatThrownBy(() -> builder.route("/users", "GET")).isInstanceOf(RouteRegistrationException.class);
            assertThatThrownBy(builder::build).isInstanceOf(RouteRegistrationException.class);
            assertThatThrownBy(() -> pending.handler("h")).isInstanceOf(RouteRegistrationException.class);
        }

        @Test
        @DisplayName("version of another format is rejected")
        void formatMismatch() {
            VersionRouteTable.Builder builder = VersionRouteTable.builder(VersionFormat.SIMPLE);

            assertThatThrownBy(() -> builder.register(
                            new VersionSpec("/users", "GET", Version.parse("2024-01-01", VersionFormat.DATE), "h", null)))
                    .isInstanceOf(RouteRegistrationException.class)
                    .hasMessageContaining("DATE");
        }

        @Test
        @DisplayName("deprecation policy is enforced at build time")
        void policyAtBuild() {
            VersionRouteTable.Builder builder = VersionRouteTable.builder(VersionFormat.SEMANTIC)
                    .deprecationRegistry(new DeprecationRegistry(
                            DeprecationHeaderNames.DEFAULTS, new DeprecationPolicy(true, false), Clock.systemUTC()));
            builder.route("/users", "GET")
                    .version("1.0")
                    .handler("h")
                    .deprecated(DeprecationInfo.builder().reason("old").build())
                    .register();

            assertThatThrownBy(builder::build)
                    .isInstanceOf(RouteRegistrationException.class)
                    .hasMessageContaining("replacement");
        }
    }
}
