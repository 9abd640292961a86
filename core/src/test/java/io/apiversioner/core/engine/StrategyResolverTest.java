package io.apiversioner.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.apiversioner.core.error.InvalidVersionException;
import io.apiversioner.core.error.MissingVersionException;
import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.model.ResolutionSource;
import io.apiversioner.core.model.StrategyKind;
import io.apiversioner.core.model.Version;
import io.apiversioner.core.model.VersionFormat;
import io.apiversioner.core.strategy.HeaderStrategy;
import io.apiversioner.core.strategy.QueryParameterStrategy;
import io.apiversioner.core.strategy.VersionStrategy;
import io.apiversioner.core.testkit.TestRequests;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StrategyResolver")
class StrategyResolverTest {

    private static final Version V1 = Version.parse("1.0", VersionFormat.SEMANTIC);

    /** Strategy returning a fixed token and counting how often it was asked. */
    private static final class SpyStrategy implements VersionStrategy {
        private final String name;
        private final int priority;
        private final String token;
        private int calls;

        SpyStrategy(String name, int priority, String token) {
            this.name = name;
            this.priority = priority;
            this.token = token;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public StrategyKind kind() {
            return StrategyKind.HEADER;
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public Optional<String> extract(RequestView request) {
            calls++;
            return Optional.ofNullable(token);
        }
    }

    private static StrategyResolver resolver(List<VersionStrategy> strategies, Version defaultVersion, boolean strict) {
        return new StrategyResolver(strategies, VersionFormat.SEMANTIC, defaultVersion, strict);
    }

    @Nested
    @DisplayName("Priority and short-circuit")
    class PriorityOrder {

        @Test
        @DisplayName("first successful strategy wins and later ones never run")
        void shortCircuit() {
            SpyStrategy header = new SpyStrategy("header", 1, "2.0");
            SpyStrategy query = new SpyStrategy("query", 2, "3.0");

            RequestedVersion result = resolver(List.of(query, header), null, false)
                    .resolve(TestRequests.get("/").build());

            assertThat(result.version()).isEqualTo(Version.parse("2.0", VersionFormat.SEMANTIC));
            assertThat(result.source()).isEqualTo(ResolutionSource.STRATEGY);
            assertThat(result.strategyName()).isEqualTo("header");
            assertThat(result.rawToken()).isEqualTo("2.0");
            assertThat(header.calls).isEqualTo(1);
            assertThat(query.calls).isZero();
        }

        @Test
        @DisplayName("empty strategies are skipped in priority order")
        void skipsEmpty() {
            SpyStrategy empty = new SpyStrategy("empty", 1, null);
            SpyStrategy found = new SpyStrategy("found", 2, "1.5");

            RequestedVersion result =
                    resolver(List.of(found, empty), null, false).resolve(TestRequests.get("/").build());

            assertThat(result.strategyName()).isEqualTo("found");
            assertThat(empty.calls).isEqualTo(1);
        }

        @Test
        @DisplayName("header beats query parameter when configured first")
        void realStrategies() {
            StrategyResolver resolver = resolver(
                    List.of(new QueryParameterStrategy(2, null, List.of()), new HeaderStrategy(1, null, List.of(), null)),
                    null,
                    false);

            RequestedVersion result = resolver.resolve(TestRequests.get("/users")
                    .header("X-API-Version", "2.0")
                    .query("version", "1.0")
                    .build());

            assertThat(result.version()).hasToString("2.0");
        }
    }

    @Nested
    @DisplayName("Invalid tokens")
    class InvalidTokens {

        @Test
        @DisplayName("unparseable token fails and names the strategy")
        void invalidToken() {
            StrategyResolver resolver = resolver(List.of(new SpyStrategy("header", 1, "banana")), V1, false);

            assertThatThrownBy(() -> resolver.resolve(TestRequests.get("/users").build()))
                    .isInstanceOf(InvalidVersionException.class)
                    .satisfies(e -> {
                        InvalidVersionException ive = (InvalidVersionException) e;
                        assertThat(ive.token()).isEqualTo("banana");
                        assertThat(ive.strategyName()).isEqualTo("header");
                        assertThat(ive.requestPath()).isEqualTo("/users");
                    });
        }

        @Test
        @DisplayName("invalid token is never replaced by a later strategy or the default")
        void invalidTokenNotDefaulted() {
            SpyStrategy later = new SpyStrategy("query", 2, "1.0");
            StrategyResolver resolver = resolver(List.of(new SpyStrategy("header", 1, "x.y"), later), V1, false);

            assertThatThrownBy(() -> resolver.resolve(TestRequests.get("/").build()))
                    .isInstanceOf(InvalidVersionException.class);
            assertThat(later.calls).isZero();
        }
    }

    @Nested
    @DisplayName("No token")
    class NoToken {

        private final List<VersionStrategy> none = List.of(new SpyStrategy("header", 1, null));

        @Test
        @DisplayName("default version applies")
        void defaultApplies() {
            RequestedVersion result = resolver(none, V1, false).resolve(TestRequests.get("/").build());

            assertThat(result.version()).isEqualTo(V1);
            assertThat(result.source()).isEqualTo(ResolutionSource.DEFAULT);
            assertThat(result.strategyName()).isNull();
        }

        @Test
        @DisplayName("default applies even in strict mode")
        void defaultInStrictMode() {
            RequestedVersion result = resolver(none, V1, true).resolve(TestRequests.get("/").build());

            assertThat(result.source()).isEqualTo(ResolutionSource.DEFAULT);
        }

        @Test
        @DisplayName("strict mode without default fails listing the strategies tried")
        void strictWithoutDefault() {
            assertThatThrownBy(() -> resolver(none, null, true).resolve(TestRequests.get("/orders").build()))
                    .isInstanceOf(MissingVersionException.class)
                    .satisfies(e -> assertThat(((MissingVersionException) e).strategiesTried())
                            .containsExactly("header"));
        }

        @Test
        @DisplayName("lenient mode without default reports UNSPECIFIED")
        void lenientWithoutDefault() {
            RequestedVersion result = resolver(none, null, false).resolve(TestRequests.get("/").build());

            assertThat(result.source()).isEqualTo(ResolutionSource.UNSPECIFIED);
            assertThat(result.isSpecified()).isFalse();
        }
    }
}
