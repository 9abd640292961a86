package io.apiversioner.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.apiversioner.core.error.ConfigParseException;
import io.apiversioner.core.model.DeprecationInfo;
import io.apiversioner.core.model.Version;
import io.apiversioner.core.model.VersionFormat;
import io.apiversioner.core.model.VersionSpec;
import io.apiversioner.core.model.WarningLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("RouteManifestParser")
class RouteManifestParserTest {

    private final RouteManifestParser parser = new RouteManifestParser();

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("routes.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("Sample manifest")
    class Sample {

        private final List<VersionSpec> specs =
                parser.parse(Path.of("src/test/resources/config/routes-sample.yaml"), VersionFormat.SEMANTIC);

        @Test
        @DisplayName("one spec per route version, method defaulting to GET")
        void flattened() {
            assertThat(specs).hasSize(3);
            assertThat(specs.get(0).method()).isEqualTo("GET");
            assertThat(specs.get(0).version()).isEqualTo(Version.parse("1.0", VersionFormat.SEMANTIC));
            assertThat(specs.get(1).handlerRef()).isEqualTo("users-v2");
            assertThat(specs.get(1).isDeprecated()).isFalse();
        }

        @Test
        @DisplayName("deprecation object maps every field")
        void deprecationObject() {
            DeprecationInfo info = specs.get(0).deprecation();

            assertThat(info.sunsetDate()).isEqualTo(Instant.parse("2030-01-01T00:00:00Z"));
            assertThat(info.warningLevel()).isEqualTo(WarningLevel.CRITICAL);
            assertThat(info.replacement()).isEqualTo("/v2/users");
            assertThat(info.reason()).isEqualTo("Replaced by paginated listing");
            assertThat(info.migrationGuide()).isEqualTo("https://docs.example.com/migrate/users-v2");
        }

        @Test
        @DisplayName("deprecated: true means deprecated without metadata; method is uppercased")
        void deprecatedFlag() {
            VersionSpec delete = specs.get(2);

            assertThat(delete.method()).isEqualTo("DELETE");
            assertThat(delete.pathTemplate()).isEqualTo("/users/{id}");
            assertThat(delete.isDeprecated()).isTrue();
            assertThat(delete.deprecation().sunsetDate()).isNull();
            assertThat(delete.deprecation().warningLevel()).isEqualTo(WarningLevel.WARNING);
        }
    }

    @Nested
    @DisplayName("Sunset parsing")
    class Sunset {

        @Test
        @DisplayName("calendar date is midnight UTC")
        void date() {
            assertThat(RouteManifestParser.parseSunset("2030-01-01", "/x", null))
                    .isEqualTo(Instant.parse("2030-01-01T00:00:00Z"));
        }

        @Test
        @DisplayName("instant with Z is taken as is")
        void instant() {
            assertThat(RouteManifestParser.parseSunset("2030-01-01T12:30:00Z", "/x", null))
                    .isEqualTo(Instant.parse("2030-01-01T12:30:00Z"));
        }

        @Test
        @DisplayName("garbage is a parse error naming the route")
        void garbage() {
            assertThatThrownBy(() -> RouteManifestParser.parseSunset("next tuesday", "/users", "routes.yaml"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("/users")
                    .hasMessageContaining("next tuesday");
        }
    }

    @Nested
    @DisplayName("Rejected manifests")
    class Rejected {

        @Test
        @DisplayName("route with no versions fails schema validation")
        void emptyVersions() {
            assertThatThrownBy(() -> parser.parse(
                            Path.of("src/test/resources/config/invalid/route-without-versions.yaml"),
                            VersionFormat.SEMANTIC))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("Invalid 'routes' document");
        }

        @Test
        @DisplayName("missing routes block")
        void missingBlock() throws IOException {
            Path file = write("versioning: {}\n");

            assertThatThrownBy(() -> parser.parse(file, VersionFormat.SEMANTIC))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("routes");
        }

        @Test
        @DisplayName("unsupported HTTP method")
        void badMethod() throws IOException {
            Path file = write("""
                    routes:
                      - path: /users
                        method: FETCH
                        versions:
                          - version: "1.0"
                            handler: h
                    """);

            assertThatThrownBy(() -> parser.parse(file, VersionFormat.SEMANTIC))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("FETCH");
        }

        @Test
        @DisplayName("version not matching the configured format")
        void wrongFormat() throws IOException {
            Path file = write("""
                    routes:
                      - path: /users
                        versions:
                          - version: "1.0"
                            handler: h
                    """);

            assertThatThrownBy(() -> parser.parse(file, VersionFormat.DATE))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("/users");
        }

        @Test
        @DisplayName("invalid sunset in a manifest")
        void badSunset() throws IOException {
            Path file = write("""
                    routes:
                      - path: /users
                        versions:
                          - version: "1.0"
                            handler: h
                            deprecated:
                              sunset: "2030-13-45"
                    """);

            assertThatThrownBy(() -> parser.parse(file, VersionFormat.SEMANTIC))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("invalid sunset");
        }
    }
}
