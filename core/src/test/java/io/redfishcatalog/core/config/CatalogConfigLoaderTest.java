package io.redfishcatalog.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.redfishcatalog.core.engine.ValidationMode;
import io.redfishcatalog.core.testkit.TestSchemas;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CatalogConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static Path fixture() throws URISyntaxException {
        return Path.of(CatalogConfigLoaderTest.class.getResource("/config/catalog.yaml").toURI());
    }

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("catalog.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("YAML")
    class Yaml {

        @Test
        void readsEveryKey() throws Exception {
            CatalogConfig config = CatalogConfigLoader.load(fixture(), name -> null);

            assertThat(config.schemaDirectory()).isEqualTo(TestSchemas.main().toAbsolutePath().normalize());
            assertThat(config.schemaSuffix()).isEqualTo("_v1.xml");
            assertThat(config.validationMode()).isEqualTo(ValidationMode.STRICT);
            assertThat(config.oemCheck()).isFalse();
            assertThat(config.fuzzyEnabled()).isTrue();
            assertThat(config.fuzzyMinSimilarity()).isEqualTo(0.8);
        }

        @Test
        void omittedKeysTakeDefaults() throws Exception {
            CatalogConfig config = CatalogConfigLoader.load(write("schema:\n  directory: /srv/schemas\n"), name -> null);

            assertThat(config.schemaDirectory()).isEqualTo(Path.of("/srv/schemas"));
            assertThat(config.schemaSuffix()).isEqualTo(CatalogConfig.DEFAULT_SCHEMA_SUFFIX);
            assertThat(config.validationMode()).isEqualTo(ValidationMode.LENIENT);
            assertThat(config.oemCheck()).isTrue();
            assertThat(config.fuzzyMinSimilarity()).isEqualTo(CatalogConfig.DEFAULT_FUZZY_MIN_SIMILARITY);
        }

        @Test
        void relativeDirectoryResolvesAgainstConfigFile() throws Exception {
            CatalogConfig config = CatalogConfigLoader.load(write("schema:\n  directory: metadata\n"), name -> null);

            assertThat(config.schemaDirectory()).isEqualTo(tempDir.toAbsolutePath().resolve("metadata"));
        }
    }

    @Nested
    @DisplayName("environment overlay")
    class EnvOverlay {

        @Test
        void envWinsOverYaml() throws Exception {
            Map<String, String> env = Map.of(
                    "RFC_VALIDATION_MODE", "lenient",
                    "RFC_VALIDATION_OEM_CHECK", "true",
                    "RFC_FUZZY_MIN_SIMILARITY", " 0.5 ",
                    "RFC_SCHEMA_DIRECTORY", "/opt/schemas");

            CatalogConfig config = CatalogConfigLoader.load(fixture(), env::get);

            assertThat(config.validationMode()).isEqualTo(ValidationMode.LENIENT);
            assertThat(config.oemCheck()).isTrue();
            assertThat(config.fuzzyMinSimilarity()).isEqualTo(0.5);
            assertThat(config.schemaDirectory()).isEqualTo(Path.of("/opt/schemas"));
        }

        @Test
        void blankEnvValueIsIgnored() throws Exception {
            CatalogConfig config = CatalogConfigLoader.load(fixture(), Map.of("RFC_VALIDATION_MODE", "   ")::get);

            assertThat(config.validationMode()).isEqualTo(ValidationMode.STRICT);
        }

        @Test
        void directoryMayComeFromEnvAlone() throws Exception {
            CatalogConfig config =
                    CatalogConfigLoader.load(write("fuzzy:\n  enabled: false\n"), Map.of("RFC_SCHEMA_DIRECTORY", "/x")::get);

            assertThat(config.schemaDirectory()).isEqualTo(Path.of("/x"));
            assertThat(config.fuzzyEnabled()).isFalse();
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void missingFile() {
            assertThatThrownBy(() -> CatalogConfigLoader.load(tempDir.resolve("absent.yaml"), name -> null))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        void missingDirectory() throws Exception {
            Path file = write("validation:\n  mode: strict\n");

            assertThatThrownBy(() -> CatalogConfigLoader.load(file, name -> null))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("schema.directory");
        }

        @Test
        void invalidMode() throws Exception {
            Path file = write("schema:\n  directory: /s\nvalidation:\n  mode: paranoid\n");

            assertThatThrownBy(() -> CatalogConfigLoader.load(file, name -> null))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("paranoid");
        }

        @Test
        void similarityOutOfRange() throws Exception {
            Path file = write("schema:\n  directory: /s\nfuzzy:\n  min-similarity: 1.5\n");

            assertThatThrownBy(() -> CatalogConfigLoader.load(file, name -> null))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("fuzzyMinSimilarity");
        }

        @Test
        void malformedYaml() throws Exception {
            Path file = write("schema: [unclosed\n");

            assertThatThrownBy(() -> CatalogConfigLoader.load(file, name -> null))
                    .isInstanceOf(ConfigLoadException.class);
        }

        @Test
        void nonNumericEnvSimilarity() throws Exception {
            Path file = write("schema:\n  directory: /s\n");

            assertThatThrownBy(() -> CatalogConfigLoader.load(file, Map.of("RFC_FUZZY_MIN_SIMILARITY", "high")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Not a number");
        }
    }
}
