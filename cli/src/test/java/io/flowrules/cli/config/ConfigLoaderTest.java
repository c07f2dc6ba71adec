package io.flowrules.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link ConfigLoader} file handling and defaults. */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    @Test
    @DisplayName("full config populates every field")
    void fullConfig() throws Exception {
        RulesConfig config = ConfigLoader.load(resource("config/full-config.yaml"), NO_ENV);

        assertThat(config.engine()).isEqualTo("legacy");
        assertThat(config.parseCache()).isFalse();
        assertThat(config.flowsFile()).isEqualTo("catalogs/onboarding.yaml");
        assertThat(config.defaultFlow()).isEqualTo("promo");
        assertThat(config.loggingFormat()).isEqualTo("json");
        assertThat(config.loggingLevel()).isEqualTo("DEBUG");
    }

    @Test
    @DisplayName("minimal config keeps defaults for absent keys")
    void minimalConfig() throws Exception {
        RulesConfig config = ConfigLoader.load(resource("config/minimal-config.yaml"), NO_ENV);

        assertThat(config).isEqualTo(RulesConfig.builder().build());
    }

    @Test
    @DisplayName("empty file yields defaults")
    void emptyFile() throws Exception {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertThat(ConfigLoader.load(file, NO_ENV)).isEqualTo(RulesConfig.builder().build());
    }

    @Test
    @DisplayName("missing file is rejected with a hint")
    void missingFile() {
        Path missing = tempDir.resolve("absent.yaml");

        assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Configuration file not found")
                .hasMessageContaining("--config");
    }

    @Test
    @DisplayName("malformed YAML is rejected")
    void malformedYaml() throws Exception {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "rules: [engine: strict\n");

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageStartingWith("Failed to parse YAML configuration");
    }

    @Test
    @DisplayName("non-mapping root is rejected")
    void nonMappingRoot() throws Exception {
        Path file = tempDir.resolve("list.yaml");
        Files.writeString(file, "- strict\n- legacy\n");

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessage("Configuration root must be a YAML mapping");
    }

    @Test
    @DisplayName("unknown engine in YAML is rejected")
    void invalidEngine() throws Exception {
        Path file = tempDir.resolve("bad-engine.yaml");
        Files.writeString(file, "rules:\n  engine: turbo\n");

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessage("Invalid rules engine 'turbo': expected 'strict' or 'legacy'");
    }

    @Test
    @DisplayName("engine name is case-insensitive")
    void engineCaseInsensitive() throws Exception {
        Path file = tempDir.resolve("upper.yaml");
        Files.writeString(file, "rules:\n  engine: ' LEGACY '\n");

        assertThat(ConfigLoader.load(file, NO_ENV).engine()).isEqualTo("legacy");
    }

    @Test
    @DisplayName("resolve without a path falls back to defaults plus environment")
    void resolveWithoutPath() {
        RulesConfig config = ConfigLoader.resolve(null, Map.of("DEFAULT_FLOW", "promo")::get);

        assertThat(config.defaultFlow()).isEqualTo("promo");
        assertThat(config.engine()).isEqualTo(RulesConfig.ENGINE_STRICT);
    }

    @Test
    @DisplayName("resolve with a path loads that file")
    void resolveWithPath() throws Exception {
        assertThat(ConfigLoader.resolve(resource("config/full-config.yaml"), NO_ENV).engine())
                .isEqualTo("legacy");
    }
}
