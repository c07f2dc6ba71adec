package io.flowrules.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/** Tests for {@link RulesConfig}. */
class RulesConfigTest {

    @Test
    void builderDefaults() {
        RulesConfig config = RulesConfig.builder().build();

        assertThat(config.engine()).isEqualTo(RulesConfig.ENGINE_STRICT);
        assertThat(config.parseCache()).isTrue();
        assertThat(config.flowsFile()).isEqualTo("flows.yaml");
        assertThat(config.defaultFlow()).isEqualTo("welcome");
        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("WARN");
    }

    @Test
    void toBuilderCopiesEveryField() {
        RulesConfig original = RulesConfig.builder()
                .engine("legacy")
                .parseCache(false)
                .flowsFile("a.yaml")
                .defaultFlow("promo")
                .loggingFormat("json")
                .loggingLevel("INFO")
                .build();

        assertThat(original.toBuilder().build()).isEqualTo(original);
        assertThat(original.toBuilder().engine("strict").build().flowsFile()).isEqualTo("a.yaml");
    }

    @Test
    void nullEngineIsRejected() {
        assertThatThrownBy(() -> RulesConfig.builder().engine(null).build())
                .isInstanceOf(ConfigLoadException.class)
                .hasMessage("Invalid rules engine 'null': expected 'strict' or 'legacy'");
    }
}
