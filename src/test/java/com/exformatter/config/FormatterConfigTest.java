package com.exformatter.config;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FormatterConfigTest {
    private final FormatterConfig config = new FormatterConfig(
            Map.of("lineLength", "120", "ratio", 1.5),
            Map.of("elixir", Map.of("checkEquivalent", "false", "localsWithoutParens", "plug/1")));

    @Test
    void values_are_coerced_to_the_default_type() {
        assertThat(config.getGeneralConfig("lineLength", 98)).isEqualTo(120);
        assertThat(config.getGeneralConfig("ratio", 0)).isEqualTo(1);
        assertThat(config.getGeneralConfig("ratio", "")).isEqualTo("1.5");
        assertThat(config.getPluginConfig("elixir", "checkEquivalent", true)).isFalse();
    }

    @Test
    void missing_values_use_the_default() {
        assertThat(config.getGeneralConfig("absent", 7)).isEqualTo(7);
        assertThat(config.getPluginConfig("other", "checkEquivalent", true)).isTrue();
        assertThat(config.getPluginConfigList("other", "localsWithoutParens")).isEmpty();
    }

    @Test
    void scalar_is_read_as_single_element_list() {
        assertThat(config.getPluginConfigList("elixir", "localsWithoutParens")).isEqualTo(List.of("plug/1"));
    }

    @Test
    void with_general_config_returns_a_copy() {
        FormatterConfig changed = config.withGeneralConfig("lineLength", 80);

        assertThat(changed.getGeneralConfig("lineLength", 0)).isEqualTo(80);
        assertThat(config.getGeneralConfig("lineLength", 0)).isEqualTo(120);
        assertThat(changed.getPluginConfig("elixir", "checkEquivalent", true)).isFalse();
    }
}
