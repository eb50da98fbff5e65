package com.exformatter.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaults_come_from_bundled_resource() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getGeneralConfig(ConfigurationLoader.LINE_LENGTH, 0)).isEqualTo(98);
        assertThat(config.getGeneralConfig(ConfigurationLoader.IGNORE_FILES, List.of()))
                .isEqualTo(List.of("deps/**", "_build/**"));
        assertThat(config.getPluginConfigList(ConfigurationLoader.ELIXIR_PLUGIN,
                ConfigurationLoader.LOCALS_WITHOUT_PARENS)).isEmpty();
        assertThat(config.getPluginConfig(ConfigurationLoader.ELIXIR_PLUGIN,
                ConfigurationLoader.CHECK_EQUIVALENT, false)).isTrue();
        assertThat(config.getPluginConfigsMap().get(ConfigurationLoader.ELIXIR_PLUGIN))
                .doesNotContainKey(ConfigurationLoader.RENAME_DEPRECATED_AT);
        assertThat(ConfigurationLoader.loadDefaultConfig()).isSameAs(config);
    }

    @Test
    void missing_file_falls_back_to_defaults() {
        assertThat(ConfigurationLoader.loadConfig(null)).isSameAs(ConfigurationLoader.loadDefaultConfig());
        assertThat(ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml")))
                .isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void unparsable_file_falls_back_to_defaults() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "general: [unclosed\n");

        assertThat(ConfigurationLoader.loadConfig(file)).isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void values_from_file_are_used() throws IOException {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, """
                general:
                  lineLength: 80
                plugins:
                  elixir:
                    localsWithoutParens: [plug/1, "field/*"]
                    renameDeprecatedAt: "1.6.0"
                """);

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getGeneralConfig(ConfigurationLoader.LINE_LENGTH, 0)).isEqualTo(80);
        assertThat(config.getGeneralConfig(ConfigurationLoader.IGNORE_FILES, List.of("x"))).isEmpty();
        assertThat(config.getPluginConfigList(ConfigurationLoader.ELIXIR_PLUGIN,
                ConfigurationLoader.LOCALS_WITHOUT_PARENS)).containsExactly("plug/1", "field/*");
        assertThat(config.getPluginConfig(ConfigurationLoader.ELIXIR_PLUGIN,
                ConfigurationLoader.RENAME_DEPRECATED_AT, "")).isEqualTo("1.6.0");
        assertThat(config.getPluginConfig(ConfigurationLoader.ELIXIR_PLUGIN,
                ConfigurationLoader.CHECK_EQUIVALENT, false)).isTrue();
    }

    @Test
    void line_length_out_of_range_uses_default() throws IOException {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, "general:\n  lineLength: 5\n");

        assertThat(ConfigurationLoader.loadConfig(file).getGeneralConfig(ConfigurationLoader.LINE_LENGTH, 0))
                .isEqualTo(ConfigurationLoader.DEFAULT_LINE_LENGTH);
    }

    @Test
    void saved_config_loads_back() throws IOException {
        Path file = tempDir.resolve("nested/dir/.exformatter.yml");
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig()
                .withGeneralConfig(ConfigurationLoader.LINE_LENGTH, 120);

        ConfigurationLoader.saveConfig(config, file);

        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("general:", "plugins:", "elixir:");
        FormatterConfig loaded = ConfigurationLoader.loadConfig(file);
        assertThat(loaded.getGeneralConfig(ConfigurationLoader.LINE_LENGTH, 0)).isEqualTo(120);
        assertThat(loaded.getGeneralConfig(ConfigurationLoader.IGNORE_FILES, List.of()))
                .isEqualTo(List.of("deps/**", "_build/**"));
    }
}
