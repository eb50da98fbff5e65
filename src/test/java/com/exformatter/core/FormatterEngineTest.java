package com.exformatter.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.exformatter.api.FormatterPlugin;
import com.exformatter.api.FormatterResult;
import com.exformatter.api.error.Severity;
import com.exformatter.config.ConfigurationLoader;
import com.exformatter.config.FormatterConfig;
import com.exformatter.plugins.FileType;
import com.exformatter.plugins.elixir.ElixirFormatterPlugin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatterEngineTest {

    @TempDir
    Path root;

    private FormatterEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("lib"));
        Files.createDirectories(root.resolve("deps/dep"));
        Files.createDirectories(root.resolve("tools"));
        Files.writeString(root.resolve("lib/a.ex"), "1+2\n");
        Files.writeString(root.resolve("deps/dep/b.ex"), "1+2\n");
        Files.writeString(root.resolve("README.md"), "# readme\n");
        Files.writeString(root.resolve("tools/run"), "#!/usr/bin/env elixir\nIO.puts(1)\n");

        engine = new FormatterEngine(ConfigurationLoader.loadDefaultConfig());
        ElixirFormatterPlugin plugin = new ElixirFormatterPlugin();
        engine.registerPlugin(FileType.ELIXIR, plugin);
        engine.registerPlugin(FileType.ELIXIR_SCRIPT, plugin);
    }

    @Test
    void finds_supported_files_outside_ignored_paths() throws IOException {
        assertThat(engine.findFiles(root)).containsExactly(root.resolve("lib/a.ex"), root.resolve("tools/run"));
        assertThat(engine.findFiles(root.resolve("lib/a.ex"))).containsExactly(root.resolve("lib/a.ex"));
        assertThat(engine.findFiles(root.resolve("README.md"))).isEmpty();
        assertThat(engine.findFiles(root.resolve("absent"))).isEmpty();
    }

    @Test
    void formats_a_directory() {
        Map<Path, FormatterResult> results = engine.formatDirectory(root, 2);

        assertThat(results).containsOnlyKeys(root.resolve("lib/a.ex"), root.resolve("tools/run"));
        assertThat(results.get(root.resolve("lib/a.ex")).getFormattedCode()).isEqualTo("1 + 2\n");
        assertThat(results.get(root.resolve("tools/run")).isSuccessful()).isTrue();
        assertThat(engine.getProcessedFileCount()).isEqualTo(2);
        assertThat(engine.getSuccessCount()).isEqualTo(2);
        assertThat(engine.getErrorCount()).isZero();
    }

    @Test
    void unsupported_file_is_a_failure() {
        FormatterResult result = engine.formatFile(root.resolve("README.md"), "# readme\n");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("# readme\n");
        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getSeverity()).isEqualTo(Severity.ERROR);
            assertThat(error.getMessage()).isEqualTo("No plugin registered for file type: UNKNOWN");
        });
        assertThat(engine.getProcessedFileCount()).isZero();
    }

    @Test
    void syntax_errors_are_counted() {
        FormatterResult result = engine.formatFile(root.resolve("lib/a.ex"), "foo(");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    void plugin_crash_is_reported_as_fatal() {
        engine.registerPlugin(FileType.ELIXIR, new FormatterPlugin() {
            @Override
            public String getName() {
                return "crashing";
            }

            @Override
            public void initialize(FormatterConfig config) {
            }

            @Override
            public FormatterResult format(Path filePath, String sourceCode) {
                throw new IllegalStateException("boom");
            }
        });

        FormatterResult result = engine.formatFile(root.resolve("lib/a.ex"), "1+2\n");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("1+2\n");
        assertThat(result.getErrors().get(0).getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(result.getErrors().get(0).getMessage())
                .isEqualTo("Unexpected error: java.lang.IllegalStateException: boom");
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    void unreadable_path_is_a_failure() {
        FormatterResult result = engine.formatPath(root.resolve("lib/absent.ex"));

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isNull();
        assertThat(result.getErrors().get(0).getMessage()).startsWith("Failed to read file: ");
    }

    @Test
    void close_releases_plugins() throws Exception {
        assertThat(engine.hasPluginFor(FileType.ELIXIR)).isTrue();
        assertThat(engine.getPluginCount()).isEqualTo(2);

        engine.close();

        assertThat(engine.getPluginCount()).isZero();
        assertThat(engine.hasPluginFor(FileType.ELIXIR)).isFalse();
    }

    @Test
    void invalid_plugin_options_fail_registration() {
        FormatterEngine strict = new FormatterEngine(ConfigurationLoader.loadDefaultConfig()
                .withGeneralConfig(ConfigurationLoader.LINE_LENGTH, -1));

        assertThatThrownBy(() -> strict.registerPlugin(FileType.ELIXIR, new ElixirFormatterPlugin()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(strict.hasPluginFor(FileType.ELIXIR)).isFalse();
    }
}
