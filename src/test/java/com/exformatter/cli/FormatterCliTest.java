package com.exformatter.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class FormatterCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private Path config;
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        config = tempDir.resolve(".exformatter.yml");
        Files.writeString(config, "general:\n  lineLength: 98\n");
        source = tempDir.resolve("lib/a.ex");
        Files.createDirectories(source.getParent());
        Files.writeString(source, "foo 1,2\n");
    }

    private int run(String... args) {
        return FormatterCli.run(args, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void version_and_help() {
        assertThat(run("--version")).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(output()).contains("exformatter 1.0.0");

        assertThat(run("-h")).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(output()).contains("Usage:");
    }

    @Test
    void bad_invocations_fail() {
        assertThat(run()).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(run("reformat")).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Unknown command: reformat");
        assertThat(run("format")).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Error: Missing path argument");
        assertThat(run("format", tempDir.resolve("absent").toString())).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Error: Path does not exist:");
        assertThat(run("format", tempDir.toString(), "--config=" + config, "--line-length=wide"))
                .isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Error: invalid --line-length: wide");
    }

    @Test
    void check_reports_without_writing() throws IOException {
        assertThat(run("check", tempDir.toString(), "--config=" + config, "--no-color"))
                .isEqualTo(FormatterCli.EXIT_FAILURE);

        assertThat(output()).contains("Not formatted: " + source, "1 need formatting, 0 with errors");
        assertThat(Files.readString(source)).isEqualTo("foo 1,2\n");
    }

    @Test
    void format_writes_files_then_check_passes() throws IOException {
        assertThat(run("format", tempDir.toString(), "--config=" + config, "--no-color"))
                .isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(source)).isEqualTo("foo(1, 2)\n");
        assertThat(output()).contains("Formatted: " + source);

        assertThat(run("check", tempDir.toString(), "--config=" + config, "--ci"))
                .isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void include_filters_by_file_name() throws IOException {
        assertThat(run("format", tempDir.toString(), "--config=" + config, "--include=*.exs"))
                .isEqualTo(FormatterCli.EXIT_OK);

        assertThat(Files.readString(source)).isEqualTo("foo 1,2\n");
    }

    @Test
    void syntax_errors_are_listed_and_fail() throws IOException {
        Files.writeString(source, "foo(\n");

        assertThat(run("format", tempDir.toString(), "--config=" + config, "--no-color"))
                .isEqualTo(FormatterCli.EXIT_FAILURE);

        assertThat(output()).contains(source + ":1:", "FATAL", "Error Summary:", "Total: 1 fatal");
        assertThat(Files.readString(source)).isEqualTo("foo(\n");
    }

    @Test
    void init_does_not_overwrite_without_force() throws IOException {
        Path target = tempDir.resolve("conf/.exformatter.yml");

        assertThat(run("init", "--config=" + target)).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(target)).contains("lineLength: 98");

        assertThat(run("init", "--config=" + target)).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(output()).contains("Configuration file already exists: " + target);

        assertThat(run("init", "--config=" + target, "--force")).isEqualTo(FormatterCli.EXIT_OK);
    }
}
