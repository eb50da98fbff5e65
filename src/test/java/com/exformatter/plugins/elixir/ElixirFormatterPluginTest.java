package com.exformatter.plugins.elixir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.exformatter.api.FormatterResult;
import com.exformatter.api.Refactoring;
import com.exformatter.api.error.FormatterError;
import com.exformatter.api.error.Severity;
import com.exformatter.config.ConfigurationLoader;
import com.exformatter.config.FormatterConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElixirFormatterPluginTest {
    private static final Path FILE = Path.of("lib/a.ex");

    private static ElixirFormatterPlugin plugin(Map<String, Object> elixirOptions) {
        ElixirFormatterPlugin plugin = new ElixirFormatterPlugin();
        plugin.initialize(new FormatterConfig(
                Map.of(ConfigurationLoader.LINE_LENGTH, 98),
                Map.of(ConfigurationLoader.ELIXIR_PLUGIN, elixirOptions)));
        return plugin;
    }

    @Test
    void formats_and_ends_with_newline() {
        ElixirFormatterPlugin plugin = plugin(Map.of());

        FormatterResult result = plugin.format(FILE, "1+2");

        assertThat(plugin.getName()).isEqualTo("elixir");
        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("1 + 2\n");
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.changes("1+2")).isTrue();
        assertThat(result.changes("1 + 2\n")).isFalse();
    }

    @Test
    void same_input_is_served_from_cache() {
        ElixirFormatterPlugin plugin = plugin(Map.of());

        FormatterResult first = plugin.format(FILE, "foo 1");

        assertThat(plugin.format(FILE, "foo 1")).isSameAs(first);
        plugin.clearCache();
        assertThat(plugin.format(FILE, "foo 1")).isNotSameAs(first);
    }

    @Test
    void sources_with_equal_hash_codes_get_their_own_results() {
        ElixirFormatterPlugin plugin = plugin(Map.of());
        assertThat(":Aa".hashCode()).isEqualTo(":BB".hashCode());

        FormatterResult first = plugin.format(FILE, ":Aa");
        FormatterResult second = plugin.format(FILE, ":BB");

        assertThat(first.getFormattedCode()).isEqualTo(":Aa\n");
        assertThat(second.getFormattedCode()).isEqualTo(":BB\n");
        assertThat(plugin.format(FILE, ":Aa")).isSameAs(first);
    }

    @Test
    void syntax_error_leaves_source_untouched() {
        FormatterResult result = plugin(Map.of()).format(FILE, "foo(");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("foo(");
        assertThat(result.changes("foo(")).isFalse();
        FormatterError error = result.getErrors().get(0);
        assertThat(error.getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(error.getLine()).isEqualTo(1);
        assertThat(error.getMessage()).startsWith("syntax error");
        assertThat(error.getSuggestion()).isEqualTo("Fix the syntax error and run the formatter again");
    }

    @Test
    void configured_locals_keep_their_bare_form() {
        ElixirFormatterPlugin plugin = plugin(Map.of(ConfigurationLoader.LOCALS_WITHOUT_PARENS, List.of("plug/1")));

        assertThat(plugin.format(FILE, "plug Foo").getFormattedCode()).isEqualTo("plug Foo\n");
    }

    @Test
    void renames_are_reported_as_refactorings() {
        ElixirFormatterPlugin plugin = plugin(Map.of(ConfigurationLoader.RENAME_DEPRECATED_AT, "1.6.0"));

        FormatterResult result = plugin.format(FILE, "Enum.partition(list, fun)\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("Enum.split_with(list, fun)\n");
        assertThat(result.getAppliedRefactorings()).singleElement().satisfies(refactoring -> {
            assertThat(refactoring.getKind()).isEqualTo(Refactoring.Kind.RENAME_DEPRECATED);
            assertThat(refactoring.getLine()).isEqualTo(1);
            assertThat(refactoring.getDescription())
                    .isEqualTo("Elixir.Enum.partition/2 renamed to Elixir.Enum.split_with/2");
        });
    }

    @Test
    void invalid_options_are_rejected() {
        assertThatThrownBy(() -> plugin(Map.of(ConfigurationLoader.LOCALS_WITHOUT_PARENS, List.of("Foo"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> plugin(Map.of(ConfigurationLoader.RENAME_DEPRECATED_AT, "latest")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
