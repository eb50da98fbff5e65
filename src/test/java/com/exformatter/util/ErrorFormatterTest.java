package com.exformatter.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import com.exformatter.api.error.FormatterError;
import com.exformatter.api.error.Severity;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorFormatterTest {
    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void error_with_location_and_hint() {
        FormatterError error = new FormatterError(Severity.FATAL, "syntax error before: \")\"", 3, 7,
                "Fix the syntax error and run the formatter again");

        assertThat(plain.formatError(Path.of("lib/a.ex"), error)).isEqualTo("""
                lib/a.ex:3:7: FATAL: syntax error before: ")"
                  hint: Fix the syntax error and run the formatter again""");
    }

    @Test
    void error_without_file_or_hint() {
        FormatterError error = new FormatterError(Severity.ERROR, "boom", 1, 1);

        assertThat(plain.formatError(null, error)).isEqualTo("1:1: ERROR: boom");
    }

    @Test
    void summary_counts_per_file_and_total() {
        Map<Path, List<FormatterError>> errors = new TreeMap<>();
        errors.put(Path.of("lib/a.ex"), List.of(new FormatterError(Severity.FATAL, "x", 1, 1)));
        errors.put(Path.of("lib/b.ex"), List.of(
                new FormatterError(Severity.ERROR, "y", 1, 1),
                new FormatterError(Severity.FATAL, "z", 2, 1)));

        assertThat(plain.formatErrorSummary(errors)).isEqualTo("""
                Error Summary:
                lib/a.ex: 1 fatal
                lib/b.ex: 1 fatal, 1 error
                Total: 2 fatal, 1 error""");
    }

    @Test
    void empty_summary() {
        assertThat(plain.formatErrorSummary(Map.of())).isEqualTo("Error Summary:\nTotal: no problems");
    }

    @Test
    void colors_only_when_enabled() {
        assertThat(plain.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("x");
        assertThat(new ErrorFormatter(true).colorize(ErrorFormatter.ANSI_RED, "x"))
                .isEqualTo(ErrorFormatter.ANSI_RED + "x" + ErrorFormatter.ANSI_RESET);
    }
}
