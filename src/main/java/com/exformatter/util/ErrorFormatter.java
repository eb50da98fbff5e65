package com.exformatter.util;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.exformatter.api.error.FormatterError;
import com.exformatter.api.error.Severity;

/**
 * Renders formatter errors for the terminal, optionally with ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats an error as {@code file:line:column: SEVERITY: message}, with the
     * suggestion, if any, on the next line.
     */
    public String formatError(Path file, FormatterError error) {
        StringBuilder sb = new StringBuilder();
        if (file != null) {
            sb.append(file).append(':');
        }
        sb.append(error.getLine()).append(':').append(error.getColumn()).append(": ");
        sb.append(colorize(colorOf(error.getSeverity()), error.getSeverity().name()));
        sb.append(": ").append(error.getMessage());

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "hint: "))
                    .append(error.getSuggestion());
        }
        return sb.toString();
    }

    /**
     * One line per file with errors, then the totals per severity.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Error Summary:")).append('\n');

        Map<Severity, Integer> totals = new EnumMap<>(Severity.class);
        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            Map<Severity, List<FormatterError>> grouped = groupBySeverity(entry.getValue());
            grouped.forEach((severity, errors) -> totals.merge(severity, errors.size(), Integer::sum));
            sb.append(entry.getKey()).append(": ").append(counts(grouped)).append('\n');
        }

        sb.append("Total: ").append(countsOf(totals));
        return sb.toString();
    }

    public Map<Severity, List<FormatterError>> groupBySeverity(List<FormatterError> errors) {
        return errors.stream().collect(Collectors.groupingBy(
                FormatterError::getSeverity, () -> new EnumMap<>(Severity.class), Collectors.toList()));
    }

    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }

    private String counts(Map<Severity, List<FormatterError>> grouped) {
        Map<Severity, Integer> sizes = new EnumMap<>(Severity.class);
        grouped.forEach((severity, errors) -> sizes.put(severity, errors.size()));
        return countsOf(sizes);
    }

    private String countsOf(Map<Severity, Integer> sizes) {
        if (sizes.isEmpty()) {
            return "no problems";
        }
        return sizes.entrySet().stream()
                .map(e -> colorize(colorOf(e.getKey()), e.getValue() + " " + e.getKey().name().toLowerCase()))
                .collect(Collectors.joining(", "));
    }

    private static String colorOf(Severity severity) {
        return switch (severity) {
            case FATAL, ERROR -> ANSI_RED;
            case WARNING -> ANSI_YELLOW;
            case INFO -> ANSI_BLUE;
        };
    }
}
