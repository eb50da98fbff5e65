package com.exformatter.api.error;

/**
 * A problem found in one file, with the 1-based position it refers to and
 * an optional hint for the user.
 */
public final class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String suggestion) {
        this.severity = severity;
        this.message = message;
        this.line = Math.max(1, line);
        this.column = Math.max(1, column);
        this.suggestion = suggestion;
    }

    /** A fatal error: the file is left untouched. */
    public static FormatterError fatal(String message, int line, int column, String suggestion) {
        return new FormatterError(Severity.FATAL, message, line, column, suggestion);
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return line + ":" + column + ": " + severity + ": " + message;
    }
}
