package com.exformatter.plugins.elixir.parser;

/**
 * Source that cannot be read as Elixir.
 */
public class ParseException extends Exception {
    private final int line;
    private final int column;
    private final String token;

    public ParseException(int line, int column, String message, String token) {
        super(message);
        this.line = line;
        this.column = column;
        this.token = token;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** The offending token text, empty at the end of input. */
    public String getToken() {
        return token;
    }

    /** The message followed by the quoted token, if any. */
    public String getDetail() {
        if (token == null || token.isEmpty()) {
            return getMessage();
        }
        return getMessage().stripTrailing() + " \"" + token + "\"";
    }

    /** {@code file:line:column: message "token"} */
    public String describe(String file) {
        return file + ":" + line + ":" + column + ": " + getDetail();
    }
}
