package com.exformatter.plugins.elixir.ast;

/**
 * Source metadata attached to calls and variables.
 * <p>
 * Metadata is advisory: it changes the rendered shape, never the meaning.
 * {@code format} is one of {@code keyword}, {@code block}, {@code charlist},
 * {@code list_heredoc} or {@code bin_heredoc}.
 */
public record Meta(Integer line,
                   Integer endLine,
                   Integer newlines,
                   boolean eol,
                   String format,
                   String terminator,
                   String original) {

    public static final Meta EMPTY = new Meta(null, null, null, false, null, null, null);

    public static final String FORMAT_KEYWORD = "keyword";
    public static final String FORMAT_BLOCK = "block";
    public static final String FORMAT_CHARLIST = "charlist";
    public static final String FORMAT_LIST_HEREDOC = "list_heredoc";
    public static final String FORMAT_BIN_HEREDOC = "bin_heredoc";

    public static Meta atLine(int line) {
        return new Meta(line, null, null, false, null, null, null);
    }

    public Meta withLine(Integer line) {
        return new Meta(line, endLine, newlines, eol, format, terminator, original);
    }

    public Meta withEndLine(Integer endLine) {
        return new Meta(line, endLine, newlines, eol, format, terminator, original);
    }

    public Meta withNewlines(Integer newlines) {
        return new Meta(line, endLine, newlines, eol, format, terminator, original);
    }

    public Meta withEol(boolean eol) {
        return new Meta(line, endLine, newlines, eol, format, terminator, original);
    }

    public Meta withFormat(String format) {
        return new Meta(line, endLine, newlines, eol, format, terminator, original);
    }

    public Meta withTerminator(String terminator) {
        return new Meta(line, endLine, newlines, eol, format, terminator, original);
    }

    public Meta withOriginal(String original) {
        return new Meta(line, endLine, newlines, eol, format, terminator, original);
    }

    public int lineOr(int fallback) {
        return line != null ? line : fallback;
    }

    public int endLineOr(int fallback) {
        return endLine != null ? endLine : fallback;
    }

    public boolean hasFormat(String expected) {
        return expected.equals(format);
    }

    /**
     * The source text of a number literal.
     *
     * @throws IllegalStateException when the parser did not record it
     */
    public String requireOriginal() {
        if (original == null) {
            throw new IllegalStateException("number literal without original text in metadata");
        }
        return original;
    }

    /**
     * The opening delimiter of a sigil.
     *
     * @throws IllegalStateException when the parser did not record it
     */
    public String requireTerminator() {
        if (terminator == null) {
            throw new IllegalStateException("sigil without terminator in metadata");
        }
        return terminator;
    }
}
