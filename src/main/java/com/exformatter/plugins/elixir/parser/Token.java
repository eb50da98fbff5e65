package com.exformatter.plugins.elixir.parser;

import java.util.List;

/**
 * A lexical token.
 * <p>
 * {@code text} holds the identifier, operator or atom name, the source text of
 * numbers and the letter of sigils. Strings, charlists, quoted atoms and sigils
 * keep their content in {@code parts}.
 *
 * @param spaceBefore whitespace or a newline precedes the token
 * @param eolCount newlines absorbed by end-of-line, comma and semicolon tokens
 * @param newlineBefore a newline preceding a binary operator was dropped
 * @param eolAfter a newline follows the token
 */
public record Token(TokenKind kind,
                    String text,
                    int line,
                    int column,
                    boolean spaceBefore,
                    int eolCount,
                    boolean newlineBefore,
                    boolean eolAfter,
                    List<Part> parts,
                    boolean heredoc,
                    String terminator,
                    String modifiers) {

    /**
     * A piece of a string-like token: raw text, or the tokens of an
     * interpolation between {@code line} and {@code endLine}.
     */
    public record Part(String literal, List<Token> tokens, int line, int endLine) {
        public static Part literal(String text) {
            return new Part(text, null, 0, 0);
        }

        public static Part interpolation(List<Token> tokens, int line, int endLine) {
            return new Part(null, List.copyOf(tokens), line, endLine);
        }

        public boolean isLiteral() {
            return literal != null;
        }
    }

    public Token {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    static Token simple(TokenKind kind, String text, int line, int column, boolean spaceBefore) {
        return new Token(kind, text, line, column, spaceBefore, 0, false, false, null, false, null, null);
    }

    static Token quoted(TokenKind kind, List<Part> parts, boolean heredoc, int line, int column, boolean spaceBefore) {
        return new Token(kind, "", line, column, spaceBefore, 0, false, false, parts, heredoc, null, null);
    }

    static Token sigil(String letter, List<Part> parts, String terminator, String modifiers,
                       int line, int column, boolean spaceBefore) {
        return new Token(TokenKind.SIGIL, letter, line, column, spaceBefore, 0, false, false,
                parts, false, terminator, modifiers);
    }

    Token withEolCount(int count) {
        return new Token(kind, text, line, column, spaceBefore, count, newlineBefore, eolAfter,
                parts, heredoc, terminator, modifiers);
    }

    Token withNewlineBefore() {
        return new Token(kind, text, line, column, spaceBefore, eolCount, true, eolAfter,
                parts, heredoc, terminator, modifiers);
    }

    Token withEolAfter() {
        return new Token(kind, text, line, column, spaceBefore, eolCount, newlineBefore, true,
                parts, heredoc, terminator, modifiers);
    }

    Token withKind(TokenKind newKind) {
        return new Token(newKind, text, line, column, spaceBefore, eolCount, newlineBefore, eolAfter,
                parts, heredoc, terminator, modifiers);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isOperator(String op) {
        return kind == TokenKind.OPERATOR && text.equals(op);
    }

    public boolean isIdentifier(String name) {
        return kind == TokenKind.IDENTIFIER && text.equals(name);
    }

    /** End of expression: a newline or a semicolon. */
    public boolean isEndOfExpression() {
        return kind == TokenKind.EOL || kind == TokenKind.SEMICOLON;
    }

    /** True when the token is a string-like literal without interpolation. */
    public boolean isPlain() {
        for (Part part : parts) {
            if (!part.isLiteral()) {
                return false;
            }
        }
        return true;
    }

    /** Concatenated literal parts. */
    public String plainText() {
        StringBuilder builder = new StringBuilder();
        for (Part part : parts) {
            if (part.isLiteral()) {
                builder.append(part.literal());
            }
        }
        return builder.toString();
    }

    /** Text used in error messages. */
    public String describe() {
        return switch (kind) {
            case EOF -> "";
            case EOL -> "end of line";
            case STRING, CHARLIST, ATOM_QUOTED, KW_QUOTED -> "\"" + plainText() + "\"";
            case SIGIL -> "~" + text;
            default -> text;
        };
    }
}
