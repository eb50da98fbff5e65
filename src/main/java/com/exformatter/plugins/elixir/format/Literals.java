package com.exformatter.plugins.elixir.format;

import static com.exformatter.algebra.Docs.concat;
import static com.exformatter.algebra.Docs.line;
import static com.exformatter.algebra.Docs.nestReset;
import static com.exformatter.algebra.Docs.text;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import com.exformatter.algebra.Doc;

/**
 * Renders number, atom and string literals.
 */
public final class Literals {
    public static final String DOUBLE_QUOTE = "\"";
    public static final String DOUBLE_HEREDOC = "\"\"\"";
    public static final String SINGLE_QUOTE = "'";
    public static final String SINGLE_HEREDOC = "'''";

    private Literals() {
    }

    public static Doc atom(String atom) {
        if (atom.equals("nil") || atom.equals("true") || atom.equals("false")) {
            return text(atom);
        }
        return switch (Identifiers.classify(atom)) {
            case CALLABLE_LOCAL, CALLABLE_OPERATOR, NOT_CALLABLE -> text(":" + atom);
            default -> text(":\"" + atom.replace("\"", "\\\"") + "\"");
        };
    }

    /**
     * Renders an integer from its source text: hexadecimal digits are upcased,
     * long decimals get underscores every three digits and binary, octal and
     * character literals are kept as written.
     */
    public static String integer(String original) {
        if (original.startsWith("0x")) {
            return "0x" + original.substring(2).toUpperCase(Locale.ROOT);
        }
        if (original.startsWith("0b") || original.startsWith("0o") || original.startsWith("?")) {
            return original;
        }
        return insertUnderscores(original);
    }

    /** Renders a float from its source text with a lowercase exponent. */
    public static String floatNumber(String original) {
        int dot = original.indexOf('.');
        if (dot < 0) {
            throw new IllegalStateException("float literal without a decimal point: " + original);
        }
        String integerPart = original.substring(0, dot);
        String decimalPart = original.substring(dot + 1).toLowerCase(Locale.ROOT);
        return insertUnderscores(integerPart) + "." + decimalPart;
    }

    static String insertUnderscores(String digits) {
        // already grouped by hand
        if (digits.indexOf('_') >= 0 || digits.length() < 6) {
            return digits;
        }
        StringBuilder grouped = new StringBuilder();
        int head = digits.length() % 3;
        if (head > 0) {
            grouped.append(digits, 0, head);
        }
        for (int i = head; i < digits.length(); i += 3) {
            if (grouped.length() > 0) {
                grouped.append('_');
            }
            grouped.append(digits, i, i + 3);
        }
        return grouped.toString();
    }

    /**
     * Escapes {@code escape} in a single-line literal. Newlines inside the literal
     * restart at column 0 so the literal's value is preserved.
     */
    public static Doc escapeString(String string, String escape) {
        String escaped = string.replace(escape, "\\" + escape);
        List<String> lines = Arrays.asList(escaped.split("\n", -1));

        Doc doc = text(lines.get(lines.size() - 1));
        for (int i = lines.size() - 2; i >= 0; i--) {
            doc = concat(text(lines.get(i)), concat(nestReset(line()), doc));
        }
        return doc;
    }

    /** Heredoc content, one document line per source line. */
    public static Doc heredoc(String string) {
        return heredocLines(Arrays.asList(string.split("\n", -1)), 0);
    }

    private static Doc heredocLines(List<String> lines, int from) {
        String current = lines.get(from);
        int remaining = lines.size() - from;

        if (remaining == 1) {
            return text(current);
        }
        if (remaining == 2 && lines.get(from + 1).isEmpty()) {
            return concat(text(current), line());
        }
        if (lines.get(from + 1).isEmpty()) {
            // empty lines are not indented
            Doc head = concat(text(current), nestReset(line()));
            return line(head, heredocLines(lines, from + 2));
        }
        return line(text(current), heredocLines(lines, from + 1));
    }
}
