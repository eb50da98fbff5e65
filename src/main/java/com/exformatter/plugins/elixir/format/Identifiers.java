package com.exformatter.plugins.elixir.format;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies atoms by how they can be written in source.
 */
public final class Identifiers {

    public enum Kind {
        CALLABLE_LOCAL,
        CALLABLE_OPERATOR,
        NOT_CALLABLE,
        QUOTED_OPERATOR,
        ALIAS,
        OTHER
    }

    private static final Set<String> NOT_CALLABLE = Set.of("%", "%{}", "{}", "<<>>", "...", "..", ".", "->");

    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{Ll}\\p{Lo}_][\\p{L}\\p{Nd}_]*[?!]?");
    private static final Pattern ALIAS_SEGMENT = Pattern.compile("[A-Z][A-Za-z0-9_]*");

    private Identifiers() {
    }

    public static Kind classify(String atom) {
        if (NOT_CALLABLE.contains(atom)) {
            return Kind.NOT_CALLABLE;
        }
        if (atom.equals("::")) {
            return Kind.QUOTED_OPERATOR;
        }
        if (Operators.isUnaryOp(atom) || Operators.isBinaryOp(atom)) {
            return Kind.CALLABLE_OPERATOR;
        }
        if (isModuleName(atom)) {
            return Kind.ALIAS;
        }
        if (IDENTIFIER.matcher(atom).matches()) {
            return Kind.CALLABLE_LOCAL;
        }
        if (ALIAS_SEGMENT.matcher(atom).matches()) {
            return Kind.NOT_CALLABLE;
        }
        return Kind.OTHER;
    }

    /** {@code Elixir.Foo.Bar} */
    private static boolean isModuleName(String atom) {
        if (!atom.startsWith("Elixir.")) {
            return false;
        }
        for (String segment : atom.substring("Elixir.".length()).split("\\.", -1)) {
            if (!ALIAS_SEGMENT.matcher(segment).matches()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders an atom used as a keyword key, including the trailing {@code ": "}.
     */
    public static String inspectAsKey(String atom) {
        if (IDENTIFIER.matcher(atom).matches()
                || ALIAS_SEGMENT.matcher(atom).matches()
                || classify(atom) == Kind.CALLABLE_OPERATOR) {
            return atom + ": ";
        }
        return "\"" + escapeQuotes(atom) + "\": ";
    }

    /**
     * Renders an atom used as a remote function name.
     */
    public static String inspectAsFunction(String atom) {
        Kind kind = classify(atom);
        if (kind == Kind.CALLABLE_LOCAL || kind == Kind.CALLABLE_OPERATOR) {
            return atom;
        }
        return "\"" + escapeQuotes(atom) + "\"";
    }

    private static String escapeQuotes(String text) {
        return text.replace("\"", "\\\"");
    }
}
