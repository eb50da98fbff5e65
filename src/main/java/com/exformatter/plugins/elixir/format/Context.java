package com.exformatter.plugins.elixir.format;

/**
 * Where an expression sits in its parent. The context decides whether
 * parentheses and spacing are needed around the expression, never its value.
 */
public enum Context {
    /** a statement in a block */
    BLOCK,
    /** an operand of a unary or binary operator */
    OPERAND,
    PARENS_ARG,
    NO_PARENS_ARG,
    PARENS_ONE_ARG,
    NO_PARENS_ONE_ARG;

    /**
     * Argument contexts collapse to their many-arguments form; statements and
     * operands become {@code choice}.
     */
    public Context forceManyArgsOr(Context choice) {
        return switch (this) {
            case NO_PARENS_ONE_ARG, NO_PARENS_ARG -> NO_PARENS_ARG;
            case PARENS_ONE_ARG, PARENS_ARG -> PARENS_ARG;
            case OPERAND, BLOCK -> choice;
        };
    }

    boolean allowsNoParens() {
        return this == BLOCK || this == OPERAND || this == NO_PARENS_ONE_ARG || this == PARENS_ONE_ARG;
    }

    boolean isNoParensArg() {
        return this == NO_PARENS_ARG || this == NO_PARENS_ONE_ARG;
    }
}
