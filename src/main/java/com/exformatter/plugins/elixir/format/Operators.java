package com.exformatter.plugins.elixir.format;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operator tables: precedence, associativity and spacing class of every
 * operator the formatter knows about.
 */
public final class Operators {

    public enum Associativity {
        LEFT,
        RIGHT,
        NON_ASSOCIATIVE
    }

    /**
     * How a binary operator is laid out.
     */
    public enum Spacing {
        /** {@code 1..2} */
        NO_SPACE,
        /** {@code left in right}, never breaks around the operator */
        NO_NEWLINE,
        /** left associative, the operator starts the next line on breaks: {@code |>} */
        LEFT_NEW_LINE,
        /** right associative, the operator starts the next line on breaks: {@code |}, {@code when} */
        RIGHT_NEW_LINE,
        /** breaks after the operator */
        FLEX
    }

    public record OpInfo(Associativity associativity, int precedence) {
        /** True when the operand on {@code side} sits on the associative side. */
        public boolean associatesTo(Side side) {
            return (associativity == Associativity.LEFT && side == Side.LEFT)
                    || (associativity == Associativity.RIGHT && side == Side.RIGHT);
        }
    }

    public enum Side {
        LEFT,
        RIGHT
    }

    private static final Map<String, OpInfo> BINARY = new HashMap<>();
    private static final Map<String, OpInfo> UNARY = new HashMap<>();

    private static final Set<String> NO_SPACE = Set.of("..");
    private static final Set<String> NO_NEWLINE = Set.of("\\\\", "in");
    private static final Set<String> LEFT_NEW_LINE = Set.of("|>", "~>>", "<<~", "~>", "<~", "<~>", "<|>");
    private static final Set<String> RIGHT_NEW_LINE = Set.of("|", "when");

    private static final Set<String> LOGICAL = Set.of("||", "|||", "or", "&&", "&&&", "and");

    private static final Set<String> REQUIRES_PARENS_ON_OPERANDS = Set.of(
            "|>", "<<<", ">>>", "<~", "~>", "<<~", "~>>", "<~>", "<|>",
            "^^^", "in", "++", "--", "..", "<>");

    static {
        binary(Associativity.LEFT, 40, "<-", "\\\\");
        binary(Associativity.RIGHT, 50, "when");
        binary(Associativity.RIGHT, 60, "::");
        binary(Associativity.RIGHT, 70, "|");
        binary(Associativity.RIGHT, 100, "=");
        binary(Associativity.LEFT, 130, "||", "|||", "or");
        binary(Associativity.LEFT, 140, "&&", "&&&", "and");
        binary(Associativity.LEFT, 150, "==", "!=", "=~", "===", "!==");
        binary(Associativity.LEFT, 160, "<", "<=", ">=", ">");
        binary(Associativity.LEFT, 170, "|>", "<<<", ">>>", "<~", "~>", "<<~", "~>>", "<~>", "<|>");
        binary(Associativity.LEFT, 180, "in");
        binary(Associativity.LEFT, 190, "^^^");
        binary(Associativity.RIGHT, 200, "++", "--", "..", "<>");
        binary(Associativity.LEFT, 210, "+", "-");
        binary(Associativity.LEFT, 220, "*", "/");
        binary(Associativity.LEFT, 310, ".");

        unary(90, "&");
        unary(300, "!", "^", "not", "+", "-", "~~~");
        unary(320, "@");
    }

    private Operators() {
    }

    private static void binary(Associativity associativity, int precedence, String... ops) {
        for (String op : ops) {
            BINARY.put(op, new OpInfo(associativity, precedence));
        }
    }

    private static void unary(int precedence, String... ops) {
        for (String op : ops) {
            UNARY.put(op, new OpInfo(Associativity.NON_ASSOCIATIVE, precedence));
        }
    }

    public static Optional<OpInfo> binaryOp(String op) {
        return Optional.ofNullable(BINARY.get(op));
    }

    public static Optional<OpInfo> unaryOp(String op) {
        return Optional.ofNullable(UNARY.get(op));
    }

    public static boolean isBinaryOp(String op) {
        return BINARY.containsKey(op);
    }

    public static boolean isUnaryOp(String op) {
        return UNARY.containsKey(op);
    }

    public static Spacing spacing(String op) {
        if (NO_SPACE.contains(op)) {
            return Spacing.NO_SPACE;
        }
        if (NO_NEWLINE.contains(op)) {
            return Spacing.NO_NEWLINE;
        }
        if (LEFT_NEW_LINE.contains(op)) {
            return Spacing.LEFT_NEW_LINE;
        }
        if (RIGHT_NEW_LINE.contains(op)) {
            return Spacing.RIGHT_NEW_LINE;
        }
        return Spacing.FLEX;
    }

    /** Logical operators cannot be mixed without parentheses. */
    public static boolean isLogical(String op) {
        return LOGICAL.contains(op);
    }

    /** Operators that parenthesize binary operands when they are the parent. */
    public static boolean requiresParensOnOperands(String parentOp) {
        return REQUIRES_PARENS_ON_OPERANDS.contains(parentOp);
    }

    /**
     * Whether a binary operand needs parentheses under its parent, given both
     * operators and the side the operand sits on. Operands with the parent's
     * precedence on its associative side are handled by the caller before this
     * check.
     */
    public static boolean operandNeedsParens(String parentOp, OpInfo parent, String op, OpInfo child, Side side) {
        if (requiresParensOnOperands(parentOp) && !NO_SPACE.contains(op)) {
            return true;
        }
        if (isLogical(op) && isLogical(parentOp)) {
            return true;
        }
        if (parent.precedence() > child.precedence()) {
            return true;
        }
        return parent.precedence() == child.precedence() && !parent.associatesTo(side);
    }
}
