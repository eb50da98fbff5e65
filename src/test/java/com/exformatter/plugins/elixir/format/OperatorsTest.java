package com.exformatter.plugins.elixir.format;

import org.junit.jupiter.api.Test;

import com.exformatter.plugins.elixir.format.Operators.OpInfo;
import com.exformatter.plugins.elixir.format.Operators.Side;
import com.exformatter.plugins.elixir.format.Operators.Spacing;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorsTest {

    private static OpInfo binary(String op) {
        return Operators.binaryOp(op).orElseThrow();
    }

    private static boolean needsParens(String parent, String child, Side side) {
        return Operators.operandNeedsParens(parent, binary(parent), child, binary(child), side);
    }

    @Test
    void precedence_table_orders_common_operators() {
        assertThat(binary("*").precedence()).isGreaterThan(binary("+").precedence());
        assertThat(binary("+").precedence()).isGreaterThan(binary("|>").precedence());
        assertThat(binary("|>").precedence()).isGreaterThan(binary("==").precedence());
        assertThat(binary("=").associativity()).isEqualTo(Operators.Associativity.RIGHT);
        assertThat(binary("-").associativity()).isEqualTo(Operators.Associativity.LEFT);
    }

    @Test
    void match_sits_between_capture_and_logical_operators() {
        assertThat(binary("=").precedence()).isEqualTo(100);
        assertThat(binary("=").precedence()).isGreaterThan(Operators.unaryOp("&").orElseThrow().precedence());
        assertThat(binary("=").precedence()).isLessThan(binary("||").precedence());
        assertThat(binary("=").precedence()).isGreaterThan(binary("|").precedence());
    }

    @Test
    void unary_and_binary_tables_overlap_on_sign_operators() {
        assertThat(Operators.isUnaryOp("-")).isTrue();
        assertThat(Operators.isBinaryOp("-")).isTrue();
        assertThat(Operators.isUnaryOp("@")).isTrue();
        assertThat(Operators.isBinaryOp("@")).isFalse();
    }

    @Test
    void spacing_classes() {
        assertThat(Operators.spacing("..")).isEqualTo(Spacing.NO_SPACE);
        assertThat(Operators.spacing("in")).isEqualTo(Spacing.NO_NEWLINE);
        assertThat(Operators.spacing("\\\\")).isEqualTo(Spacing.NO_NEWLINE);
        assertThat(Operators.spacing("|>")).isEqualTo(Spacing.LEFT_NEW_LINE);
        assertThat(Operators.spacing("|")).isEqualTo(Spacing.RIGHT_NEW_LINE);
        assertThat(Operators.spacing("when")).isEqualTo(Spacing.RIGHT_NEW_LINE);
        assertThat(Operators.spacing("+")).isEqualTo(Spacing.FLEX);
    }

    @Test
    void lower_precedence_operand_needs_parens() {
        assertThat(needsParens("*", "+", Side.LEFT)).isTrue();
        assertThat(needsParens("+", "*", Side.RIGHT)).isFalse();
    }

    @Test
    void equal_precedence_needs_parens_off_the_associative_side() {
        assertThat(needsParens("-", "+", Side.RIGHT)).isTrue();
        assertThat(needsParens("-", "+", Side.LEFT)).isFalse();
        assertThat(needsParens("=", "=", Side.LEFT)).isTrue();
        assertThat(needsParens("=", "=", Side.RIGHT)).isFalse();
    }

    @Test
    void mixed_logical_operators_always_get_parens() {
        assertThat(needsParens("||", "&&", Side.RIGHT)).isTrue();
        assertThat(needsParens("and", "or", Side.LEFT)).isTrue();
    }

    @Test
    void pipe_parenthesizes_operands_except_ranges() {
        assertThat(needsParens("|>", "+", Side.LEFT)).isTrue();
        assertThat(needsParens("|>", "..", Side.LEFT)).isFalse();
    }
}
