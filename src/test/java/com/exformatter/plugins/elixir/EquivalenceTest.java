package com.exformatter.plugins.elixir;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.exformatter.plugins.elixir.ast.Quoted;
import com.exformatter.plugins.elixir.parser.ParseException;

import static org.assertj.core.api.Assertions.assertThat;

class EquivalenceTest {

    @Test
    void layout_does_not_matter() throws ParseException {
        assertThat(Equivalence.check("1+2", "1 + 2")).isEmpty();
        assertThat(Equivalence.check("a\nb", "a\n\n\nb")).isEmpty();
        assertThat(Equivalence.check("foo 1, 2", "foo(1, 2)")).isEmpty();
    }

    @Test
    void different_operator_is_reported() throws ParseException {
        assertThat(Equivalence.check("1 + 2", "1 - 2")).isPresent();
    }

    @Test
    void first_differing_subtree_is_reported() throws ParseException {
        Optional<Equivalence.Difference> difference = Equivalence.check("a + b", "a + c");

        assertThat(difference).isPresent();
        assertThat(difference.get().left()).isInstanceOf(Quoted.Var.class);
        assertThat(((Quoted.Var) difference.get().left()).name()).isEqualTo("b");
        assertThat(((Quoted.Var) difference.get().right()).name()).isEqualTo("c");
    }

    @Test
    void extra_statement_is_reported() throws ParseException {
        assertThat(Equivalence.check("a\nb", "a")).isPresent();
    }
}
