package com.exformatter.plugins.elixir.format;

import org.junit.jupiter.api.Test;

import com.exformatter.algebra.DocRenderer;

import static org.assertj.core.api.Assertions.assertThat;

class LiteralsTest {

    @Test
    void long_decimals_are_grouped_by_thousands() {
        assertThat(Literals.integer("1000000")).isEqualTo("1_000_000");
        assertThat(Literals.integer("123456")).isEqualTo("123_456");
    }

    @Test
    void short_or_hand_grouped_decimals_are_kept() {
        assertThat(Literals.integer("12345")).isEqualTo("12345");
        assertThat(Literals.integer("1_000000")).isEqualTo("1_000000");
    }

    @Test
    void other_bases_keep_their_digits() {
        assertThat(Literals.integer("0xabc")).isEqualTo("0xABC");
        assertThat(Literals.integer("0b1010")).isEqualTo("0b1010");
        assertThat(Literals.integer("0o777")).isEqualTo("0o777");
        assertThat(Literals.integer("?a")).isEqualTo("?a");
    }

    @Test
    void float_gets_grouped_integer_part_and_lowercase_exponent() {
        assertThat(Literals.floatNumber("1234567.5E10")).isEqualTo("1_234_567.5e10");
        assertThat(Literals.floatNumber("1.0")).isEqualTo("1.0");
    }

    @Test
    void atoms_are_quoted_only_when_needed() {
        assertThat(DocRenderer.renderFlat(Literals.atom("foo"))).isEqualTo(":foo");
        assertThat(DocRenderer.renderFlat(Literals.atom("foo?"))).isEqualTo(":foo?");
        assertThat(DocRenderer.renderFlat(Literals.atom("+"))).isEqualTo(":+");
        assertThat(DocRenderer.renderFlat(Literals.atom("Foo"))).isEqualTo(":Foo");
        assertThat(DocRenderer.renderFlat(Literals.atom("foo bar"))).isEqualTo(":\"foo bar\"");
        assertThat(DocRenderer.renderFlat(Literals.atom("nil"))).isEqualTo("nil");
        assertThat(DocRenderer.renderFlat(Literals.atom("true"))).isEqualTo("true");
    }

    @Test
    void unicode_identifier_atoms_stay_unquoted() {
        assertThat(DocRenderer.renderFlat(Literals.atom("héllo"))).isEqualTo(":héllo");
        assertThat(DocRenderer.renderFlat(Literals.atom("ñandú?"))).isEqualTo(":ñandú?");
        assertThat(Identifiers.inspectAsKey("héllo")).isEqualTo("héllo: ");
    }

    @Test
    void string_escapes_its_delimiter_and_keeps_newlines() {
        assertThat(DocRenderer.renderFlat(Literals.escapeString("a\"b", "\""))).isEqualTo("a\\\"b");
        assertThat(DocRenderer.renderFlat(Literals.escapeString("a\nb", "\""))).isEqualTo("a\nb");
    }

    @Test
    void heredoc_keeps_one_line_per_source_line() {
        assertThat(DocRenderer.renderFlat(Literals.heredoc("a\nb\n"))).isEqualTo("a\nb\n");
    }

    @Test
    void keyword_keys_are_quoted_unless_identifiers() {
        assertThat(Identifiers.inspectAsKey("foo")).isEqualTo("foo: ");
        assertThat(Identifiers.inspectAsKey("Foo")).isEqualTo("Foo: ");
        assertThat(Identifiers.inspectAsKey("foo bar")).isEqualTo("\"foo bar\": ");
        assertThat(Identifiers.inspectAsKey("+")).isEqualTo("+: ");
        assertThat(Identifiers.inspectAsFunction("foo bar")).isEqualTo("\"foo bar\"");
        assertThat(Identifiers.inspectAsFunction("bar!")).isEqualTo("bar!");
    }
}
