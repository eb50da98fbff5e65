package com.exformatter.algebra;

import org.junit.jupiter.api.Test;

import static com.exformatter.algebra.Docs.collapseLines;
import static com.exformatter.algebra.Docs.concat;
import static com.exformatter.algebra.Docs.forceBreak;
import static com.exformatter.algebra.Docs.glue;
import static com.exformatter.algebra.Docs.group;
import static com.exformatter.algebra.Docs.groupInherit;
import static com.exformatter.algebra.Docs.line;
import static com.exformatter.algebra.Docs.nest;
import static com.exformatter.algebra.Docs.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocRendererTest {

    @Test
    void group_stays_flat_when_it_fits() {
        Doc doc = group(glue(text("hello"), text("world")));

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("hello world");
    }

    @Test
    void group_breaks_when_too_wide() {
        Doc doc = group(glue(text("hello"), text("world")));

        assertThat(DocRenderer.render(doc, 5)).isEqualTo("hello\nworld");
    }

    @Test
    void hard_lines_always_break_and_respect_nesting() {
        Doc doc = group(concat(text("do"), nest(concat(line(), text("x")), 2), line(), text("end")));

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("do\n  x\nend");
    }

    @Test
    void empty_lines_carry_no_indentation() {
        Doc doc = nest(concat(text("a"), line(), line(), text("b")), 2);

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("a\n\n  b");
    }

    @Test
    void forced_break_breaks_enclosing_group() {
        Doc doc = forceBreak(glue(text("a"), text("b")));

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("a\nb");
    }

    @Test
    void collapse_limits_consecutive_newlines() {
        Doc doc = concat(text("a"), collapseLines(2), line(), line(), line(), text("b"));

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("a\n\nb");
    }

    @Test
    void collapse_requires_positive_count() {
        assertThatThrownBy(() -> collapseLines(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zero_nesting_returns_same_document() {
        Doc doc = text("a");

        assertThat(nest(doc, 0)).isSameAs(doc);
    }

    @Test
    void width_is_measured_in_code_points() {
        Doc doc = group(glue(text("😀😀😀"), text("ab")));

        assertThat(DocRenderer.render(doc, 6)).isEqualTo("😀😀😀 ab");
    }

    @Test
    void inheriting_group_breaks_with_its_parent() {
        Doc inherit = group(concat(glue(text("aaaa"), text("bbbb")), groupInherit(glue(text("c"), text("d")))));
        Doc plain = group(concat(glue(text("aaaa"), text("bbbb")), group(glue(text("c"), text("d")))));

        assertThat(DocRenderer.render(inherit, 10)).isEqualTo("aaaa\nbbbbc\nd");
        assertThat(DocRenderer.render(plain, 10)).isEqualTo("aaaa\nbbbbc d");
    }

    @Test
    void group_fit_accounts_for_trailing_text() {
        Doc doc = concat(group(glue(text("aaa"), text("bbb"))), text("cccc"));

        assertThat(DocRenderer.render(doc, 8)).isEqualTo("aaa\nbbbcccc");
    }

    @Test
    void flat_rendering_never_breaks_groups() {
        Doc doc = group(glue(text("a".repeat(200)), text("b".repeat(200))));

        assertThat(DocRenderer.renderFlat(doc)).isEqualTo("a".repeat(200) + " " + "b".repeat(200));
    }

    @Test
    void negative_width_is_rejected() {
        assertThatThrownBy(() -> DocRenderer.render(text("a"), -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
