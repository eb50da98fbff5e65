package com.exformatter.plugins.elixir.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.exformatter.plugins.elixir.ast.Meta;
import com.exformatter.plugins.elixir.ast.Quoted;
import com.exformatter.plugins.elixir.ast.QuotedForms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest {

    private static Quoted parse(String source) throws ParseException {
        return SourceReader.read(source, "nofile", 1).forms();
    }

    private static Quoted.Call call(Quoted quoted, String name, int arity) {
        assertThat(QuotedForms.isCallOf(quoted, name, arity))
                .as("%s/%d in %s", name, arity, quoted)
                .isTrue();
        return (Quoted.Call) quoted;
    }

    @Test
    void literals_are_wrapped_with_their_source_text() throws ParseException {
        Quoted.Call plus = call(parse("1 + 2"), "+", 2);

        Quoted left = plus.args().get(0);
        assertThat(QuotedForms.literalValue(left)).isEqualTo(Quoted.Int.of(1));
        assertThat(Quoted.metaOf(left).original()).isEqualTo("1");
        assertThat(Quoted.metaOf(left).line()).isEqualTo(1);
    }

    @Test
    void binary_operators_follow_precedence() throws ParseException {
        Quoted.Call plus = call(parse("1 + 2 * 3"), "+", 2);

        call(plus.args().get(1), "*", 2);
    }

    @Test
    void right_associative_operators_nest_to_the_right() throws ParseException {
        Quoted.Call concat = call(parse("a ++ b ++ c"), "++", 2);

        assertThat(concat.args().get(0)).isInstanceOf(Quoted.Var.class);
        call(concat.args().get(1), "++", 2);
    }

    @Test
    void statements_record_newlines_before_them() throws ParseException {
        Quoted.Call block = call(parse("a\n\n\nb"), QuotedForms.BLOCK, 2);

        Quoted.Var first = (Quoted.Var) block.args().get(0);
        Quoted.Var second = (Quoted.Var) block.args().get(1);
        assertThat(first.meta().newlines()).isNull();
        assertThat(second.meta().newlines()).isEqualTo(3);
    }

    @Test
    void do_block_becomes_trailing_keyword_list() throws ParseException {
        Quoted.Call ifCall = call(parse("""
                if a do
                  b
                else
                  c
                end"""), "if", 2);

        Quoted.QList blocks = (Quoted.QList) ifCall.args().get(1);
        assertThat(blocks.items()).hasSize(2);

        Quoted.Pair doEntry = (Quoted.Pair) blocks.items().get(0);
        Meta doMeta = Quoted.metaOf(doEntry.left());
        assertThat(QuotedForms.literalValue(doEntry.left())).isEqualTo(new Quoted.Atom("do"));
        assertThat(doMeta.hasFormat(Meta.FORMAT_BLOCK)).isTrue();
        assertThat(doMeta.endLine()).isEqualTo(5);
        assertThat(doEntry.right()).isEqualTo(new Quoted.Var("b", Meta.atLine(2), "nil"));

        Quoted.Pair elseEntry = (Quoted.Pair) blocks.items().get(1);
        assertThat(QuotedForms.literalValue(elseEntry.left())).isEqualTo(new Quoted.Atom("else"));
    }

    @Test
    void bracket_access_becomes_access_get() throws ParseException {
        Quoted access = parse("foo[bar]");

        assertThat(QuotedForms.isRemote(access, QuotedForms.ACCESS, "get")).isTrue();
        assertThat(((Quoted.Call) access).args()).hasSize(2);
    }

    @Test
    void negated_membership_wraps_the_in_operator() throws ParseException {
        for (String source : List.of("not a in b", "a not in b")) {
            Quoted.Call not = call(parse(source), "not", 1);
            Quoted.Call in = call(not.args().get(0), "in", 2);
            assertThat(((Quoted.Var) in.args().get(0)).name()).isEqualTo("a");
        }
    }

    @Test
    void anonymous_function_holds_its_clauses() throws ParseException {
        Quoted.Call fn = call(parse("fn x -> x end"), "fn", 1);

        Quoted.Call clause = call(fn.args().get(0), QuotedForms.STAB, 2);
        assertThat(((Quoted.QList) clause.args().get(0)).items()).hasSize(1);
        assertThat(fn.meta().endLine()).isEqualTo(1);
    }

    @Test
    void map_with_keywords_holds_pairs() throws ParseException {
        Quoted.Call map = call(parse("%{a: 1}"), QuotedForms.MAP, 1);

        Quoted.Pair entry = (Quoted.Pair) map.args().get(0);
        assertThat(QuotedForms.literalValue(entry.left())).isEqualTo(new Quoted.Atom("a"));
        assertThat(Quoted.metaOf(entry.left()).hasFormat(Meta.FORMAT_KEYWORD)).isTrue();
    }

    @Test
    void interpolated_string_becomes_binary() throws ParseException {
        Quoted.Call binary = call(parse("\"a#{b}\""), QuotedForms.BITSTRING, 2);

        assertThat(binary.args().get(0)).isEqualTo(new Quoted.Str("a"));
        assertThat(QuotedForms.interpolatedExpression(binary.args().get(1))).isNotNull();
        assertThat(QuotedForms.isInterpolated(binary.args())).isTrue();
    }

    @Test
    void lists_and_pairs_are_literals() throws ParseException {
        Quoted list = QuotedForms.literalValue(parse("[1, 2]"));
        Quoted pair = QuotedForms.literalValue(parse("{1, 2}"));

        assertThat(list).isInstanceOf(Quoted.QList.class);
        assertThat(((Quoted.QList) list).items()).hasSize(2);
        assertThat(pair).isInstanceOf(Quoted.Pair.class);
        call(parse("{1, 2, 3}"), QuotedForms.TUPLE, 3);
    }

    @Test
    void call_without_parens_keeps_keyword_list_last() throws ParseException {
        Quoted.Call foo = call(parse("foo 1, key: 2"), "foo", 2);

        assertThat(foo.args().get(1)).isInstanceOf(Quoted.QList.class);
    }

    @Test
    void operator_capture_holds_the_operator_as_a_variable() throws ParseException {
        Quoted.Call capture = call(parse("&+/2"), "&", 1);

        Quoted.Call slash = call(capture.args().get(0), "/", 2);
        assertThat(slash.args().get(0)).isInstanceOf(Quoted.Var.class);
        assertThat(((Quoted.Var) slash.args().get(0)).name()).isEqualTo("+");
        assertThat(QuotedForms.literalValue(slash.args().get(1))).isEqualTo(Quoted.Int.of(2));
        call(call(parse("&-/1"), "&", 1).args().get(0), "/", 2);
    }

    @Test
    void capture_on_the_right_of_a_match_binds_tighter() throws ParseException {
        Quoted.Call match = call(parse("fun = & &1"), "=", 2);

        Quoted.Call capture = call(match.args().get(1), "&", 1);
        call(capture.args().get(0), "&", 1);
        call(call(parse("x = &Mod.fun/1"), "=", 2).args().get(1), "&", 1);
    }

    @Test
    void operator_can_be_a_keyword_key() throws ParseException {
        Quoted list = QuotedForms.literalValue(parse("[+: 2]"));

        Quoted.Pair entry = (Quoted.Pair) ((Quoted.QList) list).items().get(0);
        assertThat(QuotedForms.literalValue(entry.left())).isEqualTo(new Quoted.Atom("+"));
        assertThat(QuotedForms.literalValue(entry.right())).isEqualTo(Quoted.Int.of(2));
    }

    @Test
    void incomplete_expression_fails() {
        assertThatThrownBy(() -> parse("foo("))
                .isInstanceOf(ParseException.class)
                .hasMessage("syntax error: expression is incomplete");
    }

    @Test
    void missing_end_reports_the_opening_line() {
        assertThatThrownBy(() -> parse("if a do\n  b\n"))
                .isInstanceOf(ParseException.class)
                .hasMessage("missing terminator: end (for \"do\" starting at line 1)");
    }

    @Test
    void error_description_quotes_the_token() {
        ParseException error = new ParseException(3, 7, "syntax error before: ", ")");

        assertThat(error.describe("lib/a.ex")).isEqualTo("lib/a.ex:3:7: syntax error before: \")\"");
    }
}
