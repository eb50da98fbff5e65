package com.exformatter.plugins.elixir.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenizerTest {

    private static List<Token> tokenize(String source) throws ParseException {
        return new Tokenizer(source, 1).tokenize();
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }

    @Test
    void newlines_fold_into_one_counted_end_of_line() throws ParseException {
        List<Token> tokens = tokenize("a\n\n\nb");

        assertThat(kinds(tokens)).containsExactly(TokenKind.IDENTIFIER, TokenKind.EOL, TokenKind.IDENTIFIER, TokenKind.EOF);
        assertThat(tokens.get(0).eolAfter()).isTrue();
        assertThat(tokens.get(1).eolCount()).isEqualTo(3);
    }

    @Test
    void comma_absorbs_following_newlines() throws ParseException {
        List<Token> tokens = tokenize("[1,\n\n2]");

        assertThat(kinds(tokens)).containsExactly(
                TokenKind.LBRACKET, TokenKind.INT, TokenKind.COMMA, TokenKind.INT, TokenKind.RBRACKET, TokenKind.EOF);
        assertThat(tokens.get(2).eolCount()).isEqualTo(2);
    }

    @Test
    void newline_before_binary_operator_is_dropped() throws ParseException {
        List<Token> tokens = tokenize("a\n|> b");

        assertThat(kinds(tokens)).containsExactly(TokenKind.IDENTIFIER, TokenKind.OPERATOR, TokenKind.IDENTIFIER, TokenKind.EOF);
        assertThat(tokens.get(1).text()).isEqualTo("|>");
        assertThat(tokens.get(1).newlineBefore()).isTrue();
    }

    @Test
    void comments_record_surrounding_newlines() throws ParseException {
        Tokenizer tokenizer = new Tokenizer("# hi\nfoo # trailing\n\n#bar\nbaz", 1);
        List<Token> tokens = tokenizer.tokenize();

        assertThat(tokenizer.getComments()).containsExactly(
                new SourceComment(1, 1, 1, "# hi"),
                new SourceComment(2, null, 2, "# trailing"),
                new SourceComment(4, 2, 1, "# bar"));
        assertThat(kinds(tokens)).containsExactly(TokenKind.IDENTIFIER, TokenKind.EOL, TokenKind.IDENTIFIER, TokenKind.EOF);
        assertThat(tokens.get(1).eolCount()).isEqualTo(1);
    }

    @Test
    void comment_text_is_normalized() {
        assertThat(Tokenizer.formatComment("#foo")).isEqualTo("# foo");
        assertThat(Tokenizer.formatComment("## foo")).isEqualTo("## foo");
        assertThat(Tokenizer.formatComment("##foo")).isEqualTo("## foo");
        assertThat(Tokenizer.formatComment("#####")).isEqualTo("#####");
        assertThat(Tokenizer.formatComment("#!/usr/bin/env elixir")).isEqualTo("#!/usr/bin/env elixir");
    }

    @Test
    void interpolation_splits_string_parts() throws ParseException {
        Token string = tokenize("\"a#{b}c\"").get(0);

        assertThat(string.kind()).isEqualTo(TokenKind.STRING);
        assertThat(string.parts()).hasSize(3);
        assertThat(string.parts().get(0).literal()).isEqualTo("a");
        assertThat(string.parts().get(1).isLiteral()).isFalse();
        assertThat(string.parts().get(1).tokens().get(0).text()).isEqualTo("b");
        assertThat(string.parts().get(2).literal()).isEqualTo("c");
        assertThat(string.isPlain()).isFalse();
    }

    @Test
    void escaped_terminator_loses_its_backslash() throws ParseException {
        assertThat(tokenize("\"say \\\"hi\\\"\"").get(0).plainText()).isEqualTo("say \"hi\"");
        assertThat(tokenize("\"a\\nb\"").get(0).plainText()).isEqualTo("a\\nb");
    }

    @Test
    void heredoc_strips_closing_indentation() throws ParseException {
        Token heredoc = tokenize("\"\"\"\n  hello\n    world\n  \"\"\"").get(0);

        assertThat(heredoc.heredoc()).isTrue();
        assertThat(heredoc.plainText()).isEqualTo("hello\n  world\n");
    }

    @Test
    void not_in_is_one_operator() throws ParseException {
        List<Token> tokens = tokenize("a not in b");

        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(1).isOperator("not in")).isTrue();
    }

    @Test
    void keyword_identifier_keeps_its_name() throws ParseException {
        Token keyword = tokenize("[do: 1]").get(1);

        assertThat(keyword.kind()).isEqualTo(TokenKind.KW_IDENTIFIER);
        assertThat(keyword.text()).isEqualTo("do");
    }

    @Test
    void sigil_records_delimiter_and_modifiers() throws ParseException {
        Token sigil = tokenize("~r/ab+/i").get(0);

        assertThat(sigil.kind()).isEqualTo(TokenKind.SIGIL);
        assertThat(sigil.text()).isEqualTo("r");
        assertThat(sigil.terminator()).isEqualTo("/");
        assertThat(sigil.modifiers()).isEqualTo("i");
        assertThat(sigil.plainText()).isEqualTo("ab+");
    }

    @Test
    void capture_argument_is_one_token() throws ParseException {
        Token capture = tokenize("&1").get(0);

        assertThat(capture.kind()).isEqualTo(TokenKind.CAPTURE_INT);
        assertThat(capture.text()).isEqualTo("1");
    }

    @Test
    void numbers_keep_their_source_text() throws ParseException {
        List<Token> tokens = tokenize("1_000 0xFF 1.5e10");

        assertThat(kinds(tokens)).containsExactly(TokenKind.INT, TokenKind.INT, TokenKind.FLOAT, TokenKind.EOF);
        assertThat(tokens.get(0).text()).isEqualTo("1_000");
        assertThat(tokens.get(1).text()).isEqualTo("0xFF");
        assertThat(tokens.get(2).text()).isEqualTo("1.5e10");
    }

    @Test
    void unterminated_string_fails() {
        assertThatThrownBy(() -> tokenize("\"abc"))
                .isInstanceOf(ParseException.class)
                .hasMessageStartingWith("missing terminator: \"");
    }
}
