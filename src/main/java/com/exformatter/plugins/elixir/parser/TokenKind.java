package com.exformatter.plugins.elixir.parser;

public enum TokenKind {
    IDENTIFIER,
    ALIAS,
    /** {@code foo:} */
    KW_IDENTIFIER,
    /** {@code "foo bar":}, possibly interpolated */
    KW_QUOTED,
    ATOM,
    /** {@code :"foo"}, possibly interpolated */
    ATOM_QUOTED,
    INT,
    FLOAT,
    /** {@code ?a} */
    CHAR,
    STRING,
    CHARLIST,
    SIGIL,
    /** {@code &1} */
    CAPTURE_INT,
    OPERATOR,
    DOT,
    COMMA,
    SEMICOLON,
    EOL,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    /** {@code <<} */
    LTLT,
    /** {@code >>} */
    GTGT,
    PERCENT,
    EOF
}
