package com.exformatter.plugins.elixir.parser;

/**
 * A comment as read from the source.
 *
 * @param line the line of the comment
 * @param previousEol newlines between the previous token and the comment, null
 *                    when code precedes the comment on its line
 * @param nextEol newlines between the comment and the next token
 * @param text the normalized comment text, starting with {@code #}
 */
public record SourceComment(int line, Integer previousEol, int nextEol, String text) {
}
