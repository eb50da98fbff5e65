package com.exformatter.plugins.elixir.parser;

import java.util.List;

import com.exformatter.plugins.elixir.ast.Quoted;

/**
 * The quoted forms of a source and its comments, in line order.
 */
public record ParsedSource(Quoted forms, List<SourceComment> comments) {
    public ParsedSource {
        comments = List.copyOf(comments);
    }
}
