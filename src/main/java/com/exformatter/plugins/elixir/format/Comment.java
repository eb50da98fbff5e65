package com.exformatter.plugins.elixir.format;

import java.util.List;

import com.exformatter.algebra.Doc;
import com.exformatter.plugins.elixir.parser.SourceComment;

/**
 * A gathered source comment: consecutive comment lines are already merged
 * into {@code doc}.
 *
 * @param line the source line of the first comment in the run
 * @param previousEol newlines between the previous token and the comment
 * @param nextEol newlines between the last comment of the run and the next token
 */
public record Comment(int line, int previousEol, int nextEol, Doc doc) {

    /** Merges runs of comments on consecutive lines, in source order. */
    public static List<Comment> gather(List<SourceComment> comments) {
        return CommentEngine.gather(comments);
    }
}
