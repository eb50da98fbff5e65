package com.exformatter.plugins.elixir.format;

import static com.exformatter.algebra.Docs.collapseLines;
import static com.exformatter.algebra.Docs.concat;
import static com.exformatter.algebra.Docs.empty;
import static com.exformatter.algebra.Docs.forceBreak;
import static com.exformatter.algebra.Docs.glue;
import static com.exformatter.algebra.Docs.group;
import static com.exformatter.algebra.Docs.isEmpty;
import static com.exformatter.algebra.Docs.line;
import static com.exformatter.algebra.Docs.text;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import com.exformatter.algebra.Doc;
import com.exformatter.plugins.elixir.ast.Meta;
import com.exformatter.plugins.elixir.ast.Quoted;
import com.exformatter.plugins.elixir.parser.SourceComment;

/**
 * Puts source comments back between the documents of a sequence of
 * expressions.
 * <p>
 * Comments are consumed from the state in line order. Comments that fall before
 * an expression are emitted before it. Comments inside an expression that the
 * expression did not place itself are emitted right before the expression.
 * Comments left before the end of the sequence close it.
 */
final class CommentEngine {
    /** Newline count from which a blank line is kept. */
    private static final int NEWLINES = 2;

    /**
     * A rendered item of a sequence.
     *
     * @param doc the item
     * @param nextLine the separator used after the item when the source had no blank line
     * @param newlines newlines in the source before the item
     */
    record Slot(Doc doc, Doc nextLine, int newlines) {
    }

    @FunctionalInterface
    interface SlotLayout {
        Slot layout(Quoted arg, boolean last, int newlines);
    }

    private record LineSpan(int start, int end) {
    }

    private final FormatterState state;

    CommentEngine(FormatterState state) {
        this.state = state;
    }

    /**
     * Merges comments on consecutive lines into a single document. A comment that
     * follows code on its own line starts a run of its own and does not absorb
     * the comments below it.
     */
    static List<Comment> gather(List<SourceComment> comments) {
        List<Comment> gathered = new ArrayList<>();
        int index = 0;

        while (index < comments.size()) {
            SourceComment first = comments.get(index++);

            if (first.previousEol() == null) {
                gathered.add(new Comment(first.line(), NEWLINES, first.nextEol(), text(first.text())));
                continue;
            }

            Doc doc = text(first.text());
            int nextEol = first.nextEol();
            int expectedLine = first.line() + 1;
            while (index < comments.size()
                    && comments.get(index).line() == expectedLine
                    && comments.get(index).previousEol() != null) {
                SourceComment followup = comments.get(index++);
                doc = line(doc, text(followup.text()));
                nextEol = followup.nextEol();
                expectedLine++;
            }
            gathered.add(new Comment(first.line(), first.previousEol(), nextEol, doc));
        }

        return gathered;
    }

    /**
     * Renders {@code args} with {@code layout}, interleaving the comments that
     * fall after {@code minLine} and before {@code maxLine}.
     *
     * @return one document per item, comments included
     */
    List<Doc> quotedToAlgebraWithComments(List<Quoted> args, int minLine, int maxLine, int newlines,
                                          SlotLayout layout) {
        List<Comment> comments = state.getComments();
        int split = 0;
        while (split < comments.size() && comments.get(split).line() <= minLine) {
            split++;
        }
        List<Comment> preComments = comments.subList(0, split);
        state.setComments(List.copyOf(comments.subList(split, comments.size())));

        List<Slot> slots = new ArrayList<>();
        for (int index = 0; index < args.size(); index++) {
            Quoted arg = args.get(index);
            LineSpan span = traverseLine(arg, new LineSpan(Layouts.MAX_LINE, Layouts.MIN_LINE));

            int docNewlines = newlines;
            List<Comment> pending = state.getComments();
            int consumed = 0;
            Comment previous = null;
            while (consumed < pending.size() && pending.get(consumed).line() < span.start()) {
                Comment comment = pending.get(consumed++);
                slots.add(new Slot(comment.doc(), empty(), newlinesBefore(comment, previous)));
                docNewlines = comment.nextEol();
                previous = comment;
            }
            state.setComments(List.copyOf(pending.subList(consumed, pending.size())));

            Slot slot = layout.layout(arg, index == args.size() - 1, docNewlines);

            docNewlines = slot.newlines();
            pending = state.getComments();
            consumed = 0;
            while (consumed < pending.size()
                    && pending.get(consumed).line() >= span.start()
                    && pending.get(consumed).line() <= span.end()) {
                slots.add(new Slot(pending.get(consumed++).doc(), empty(), docNewlines));
                docNewlines = 1;
            }
            state.setComments(List.copyOf(pending.subList(consumed, pending.size())));

            slots.add(new Slot(slot.doc(), slot.nextLine(), docNewlines));
        }

        List<Comment> pending = state.getComments();
        List<Comment> remaining = new ArrayList<>(preComments);
        Comment previous = null;
        for (Comment comment : pending) {
            if (comment.line() < maxLine) {
                slots.add(new Slot(comment.doc(), empty(), newlinesBefore(comment, previous)));
                previous = comment;
            } else {
                remaining.add(comment);
            }
        }
        state.setComments(List.copyOf(remaining));

        return mergeAlgebraWithComments(slots);
    }

    // A comment right after another one only knows the newlines after the
    // previous token, which is absent at the start of the input.
    private static int newlinesBefore(Comment comment, Comment previous) {
        return previous == null ? comment.previousEol() : Math.max(comment.previousEol(), previous.nextEol());
    }

    /**
     * Comma separated arguments delimited by the lines of {@code meta}. The
     * arguments go one per line when the container had a newline after its
     * opening token or when comments were placed among them.
     */
    Doc argsToAlgebraWithComments(List<Quoted> args, Meta meta, Function<Quoted, Doc> fun) {
        int commentsBefore = state.getComments().size();

        List<Doc> docs = quotedToAlgebraWithComments(args, Layouts.line(meta), Layouts.endLine(meta), 1,
                (arg, last, newlines) -> {
                    Doc doc = fun.apply(arg);
                    return new Slot(last ? doc : concat(doc, text(",")), empty(), newlines);
                });

        if (docs.isEmpty()) {
            return empty();
        }
        boolean placedComments = state.getComments().size() != commentsBefore;
        if (meta.eol() || placedComments) {
            return forceBreak(joinWith(docs, true));
        }
        return joinWith(docs, false);
    }

    /** Joins documents with hard lines, or with breakable spaces. */
    static Doc joinWith(List<Doc> docs, boolean lines) {
        Doc doc = docs.get(0);
        for (int i = 1; i < docs.size(); i++) {
            doc = lines ? line(doc, docs.get(i)) : glue(doc, docs.get(i));
        }
        return doc;
    }

    // Blank lines follow the source but never exceed one, and expressions
    // spanning several lines get blank lines around them.
    private static List<Doc> mergeAlgebraWithComments(List<Slot> slots) {
        List<Doc> docs = new ArrayList<>(slots.size());
        Doc left = empty();

        for (int index = 0; index < slots.size(); index++) {
            Slot slot = slots.get(index);
            boolean hasNext = index + 1 < slots.size();
            Doc right = hasNext ? nextLineSeparator(slots.get(index + 1), slot.nextLine()) : line();

            Doc doc = isEmpty(left) ? slot.doc() : concat(left, slot.doc());
            if (hasNext && !isEmpty(right)) {
                doc = concat(doc, concat(collapseLines(2), right));
            }

            docs.add(group(doc));
            left = right;
        }

        return docs;
    }

    private static Doc nextLineSeparator(Slot next, Doc nextLine) {
        return next.newlines() >= NEWLINES ? line() : nextLine;
    }

    /** The smallest and largest start line found anywhere in {@code quoted}. */
    private static LineSpan traverseLine(Quoted quoted, LineSpan span) {
        if (quoted instanceof Quoted.Call call) {
            LineSpan result = withLine(span, call.meta());
            result = traverseLine(call.target(), result);
            for (Quoted arg : call.args()) {
                result = traverseLine(arg, result);
            }
            return result;
        }
        if (quoted instanceof Quoted.Var var) {
            return withLine(span, var.meta());
        }
        if (quoted instanceof Quoted.Pair pair) {
            return traverseLine(pair.right(), traverseLine(pair.left(), span));
        }
        if (quoted instanceof Quoted.QList list) {
            LineSpan result = span;
            for (Quoted item : list.items()) {
                result = traverseLine(item, result);
            }
            return result;
        }
        return span;
    }

    private static LineSpan withLine(LineSpan span, Meta meta) {
        if (meta.line() == null) {
            return span;
        }
        return new LineSpan(Math.min(meta.line(), span.start()), Math.max(meta.line(), span.end()));
    }
}
