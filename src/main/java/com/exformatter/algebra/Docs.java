package com.exformatter.algebra;

import java.util.List;

/**
 * Document combinators.
 */
public final class Docs {
    private static final Doc SPACE = text(" ");

    private Docs() {
    }

    public static Doc empty() {
        return Doc.Nil.INSTANCE;
    }

    public static boolean isEmpty(Doc doc) {
        return doc == Doc.Nil.INSTANCE;
    }

    /**
     * Literal text. The width is counted in code points.
     */
    public static Doc text(String text) {
        return new Doc.Text(text, text.codePointCount(0, text.length()));
    }

    public static Doc concat(Doc left, Doc right) {
        return new Doc.Cons(left, right);
    }

    public static Doc concat(Doc... docs) {
        return concat(List.of(docs));
    }

    public static Doc concat(List<Doc> docs) {
        if (docs.isEmpty()) {
            return empty();
        }
        Doc result = docs.get(0);
        for (int i = 1; i < docs.size(); i++) {
            result = new Doc.Cons(result, docs.get(i));
        }
        return result;
    }

    public static Doc nest(Doc doc, int columns) {
        return nest(doc, columns, false);
    }

    public static Doc nest(Doc doc, int columns, boolean breakOnly) {
        if (columns == 0) {
            return doc;
        }
        return new Doc.Nest(doc, Doc.NestKind.COLUMNS, columns, breakOnly);
    }

    /** Nests at the column where the document starts. */
    public static Doc nestCursor(Doc doc) {
        return nestCursor(doc, false);
    }

    public static Doc nestCursor(Doc doc, boolean breakOnly) {
        return new Doc.Nest(doc, Doc.NestKind.CURSOR, 0, breakOnly);
    }

    /** Lines inside {@code doc} restart at column 0. */
    public static Doc nestReset(Doc doc) {
        return new Doc.Nest(doc, Doc.NestKind.RESET, 0, false);
    }

    /**
     * A strict break: {@code text} when its group is flat, a newline otherwise.
     */
    public static Doc breakWith(String text) {
        return new Doc.Break(text);
    }

    public static Doc glue(Doc left, Doc right) {
        return glue(left, " ", right);
    }

    public static Doc glue(Doc left, String breakText, Doc right) {
        return new Doc.Cons(left, new Doc.Cons(breakWith(breakText), right));
    }

    public static Doc line() {
        return Doc.Line.INSTANCE;
    }

    public static Doc line(Doc left, Doc right) {
        return new Doc.Cons(left, new Doc.Cons(Doc.Line.INSTANCE, right));
    }

    public static Doc space(Doc left, Doc right) {
        return new Doc.Cons(left, new Doc.Cons(SPACE, right));
    }

    public static Doc group(Doc doc) {
        return new Doc.Group(doc, false);
    }

    /** A group that stays broken when its parent is broken. */
    public static Doc groupInherit(Doc doc) {
        return new Doc.Group(doc, true);
    }

    public static Doc forceBreak(Doc doc) {
        return new Doc.Force(doc);
    }

    public static Doc nextBreakFits(Doc doc, boolean enabled) {
        return new Doc.Fits(doc, enabled);
    }

    public static Doc collapseLines(int max) {
        if (max <= 0) {
            throw new IllegalArgumentException("collapse count must be positive, got " + max);
        }
        return new Doc.Collapse(max);
    }
}
