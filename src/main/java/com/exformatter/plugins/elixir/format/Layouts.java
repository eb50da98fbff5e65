package com.exformatter.plugins.elixir.format;

import static com.exformatter.algebra.Docs.breakWith;
import static com.exformatter.algebra.Docs.concat;
import static com.exformatter.algebra.Docs.glue;
import static com.exformatter.algebra.Docs.group;
import static com.exformatter.algebra.Docs.isEmpty;
import static com.exformatter.algebra.Docs.nest;
import static com.exformatter.algebra.Docs.nestCursor;
import static com.exformatter.algebra.Docs.nestReset;
import static com.exformatter.algebra.Docs.nextBreakFits;
import static com.exformatter.algebra.Docs.text;

import java.util.function.UnaryOperator;

import com.exformatter.algebra.Doc;
import com.exformatter.algebra.DocRenderer;
import com.exformatter.plugins.elixir.ast.Meta;

/**
 * Document shapes shared by the translator and the call layout.
 */
final class Layouts {
    static final int MIN_LINE = 0;
    static final int MAX_LINE = 9_999_999;

    private Layouts() {
    }

    /** The start line, or {@link #MAX_LINE} when unknown. */
    static int line(Meta meta) {
        return meta.lineOr(MAX_LINE);
    }

    /** The end line, or {@link #MIN_LINE} when unknown. */
    static int endLine(Meta meta) {
        return meta.endLineOr(MIN_LINE);
    }

    static Doc surround(String left, Doc doc, String right) {
        return surround(text(left), doc, text(right), false);
    }

    /**
     * {@code left doc right}, breaking inside the delimiters when the content does
     * not fit. With {@code nestOnBreak} the content is only indented when the
     * surrounding group breaks.
     */
    static Doc surround(Doc left, Doc doc, Doc right, boolean nestOnBreak) {
        if (isEmpty(doc)) {
            return concat(left, right);
        }
        return group(glue(nest(glue(left, "", doc), 2, nestOnBreak), "", right));
    }

    static Doc wrapInParens(Doc doc) {
        return concat(text("("), nestCursor(doc), text(")"));
    }

    static Doc nestByLength(Doc doc, String string) {
        return nest(doc, string.codePointCount(0, string.length()));
    }

    static Doc maybeEmptyLine() {
        return nestReset(breakWith(""));
    }

    /** Renders without width limits, for decisions based on the rendered text. */
    static String formatToString(Doc doc) {
        return DocRenderer.renderFlat(doc);
    }

    /**
     * Applies {@code layout} to {@code doc}, letting {@code doc} decide its own
     * breaks when {@code condition} holds.
     */
    static Doc withNextBreakFits(boolean condition, Doc doc, UnaryOperator<Doc> layout) {
        if (condition) {
            return nextBreakFits(layout.apply(nextBreakFits(doc, true)), false);
        }
        return layout.apply(doc);
    }
}
