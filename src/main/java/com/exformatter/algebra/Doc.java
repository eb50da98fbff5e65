package com.exformatter.algebra;

/**
 * A layout document. Documents are immutable values built with {@link Docs}
 * and rendered to text by {@link DocRenderer}.
 */
public sealed interface Doc
        permits Doc.Nil, Doc.Text, Doc.Cons, Doc.Nest, Doc.Break, Doc.Line,
                Doc.Group, Doc.Force, Doc.Fits, Doc.Collapse {

    /** How a {@link Nest} computes its indentation. */
    enum NestKind {
        COLUMNS,
        CURSOR,
        RESET
    }

    enum Nil implements Doc {
        INSTANCE
    }

    enum Line implements Doc {
        INSTANCE
    }

    record Text(String text, int length) implements Doc {
    }

    record Cons(Doc left, Doc right) implements Doc {
    }

    /**
     * Indents the lines started inside {@code doc}. When {@code breakOnly} is set
     * the indentation only applies if the nest is rendered in break mode.
     */
    record Nest(Doc doc, NestKind kind, int columns, boolean breakOnly) implements Doc {
    }

    record Break(String text) implements Doc {
    }

    record Group(Doc doc, boolean inherit) implements Doc {
    }

    record Force(Doc doc) implements Doc {
    }

    record Fits(Doc doc, boolean enabled) implements Doc {
    }

    record Collapse(int max) implements Doc {
    }
}
