package com.exformatter.api;

/**
 * A rewrite that changes the code beyond its layout.
 */
public final class Refactoring {
    public enum Kind {
        /** A call to a deprecated function replaced by its successor. */
        RENAME_DEPRECATED
    }

    private final Kind kind;
    private final int line;
    private final String description;

    public Refactoring(Kind kind, int line, String description) {
        this.kind = kind;
        this.line = line;
        this.description = description;
    }

    /**
     * A rename of {@code module.from/arity} to {@code module.to/arity} on {@code line}.
     */
    public static Refactoring renamedDeprecated(int line, String module, String from, String to, int arity) {
        return new Refactoring(Kind.RENAME_DEPRECATED, line,
                module + "." + from + "/" + arity + " renamed to " + module + "." + to + "/" + arity);
    }

    public Kind getKind() { return kind; }
    public int getLine() { return line; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return "line " + line + ": " + description;
    }
}
