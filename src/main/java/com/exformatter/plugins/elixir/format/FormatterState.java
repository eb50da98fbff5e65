package com.exformatter.plugins.elixir.format;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.exformatter.util.Version;

/**
 * State threaded through one translation: the pending comments, the calls
 * that may omit parentheses, the deprecation threshold and the operand nesting.
 * <p>
 * A state belongs to a single format call and is not shared between threads.
 */
public final class FormatterState {

    /** Calls written without parentheses unless the context requires them. */
    public static final Set<String> DEFAULT_LOCALS_WITHOUT_PARENS = Set.of(
            // special forms
            "alias/1", "alias/2", "case/2", "cond/1", "import/1", "import/2",
            "require/1", "require/2", "for/*", "receive/1", "try/1", "with/*",
            // kernel
            "def/1", "def/2", "defp/1", "defp/2", "defmacro/1", "defmacro/2",
            "defmacrop/1", "defmacrop/2", "defdelegate/2", "defexception/1",
            "defoverridable/1", "defstruct/1", "destructure/2", "raise/1", "raise/2",
            "reraise/2", "reraise/3", "if/2", "unless/2", "use/1", "use/2",
            // testing
            "all/*", "assert/1", "assert/2", "assert_in_delta/3", "assert_in_delta/4",
            "assert_raise/2", "assert_raise/3", "assert_receive/1", "assert_receive/2",
            "assert_receive/3", "assert_received/1", "assert_received/2", "check/1",
            "check/2", "doctest/1", "doctest/2", "property/1", "property/2", "refute/1",
            "refute/2", "refute_in_delta/3", "refute_in_delta/4", "refute_receive/1",
            "refute_receive/2", "refute_receive/3", "refute_received/1",
            "refute_received/2", "setup/1", "setup/2", "test/1", "test/2");

    /** A remote call rewritten to its replacement name. */
    public record Rename(int line, String module, String from, String to, int arity) {
    }

    private final Set<String> localsWithoutParens;
    private final Version renameDeprecatedAt;
    private final List<Rename> renames = new ArrayList<>();
    private List<Comment> comments;
    private int operandNesting = 2;

    public FormatterState(List<Comment> comments, Collection<String> extraLocalsWithoutParens,
                          Version renameDeprecatedAt) {
        Set<String> locals = new HashSet<>(DEFAULT_LOCALS_WITHOUT_PARENS);
        locals.addAll(extraLocalsWithoutParens);
        this.localsWithoutParens = Collections.unmodifiableSet(locals);
        this.renameDeprecatedAt = renameDeprecatedAt;
        this.comments = List.copyOf(comments);
    }

    /** True when {@code name} called with {@code arity} arguments may omit parentheses. */
    public boolean isLocalWithoutParens(String name, int arity) {
        return arity > 0
                && (localsWithoutParens.contains(name + "/" + arity) || localsWithoutParens.contains(name + "/*"));
    }

    public Version getRenameDeprecatedAt() {
        return renameDeprecatedAt;
    }

    public List<Comment> getComments() {
        return comments;
    }

    public void setComments(List<Comment> comments) {
        this.comments = comments;
    }

    public int getOperandNesting() {
        return operandNesting;
    }

    public void setOperandNesting(int operandNesting) {
        this.operandNesting = operandNesting;
    }

    void recordRename(Rename rename) {
        renames.add(rename);
    }

    /** Deprecated calls renamed during translation, in translation order. */
    public List<Rename> getRenames() {
        return Collections.unmodifiableList(renames);
    }
}
