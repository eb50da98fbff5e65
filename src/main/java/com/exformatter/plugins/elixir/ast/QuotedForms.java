package com.exformatter.plugins.elixir.ast;

import java.util.List;

/**
 * Builders and shape tests for the well-known forms of the quoted tree.
 */
public final class QuotedForms {
    public static final String BLOCK = "__block__";
    public static final String ALIASES = "__aliases__";
    public static final String DOT = ".";
    public static final String STAB = "->";
    public static final String BITSTRING = "<<>>";
    public static final String MAP = "%{}";
    public static final String STRUCT = "%";
    public static final String TUPLE = "{}";
    public static final String TYPE = "::";

    public static final Quoted.Atom KERNEL = new Quoted.Atom("Elixir.Kernel");
    public static final Quoted.Atom STRING = new Quoted.Atom("Elixir.String");
    public static final Quoted.Atom ACCESS = new Quoted.Atom("Elixir.Access");
    public static final Quoted.Atom ERLANG = new Quoted.Atom("erlang");

    private QuotedForms() {
    }

    /** Wraps a literal in a {@code __block__} that carries its metadata. */
    public static Quoted.Call literal(Quoted value, Meta meta) {
        return Quoted.call(BLOCK, meta, List.of(value));
    }

    public static Quoted.Call block(Meta meta, List<Quoted> exprs) {
        return Quoted.call(BLOCK, meta, exprs);
    }

    public static Quoted.Call emptyBlock() {
        return Quoted.call(BLOCK, Meta.EMPTY, List.of());
    }

    /** {@code {:., meta, [target, fun]}} */
    public static Quoted.Call dot(Quoted target, String fun, Meta meta) {
        return Quoted.call(DOT, meta, List.of(target, new Quoted.Atom(fun)));
    }

    /** {@code {{:., meta, [target, fun]}, meta, args}} */
    public static Quoted.Call remote(Quoted target, String fun, Meta meta, List<Quoted> args) {
        return Quoted.call(dot(target, fun, meta), meta, args);
    }

    /**
     * The single value of a literal {@code __block__}, or null when {@code quoted}
     * is not a one-element block.
     */
    public static Quoted literalValue(Quoted quoted) {
        if (quoted instanceof Quoted.Call call && call.isLocal(BLOCK) && call.args().size() == 1) {
            return call.args().get(0);
        }
        return null;
    }

    /** True for {@code {{:., _, [target, fun]}, _, _}} with the given target and function. */
    public static boolean isRemote(Quoted quoted, Quoted.Atom module, String fun) {
        if (!(quoted instanceof Quoted.Call call) || !(call.target() instanceof Quoted.Call dot)) {
            return false;
        }
        return dot.isLocal(DOT)
                && dot.args().size() == 2
                && module.equals(dot.args().get(0))
                && new Quoted.Atom(fun).equals(dot.args().get(1));
    }

    /** The {@code {:., _, args}} head of a remote or anonymous call, or null. */
    public static Quoted.Call dotHead(Quoted quoted) {
        if (quoted instanceof Quoted.Call call
                && call.target() instanceof Quoted.Call dot
                && dot.isLocal(DOT)) {
            return dot;
        }
        return null;
    }

    public static boolean isCallOf(Quoted quoted, String name, int arity) {
        return quoted instanceof Quoted.Call call && call.isLocal(name) && call.arity() == arity;
    }

    /** Interpolated string entries: binaries and {@code Kernel.to_string(expr) :: binary} segments. */
    public static boolean isInterpolated(List<Quoted> entries) {
        for (Quoted entry : entries) {
            if (!(entry instanceof Quoted.Str) && interpolatedExpression(entry) == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * The {@code Kernel.to_string/1} call of an interpolation segment, or null when
     * {@code entry} is not one.
     */
    public static Quoted.Call interpolatedExpression(Quoted entry) {
        if (!isCallOf(entry, TYPE, 2)) {
            return null;
        }
        Quoted.Call type = (Quoted.Call) entry;
        Quoted left = type.args().get(0);
        Quoted right = type.args().get(1);
        boolean binary = right instanceof Quoted.Var var && var.name().equals("binary");
        if (binary && isRemote(left, KERNEL, "to_string") && ((Quoted.Call) left).arity() == 1) {
            return (Quoted.Call) left;
        }
        return null;
    }

    public static Quoted.Call interpolation(Quoted expr, Meta meta) {
        Quoted.Call toString = remote(KERNEL, "to_string", meta, List.of(expr));
        Quoted binary = new Quoted.Var("binary", meta, "nil");
        return Quoted.call(TYPE, meta, List.of(toString, binary));
    }
}
