package com.exformatter.plugins.elixir.ast;

import java.math.BigInteger;
import java.util.List;

/**
 * The quoted form of Elixir code.
 * <p>
 * Calls carry a target: an {@link Atom} for local calls and special forms
 * ({@code __block__}, {@code __aliases__}, {@code {}}, {@code %{}}, operators, ...),
 * or another node for remote ({@code {:., _, [target, fun]}}) and anonymous calls.
 * Literals produced by the parser are wrapped in a {@code __block__} call that
 * carries their metadata; a bare literal only appears where the language itself
 * keeps one, such as the integer of {@code &1} or the modifiers of a sigil.
 */
public sealed interface Quoted
        permits Quoted.Atom, Quoted.Int, Quoted.Flt, Quoted.Str, Quoted.QList,
                Quoted.Pair, Quoted.Var, Quoted.Call {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitAtom(Atom atom);

        R visitInt(Int integer);

        R visitFlt(Flt flt);

        R visitStr(Str str);

        R visitList(QList list);

        R visitPair(Pair pair);

        R visitVar(Var var);

        R visitCall(Call call);
    }

    record Atom(String name) implements Quoted {
        public static final Atom NIL = new Atom("nil");
        public static final Atom TRUE = new Atom("true");
        public static final Atom FALSE = new Atom("false");

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAtom(this);
        }

        public boolean is(String expected) {
            return name.equals(expected);
        }
    }

    record Int(BigInteger value) implements Quoted {
        public static Int of(long value) {
            return new Int(BigInteger.valueOf(value));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInt(this);
        }
    }

    record Flt(double value) implements Quoted {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlt(this);
        }
    }

    record Str(String value) implements Quoted {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStr(this);
        }
    }

    record QList(List<Quoted> items) implements Quoted {
        public QList {
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }
    }

    /** A 2-tuple: keyword entries, map associations and two-element tuples. */
    record Pair(Quoted left, Quoted right) implements Quoted {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPair(this);
        }
    }

    /** A variable. Parsed variables have the context {@code nil}. */
    record Var(String name, Meta meta, String context) implements Quoted {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVar(this);
        }
    }

    record Call(Quoted target, Meta meta, List<Quoted> args) implements Quoted {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        /** The name of a local call or special form, or null for remote and anonymous calls. */
        public String localName() {
            return target instanceof Atom atom ? atom.name() : null;
        }

        public boolean isLocal(String name) {
            return target instanceof Atom atom && atom.is(name);
        }

        public int arity() {
            return args.size();
        }

        public Call withMeta(Meta newMeta) {
            return new Call(target, newMeta, args);
        }
    }

    static Atom atom(String name) {
        return new Atom(name);
    }

    static Call call(String name, Meta meta, List<Quoted> args) {
        return new Call(new Atom(name), meta, args);
    }

    static Call call(Quoted target, Meta meta, List<Quoted> args) {
        return new Call(target, meta, args);
    }

    /** The metadata of a call or variable, {@link Meta#EMPTY} for anything else. */
    static Meta metaOf(Quoted quoted) {
        if (quoted instanceof Call call) {
            return call.meta();
        }
        if (quoted instanceof Var var) {
            return var.meta();
        }
        return Meta.EMPTY;
    }
}
