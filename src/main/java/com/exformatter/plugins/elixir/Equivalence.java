package com.exformatter.plugins.elixir;

import java.util.List;
import java.util.Optional;

import com.exformatter.plugins.elixir.ast.Quoted;
import com.exformatter.plugins.elixir.ast.QuotedForms;
import com.exformatter.plugins.elixir.parser.ParseException;
import com.exformatter.plugins.elixir.parser.SourceReader;

/**
 * Checks that two sources have the same quoted form. Metadata is ignored,
 * as are {@code __block__} wrappers around a single expression; an empty block
 * and {@code nil} are the same.
 */
public final class Equivalence {

    /** The first pair of subtrees that differ. */
    public record Difference(Quoted left, Quoted right) {
    }

    private Equivalence() {
    }

    public static Optional<Difference> check(String left, String right) throws ParseException {
        Quoted leftForms = SourceReader.read(left, FormatOptions.DEFAULT_FILE, 1).forms();
        Quoted rightForms = SourceReader.read(right, FormatOptions.DEFAULT_FILE, 1).forms();
        return Optional.ofNullable(difference(leftForms, rightForms));
    }

    static Difference difference(Quoted left, Quoted right) {
        if (isSingleBlock(left)) {
            return difference(((Quoted.Call) left).args().get(0), right);
        }
        if (isSingleBlock(right)) {
            return difference(left, ((Quoted.Call) right).args().get(0));
        }
        if ((isEmptyBlock(left) && Quoted.Atom.NIL.equals(right))
                || (Quoted.Atom.NIL.equals(left) && isEmptyBlock(right))) {
            return null;
        }

        if (left instanceof Quoted.QList leftList && right instanceof Quoted.QList rightList) {
            return difference(leftList.items(), rightList.items());
        }
        if (left instanceof Quoted.Call leftCall && right instanceof Quoted.Call rightCall) {
            Difference target = difference(leftCall.target(), rightCall.target());
            return target != null ? target : difference(leftCall.args(), rightCall.args());
        }
        if (left instanceof Quoted.Var leftVar && right instanceof Quoted.Var rightVar) {
            boolean same = leftVar.name().equals(rightVar.name()) && leftVar.context().equals(rightVar.context());
            return same ? null : new Difference(left, right);
        }
        if (left instanceof Quoted.Pair leftPair && right instanceof Quoted.Pair rightPair) {
            Difference first = difference(leftPair.left(), rightPair.left());
            return first != null ? first : difference(leftPair.right(), rightPair.right());
        }
        return left.equals(right) ? null : new Difference(left, right);
    }

    private static Difference difference(List<Quoted> left, List<Quoted> right) {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            Difference difference = difference(left.get(i), right.get(i));
            if (difference != null) {
                return difference;
            }
        }
        if (left.size() != right.size()) {
            return new Difference(new Quoted.QList(left.subList(shared, left.size())),
                    new Quoted.QList(right.subList(shared, right.size())));
        }
        return null;
    }

    private static boolean isSingleBlock(Quoted quoted) {
        return QuotedForms.isCallOf(quoted, QuotedForms.BLOCK, 1);
    }

    private static boolean isEmptyBlock(Quoted quoted) {
        return QuotedForms.isCallOf(quoted, QuotedForms.BLOCK, 0);
    }
}
