package com.exformatter.plugins.elixir.format;

import static com.exformatter.algebra.Docs.breakWith;
import static com.exformatter.algebra.Docs.concat;
import static com.exformatter.algebra.Docs.empty;
import static com.exformatter.algebra.Docs.forceBreak;
import static com.exformatter.algebra.Docs.glue;
import static com.exformatter.algebra.Docs.group;
import static com.exformatter.algebra.Docs.groupInherit;
import static com.exformatter.algebra.Docs.isEmpty;
import static com.exformatter.algebra.Docs.line;
import static com.exformatter.algebra.Docs.nest;
import static com.exformatter.algebra.Docs.nestCursor;
import static com.exformatter.algebra.Docs.space;
import static com.exformatter.algebra.Docs.text;
import static com.exformatter.plugins.elixir.format.Layouts.endLine;
import static com.exformatter.plugins.elixir.format.Layouts.line;
import static com.exformatter.plugins.elixir.format.Layouts.maybeEmptyLine;
import static com.exformatter.plugins.elixir.format.Layouts.surround;
import static com.exformatter.plugins.elixir.format.Layouts.withNextBreakFits;
import static com.exformatter.plugins.elixir.format.Layouts.wrapInParens;

import java.util.ArrayList;
import java.util.List;

import com.exformatter.algebra.Doc;
import com.exformatter.plugins.elixir.ast.Meta;
import com.exformatter.plugins.elixir.ast.Quoted;
import com.exformatter.plugins.elixir.ast.QuotedForms;
import com.exformatter.plugins.elixir.format.CommentEngine.Slot;

/**
 * Lays out call arguments, do/end blocks, clauses and block bodies.
 */
final class CallLayout {

    /** When the parentheses around call arguments may be left out. */
    enum Parens {
        /** unless the call is itself an argument of another call */
        SKIP_UNLESS_MANY_ARGS,
        /** only when the call ends with do/end blocks */
        SKIP_IF_DO_END,
        REQUIRED
    }

    /**
     * Laid out call arguments.
     *
     * @param wrapInParens whether the whole call must be parenthesized because
     *                     its do/end blocks would otherwise attach to the outer call
     */
    record CallArgs(Doc doc, boolean wrapInParens) {
    }

    private record DoEndBlock(String key, int line, int endLine, Quoted value) {
    }

    private final ExpressionTranslator translator;
    private final CommentEngine comments;
    private final FormatterState state;

    CallLayout(ExpressionTranslator translator, CommentEngine comments, FormatterState state) {
        this.translator = translator;
        this.comments = comments;
        this.state = state;
    }

    // Blocks

    Doc blockToAlgebra(Quoted block, int minLine, int maxLine) {
        if (block instanceof Quoted.QList list && isStabClauses(list)) {
            return typeFunToAlgebra(list.items(), minLine, maxLine);
        }
        if (block instanceof Quoted.Call call && call.isLocal(QuotedForms.BLOCK) && call.arity() != 1) {
            return blockArgsToAlgebra(call.args(), minLine, maxLine);
        }
        return blockArgsToAlgebra(List.of(block), minLine, maxLine);
    }

    private Doc blockArgsToAlgebra(List<Quoted> args, int minLine, int maxLine) {
        List<Doc> docs = comments.quotedToAlgebraWithComments(args, minLine, maxLine, 2,
                (arg, last, newlines) -> {
                    Integer sourceNewlines = Quoted.metaOf(arg).newlines();
                    int docNewlines = sourceNewlines != null ? sourceNewlines : newlines;
                    Doc doc = translator.quotedToAlgebra(arg, Context.BLOCK);
                    return new Slot(doc, ExpressionTranslator.blockNextLine(arg), docNewlines);
                });

        if (docs.isEmpty()) {
            return empty();
        }
        if (docs.size() == 1) {
            return docs.get(0);
        }
        return forceBreak(CommentEngine.joinWith(docs, true));
    }

    static boolean isStabClauses(Quoted.QList list) {
        return !list.isEmpty() && QuotedForms.isCallOf(list.items().get(0), QuotedForms.STAB, 2);
    }

    // Call arguments

    CallArgs callArgsToAlgebra(List<Quoted> args, Context context, Parens parens, boolean listToKeyword) {
        if (args.isEmpty()) {
            return new CallArgs(text("()"), false);
        }

        List<Quoted> init = args.subList(0, args.size() - 1);
        Quoted last = args.get(args.size() - 1);
        List<DoEndBlock> blocks = doEndBlocks(last);

        if (blocks != null) {
            Doc callDoc = empty();
            if (!init.isEmpty()) {
                boolean noParens = parens != Parens.REQUIRED;
                callDoc = callArgsToAlgebraWithoutBlocks(init.subList(0, init.size() - 1), init.get(init.size() - 1),
                        noParens, listToKeyword);
            }
            Doc blocksDoc = doEndBlocksToAlgebra(blocks);
            callDoc = forceBreak(line(space(callDoc, blocksDoc), text("end")));
            return new CallArgs(callDoc, context.isNoParensArg());
        }

        boolean noParens = parens == Parens.SKIP_UNLESS_MANY_ARGS && context.allowsNoParens();
        return new CallArgs(callArgsToAlgebraWithoutBlocks(init, last, noParens, listToKeyword), false);
    }

    private Doc callArgsToAlgebraWithoutBlocks(List<Quoted> left, Quoted right, boolean skipParens,
                                               boolean listToKeyword) {
        List<Quoted> all = new ArrayList<>(left);
        all.add(right);
        boolean multipleGenerators = hasMultipleGenerators(all);

        Quoted lastArg = right;
        boolean keyword = false;
        if (right instanceof Quoted.QList list && !list.isEmpty()) {
            keyword = ExpressionTranslator.isKeyword(list.items());
        } else if (listToKeyword
                && QuotedForms.literalValue(right) instanceof Quoted.QList list
                && !list.isEmpty()
                && ExpressionTranslator.isKeyword(list.items())) {
            keyword = true;
            lastArg = list;
        }

        Context context;
        if (left.isEmpty() && !keyword) {
            context = skipParens ? Context.NO_PARENS_ONE_ARG : Context.PARENS_ONE_ARG;
        } else {
            context = skipParens ? Context.NO_PARENS_ARG : Context.PARENS_ARG;
        }

        if (!left.isEmpty() && keyword && skipParens && !multipleGenerators) {
            return callArgsToAlgebraWithNoParensKeywords(left, lastArg, context);
        }

        List<Quoted> leftArgs = left;
        Quoted rightArg = lastArg;
        if (keyword) {
            List<Quoted> entries = ((Quoted.QList) lastArg).items();
            leftArgs = new ArrayList<>(left);
            leftArgs.addAll(entries.subList(0, entries.size() - 1));
            rightArg = entries.get(entries.size() - 1);
        }

        Context argContext = context;
        Doc leftDoc = translator.argsToAlgebra(leftArgs, arg -> translator.quotedToAlgebra(arg, argContext));
        Doc rightDoc = translator.quotedToAlgebra(rightArg, context);
        boolean noLeft = leftArgs.isEmpty();

        return withNextBreakFits(ExpressionTranslator.nextBreakFits(rightArg), rightDoc, last -> {
            Doc argsDoc = noLeft ? last : glue(concat(leftDoc, text(",")), last);
            if (multipleGenerators) {
                argsDoc = forceBreak(argsDoc);
            }
            if (skipParens) {
                return group(concat(text(" "), nestCursor(argsDoc, true)));
            }
            return surround(text("("), argsDoc, text(")"), true);
        });
    }

    private Doc callArgsToAlgebraWithNoParensKeywords(List<Quoted> left, Quoted right, Context context) {
        Doc leftDoc = translator.argsToAlgebra(left, arg -> translator.quotedToAlgebra(arg, context));
        Doc rightDoc = groupInherit(concat(breakWith(" "), translator.quotedToAlgebra(right, context)));

        return withNextBreakFits(true, rightDoc, last -> {
            Doc argsDoc = concat(leftDoc, text(","), last);
            return group(nest(concat(text(" "), nestCursor(argsDoc, true)), 2));
        });
    }

    /*
     * Two or more generators, as in comprehensions, keep the keyword list in
     * brackets and go one per line.
     */
    private static boolean hasMultipleGenerators(List<Quoted> args) {
        int generators = 0;
        for (Quoted arg : args) {
            if (QuotedForms.isCallOf(arg, "<-", 2)) {
                generators++;
            }
        }
        return generators >= 2;
    }

    // do/end blocks

    private static List<DoEndBlock> doEndBlocks(Quoted last) {
        if (!(last instanceof Quoted.QList list) || list.isEmpty()) {
            return null;
        }
        if (!(list.items().get(0) instanceof Quoted.Pair first) || !isBlockKey(first.left(), "do")) {
            return null;
        }
        Meta doMeta = Quoted.metaOf(first.left());
        if (!doMeta.hasFormat(Meta.FORMAT_BLOCK)) {
            return null;
        }

        List<DoEndBlock> blocks = new ArrayList<>();
        List<Quoted> items = list.items();
        for (int index = 0; index < items.size(); index++) {
            if (!(items.get(index) instanceof Quoted.Pair pair)
                    || !(QuotedForms.literalValue(pair.left()) instanceof Quoted.Atom key)) {
                throw new IllegalStateException("malformed do/end block list at line " + doMeta.line());
            }
            int start = line(Quoted.metaOf(pair.left()));
            int end = index + 1 < items.size()
                    ? line(Quoted.metaOf(((Quoted.Pair) items.get(index + 1)).left()))
                    : endLine(doMeta);
            blocks.add(new DoEndBlock(key.name(), start, end, pair.right()));
        }
        return blocks;
    }

    private static boolean isBlockKey(Quoted key, String name) {
        return QuotedForms.literalValue(key) instanceof Quoted.Atom atom && atom.is(name);
    }

    private Doc doEndBlocksToAlgebra(List<DoEndBlock> blocks) {
        Doc doc = doEndBlockToAlgebra(blocks.get(0));
        for (DoEndBlock block : blocks.subList(1, blocks.size())) {
            doc = line(doc, doEndBlockToAlgebra(block));
        }
        return doc;
    }

    private Doc doEndBlockToAlgebra(DoEndBlock block) {
        Doc key = text(block.key());
        Doc value = clausesToAlgebra(block.value(), block.line(), block.endLine());
        if (isEmpty(value)) {
            return key;
        }
        return nest(line(key, value), 2);
    }

    // Anonymous functions

    Doc anonFunToAlgebra(List<Quoted> clauses, int minLine, int maxLine) {
        if (clauses.size() == 1) {
            Quoted.Call clause = stabClause(clauses.get(0));
            List<Quoted> args = clauseArgs(clause);
            Quoted body = clause.args().get(1);
            int clauseLine = line(clause.meta());

            // fn -> block end
            if (args.isEmpty()) {
                Doc bodyDoc = blockToAlgebra(body, clauseLine, maxLine);
                Doc doc = glue(nest(glue(text("fn ->"), bodyDoc), 2), text("end"));
                return group(maybeForceClauses(doc, clauses));
            }

            // fn x -> y end
            Doc argsDoc = clauseArgsToAlgebra(args, clauseLine);
            Doc bodyDoc = blockToAlgebra(body, clauseLine, maxLine);
            Doc head = nest(concat(text("fn "), group(argsDoc), text(" ->")), 1);
            Doc doc = glue(nest(glue(head, bodyDoc), 2), text("end"));
            return group(maybeForceClauses(doc, clauses));
        }

        Doc clausesDoc = stabClausesToAlgebra(clauses, minLine, maxLine);
        return forceBreak(line(nest(line(text("fn"), clausesDoc), 2), text("end")));
    }

    // Type functions, (args -> result)

    Doc typeFunToAlgebra(List<Quoted> clauses, int minLine, int maxLine) {
        if (clauses.size() == 1) {
            Quoted.Call clause = stabClause(clauses.get(0));
            List<Quoted> args = clauseArgs(clause);
            Quoted body = clause.args().get(1);
            int clauseLine = line(clause.meta());

            if (args.isEmpty()) {
                Doc bodyDoc = blockToAlgebra(body, clauseLine, maxLine);
                Doc doc = concat(text("(() -> "), nestCursor(bodyDoc), text(")"));
                return group(maybeForceClauses(doc, clauses));
            }

            Doc argsDoc = clauseArgsToAlgebra(args, clauseLine);
            Doc bodyDoc = blockToAlgebra(body, clauseLine, maxLine);
            Doc clauseDoc = nest(glue(text(" ->"), bodyDoc), 2);
            Doc doc = wrapInParens(concat(group(argsDoc), clauseDoc));
            return group(maybeForceClauses(doc, clauses));
        }

        Doc clausesDoc = stabClausesToAlgebra(clauses, minLine, maxLine);
        return forceBreak(line(nest(line(text("("), clausesDoc), 2), text(")")));
    }

    // Clauses

    private static Doc maybeForceClauses(Doc doc, List<Quoted> clauses) {
        for (Quoted clause : clauses) {
            if (Quoted.metaOf(clause).eol()) {
                return forceBreak(doc);
            }
        }
        return doc;
    }

    private Doc clausesToAlgebra(Quoted value, int minLine, int maxLine) {
        if (value instanceof Quoted.QList list && isStabClauses(list)) {
            return stabClausesToAlgebra(list.items(), minLine, maxLine);
        }
        Doc doc = blockToAlgebra(value, minLine, maxLine);
        return isEmpty(doc) ? doc : group(doc);
    }

    private Doc stabClausesToAlgebra(List<Quoted> clauses, int minLine, int maxLine) {
        List<Quoted> withMaxLine = new ArrayList<>(clauses);
        int lastIndex = withMaxLine.size() - 1;
        Quoted.Call lastClause = stabClause(withMaxLine.get(lastIndex));
        withMaxLine.set(lastIndex, lastClause.withMeta(lastClause.meta().withEndLine(maxLine)));

        Doc doc = clauseToAlgebra(stabClause(withMaxLine.get(0)), minLine);
        for (Quoted clause : withMaxLine.subList(1, withMaxLine.size())) {
            Doc clauseDoc = clauseToAlgebra(stabClause(clause), minLine);
            doc = line(concat(doc, maybeEmptyLine()), clauseDoc);
        }
        return group(maybeForceClauses(doc, withMaxLine));
    }

    private Doc clauseToAlgebra(Quoted.Call clause, int minLine) {
        List<Quoted> args = clauseArgs(clause);
        Quoted body = clause.args().get(1);
        Meta meta = clause.meta();

        if (args.isEmpty()) {
            Doc bodyDoc = blockToAlgebra(body, line(meta), endLine(meta));
            return nest(glue(text("() ->"), bodyDoc), 2);
        }

        int nesting = state.getOperandNesting();
        state.setOperandNesting(nesting + 2);
        Doc argsDoc = clauseArgsToAlgebra(args, minLine);
        state.setOperandNesting(nesting);

        Doc bodyDoc = blockToAlgebra(body, minLine, endLine(meta));
        return concat(group(argsDoc), nest(glue(text(" ->"), bodyDoc), 2));
    }

    // fn a, b, c when d -> e end
    private Doc clauseArgsToAlgebra(List<Quoted> args, int minLine) {
        if (args.size() == 1 && args.get(0) instanceof Quoted.Call guard && guard.isLocal("when")) {
            List<Quoted> guarded = guard.args();
            if (guarded.isEmpty()) {
                throw new IllegalStateException("guard without arguments at line " + guard.meta().line());
            }
            List<Quoted> heads = guarded.subList(0, guarded.size() - 1);
            Quoted condition = guarded.get(guarded.size() - 1);
            return translator.binaryOpToAlgebra("when", guard.meta(),
                    () -> group(clauseArgsToAlgebra(heads, minLine)), condition, Context.NO_PARENS_ARG);
        }
        if (args.isEmpty()) {
            return text("()");
        }
        return comments.argsToAlgebraWithComments(args, Meta.atLine(minLine),
                arg -> translator.quotedToAlgebra(arg, Context.NO_PARENS_ARG));
    }

    private static Quoted.Call stabClause(Quoted clause) {
        if (!QuotedForms.isCallOf(clause, QuotedForms.STAB, 2)) {
            throw new IllegalStateException("expected a -> clause, got " + clause);
        }
        return (Quoted.Call) clause;
    }

    private static List<Quoted> clauseArgs(Quoted.Call clause) {
        if (!(clause.args().get(0) instanceof Quoted.QList args)) {
            throw new IllegalStateException("-> clause without an argument list at line " + clause.meta().line());
        }
        return args.items();
    }
}
