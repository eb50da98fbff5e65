package com.exformatter.plugins.elixir.format;

import static com.exformatter.algebra.Docs.breakWith;
import static com.exformatter.algebra.Docs.concat;
import static com.exformatter.algebra.Docs.empty;
import static com.exformatter.algebra.Docs.forceBreak;
import static com.exformatter.algebra.Docs.glue;
import static com.exformatter.algebra.Docs.group;
import static com.exformatter.algebra.Docs.line;
import static com.exformatter.algebra.Docs.nest;
import static com.exformatter.algebra.Docs.text;
import static com.exformatter.plugins.elixir.format.Layouts.endLine;
import static com.exformatter.plugins.elixir.format.Layouts.formatToString;
import static com.exformatter.plugins.elixir.format.Layouts.line;
import static com.exformatter.plugins.elixir.format.Layouts.nestByLength;
import static com.exformatter.plugins.elixir.format.Layouts.surround;
import static com.exformatter.plugins.elixir.format.Layouts.withNextBreakFits;
import static com.exformatter.plugins.elixir.format.Layouts.wrapInParens;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

import com.exformatter.algebra.Doc;
import com.exformatter.plugins.elixir.ast.Meta;
import com.exformatter.plugins.elixir.ast.Quoted;
import com.exformatter.plugins.elixir.ast.QuotedForms;
import com.exformatter.plugins.elixir.format.CallLayout.CallArgs;
import com.exformatter.plugins.elixir.format.CallLayout.Parens;
import com.exformatter.plugins.elixir.format.Operators.OpInfo;
import com.exformatter.plugins.elixir.format.Operators.Side;

/**
 * Translates quoted expressions to documents.
 * <p>
 * One translator serves one format call: it shares its {@link FormatterState}
 * with the {@link CallLayout} and the {@link CommentEngine} it drives.
 */
public final class ExpressionTranslator {
    private static final String TO_CHARLIST = "to_charlist";
    private static final String BINARY_TO_ATOM = "binary_to_atom";

    private final FormatterState state;
    private final CommentEngine comments;
    private final CallLayout calls;

    public ExpressionTranslator(FormatterState state) {
        this.state = state;
        this.comments = new CommentEngine(state);
        this.calls = new CallLayout(this, comments, state);
    }

    /** Translates the top-level forms of a source file. */
    public Doc translate(Quoted forms) {
        return calls.blockToAlgebra(forms, Layouts.MIN_LINE, Layouts.MAX_LINE);
    }

    FormatterState state() {
        return state;
    }

    Doc quotedToAlgebra(Quoted quoted, Context context) {
        return quoted.accept(new Dispatch(context));
    }

    /** One translation step; every node variant has its own rule. */
    private final class Dispatch implements Quoted.Visitor<Doc> {
        private final Context context;

        Dispatch(Context context) {
            this.context = context;
        }

        @Override
        public Doc visitAtom(Quoted.Atom atom) {
            throw bareLiteral(atom);
        }

        @Override
        public Doc visitInt(Quoted.Int integer) {
            throw bareLiteral(integer);
        }

        @Override
        public Doc visitFlt(Quoted.Flt flt) {
            throw bareLiteral(flt);
        }

        @Override
        public Doc visitStr(Quoted.Str str) {
            throw bareLiteral(str);
        }

        @Override
        public Doc visitVar(Quoted.Var var) {
            return text(var.name());
        }

        @Override
        public Doc visitList(Quoted.QList list) {
            // (left -> right)
            if (CallLayout.isStabClauses(list)) {
                return calls.typeFunToAlgebra(list.items(), Layouts.MAX_LINE, Layouts.MIN_LINE);
            }
            // [keyword: :list] and %{:foo => :bar} without their delimiters
            return argsToAlgebra(list.items(), arg -> quotedToAlgebra(arg, context));
        }

        @Override
        public Doc visitPair(Quoted.Pair pair) {
            if (isKeywordKey(pair.left())) {
                Doc key = keywordKeyToAlgebra(pair.left());
                return concat(key, quotedToAlgebra(pair.right(), context));
            }
            Doc left = quotedToAlgebra(pair.left(), context);
            Doc right = quotedToAlgebra(pair.right(), context);
            return concat(left, text(" => "), right);
        }

        @Override
        public Doc visitCall(Quoted.Call call) {
            String name = call.localName();
            if (name == null) {
                return remoteCallToAlgebra(call, context);
            }
            return switch (name) {
                case QuotedForms.BITSTRING -> bitstringOrStringToAlgebra(call);
                case QuotedForms.STRUCT -> structToAlgebra(call, context);
                case QuotedForms.MAP -> mapToAlgebra(call.meta(), empty(), call.args());
                case QuotedForms.TUPLE -> tupleToAlgebra(call.meta(), call.args());
                case QuotedForms.BLOCK -> blockToAlgebra(call, context);
                case QuotedForms.ALIASES -> aliasesToAlgebra(call, context);
                case "&" -> call.arity() == 1 ? captureToAlgebra(call.args().get(0), context) : localCall(call, context);
                case "@" -> call.arity() == 1
                        ? moduleAttributeToAlgebra(call.meta(), call.args().get(0), context)
                        : localCall(call, context);
                case "not" -> notToAlgebra(call, context);
                case "fn" -> call.args().isEmpty()
                        ? localCall(call, context)
                        : calls.anonFunToAlgebra(call.args(), line(call.meta()), endLine(call.meta()));
                default -> localCall(call, context);
            };
        }
    }

    private static IllegalStateException bareLiteral(Quoted quoted) {
        return new IllegalStateException("no translation rule for bare literal " + quoted);
    }

    // Strings, charlists and atoms with interpolation are calls of their own

    private Doc remoteCallToAlgebra(Quoted.Call call, Context context) {
        if (QuotedForms.isRemote(call, QuotedForms.STRING, TO_CHARLIST)
                && call.arity() == 1
                && call.args().get(0) instanceof Quoted.Call binary
                && binary.isLocal(QuotedForms.BITSTRING)) {
            if (!QuotedForms.isInterpolated(binary.args())) {
                return remoteToAlgebra(call, context);
            }
            if (binary.meta().hasFormat(Meta.FORMAT_LIST_HEREDOC)) {
                Doc initial = forceBreak(concat(text(Literals.SINGLE_HEREDOC), line()));
                return interpolationToAlgebra(binary.args(), Literals::heredoc, initial, text(Literals.SINGLE_HEREDOC));
            }
            return interpolationToAlgebra(binary.args(), escaper(Literals.SINGLE_QUOTE),
                    text(Literals.SINGLE_QUOTE), text(Literals.SINGLE_QUOTE));
        }

        if (isInterpolatedAtom(call)) {
            Quoted.Call binary = (Quoted.Call) call.args().get(0);
            return interpolationToAlgebra(binary.args(), escaper(Literals.DOUBLE_QUOTE),
                    text(":\""), text(Literals.DOUBLE_QUOTE));
        }

        // foo[bar]
        if (QuotedForms.isRemote(call, QuotedForms.ACCESS, "get") && !call.args().isEmpty()) {
            Doc target = remoteTargetToAlgebra(call.args().get(0));
            Doc access = listToAlgebra(call.meta(), call.args().subList(1, call.arity()));
            return concat(target, access);
        }

        return remoteToAlgebra(call, context);
    }

    private static boolean isInterpolatedAtom(Quoted.Call call) {
        return binaryToAtomEntries(call) != null;
    }

    /** The entries of {@code :erlang.binary_to_atom(<<...>>, :utf8)}, or null. */
    private static List<Quoted> binaryToAtomEntries(Quoted quoted) {
        if (!QuotedForms.isRemote(quoted, QuotedForms.ERLANG, BINARY_TO_ATOM)) {
            return null;
        }
        Quoted.Call call = (Quoted.Call) quoted;
        if (call.arity() != 2
                || !(call.args().get(0) instanceof Quoted.Call binary)
                || !binary.isLocal(QuotedForms.BITSTRING)
                || !new Quoted.Atom("utf8").equals(call.args().get(1))
                || !QuotedForms.isInterpolated(binary.args())) {
            return null;
        }
        return binary.args();
    }

    private Doc bitstringOrStringToAlgebra(Quoted.Call call) {
        List<Quoted> entries = call.args();
        if (entries.isEmpty()) {
            return text("<<>>");
        }
        if (!QuotedForms.isInterpolated(entries)) {
            return bitstringToAlgebra(call.meta(), entries);
        }
        if (call.meta().hasFormat(Meta.FORMAT_BIN_HEREDOC)) {
            Doc initial = forceBreak(concat(text(Literals.DOUBLE_HEREDOC), line()));
            return interpolationToAlgebra(entries, Literals::heredoc, initial, text(Literals.DOUBLE_HEREDOC));
        }
        return interpolationToAlgebra(entries, escaper(Literals.DOUBLE_QUOTE),
                text(Literals.DOUBLE_QUOTE), text(Literals.DOUBLE_QUOTE));
    }

    // %Foo{} and %name{bar | foo: 1}
    private Doc structToAlgebra(Quoted.Call call, Context context) {
        if (call.arity() == 2 && call.args().get(1) instanceof Quoted.Call map && map.isLocal(QuotedForms.MAP)) {
            Doc name = quotedToAlgebra(call.args().get(0), Context.PARENS_ARG);
            return mapToAlgebra(map.meta(), name, map.args());
        }
        return localCall(call, context);
    }

    private Doc blockToAlgebra(Quoted.Call block, Context context) {
        Meta meta = block.meta();
        if (block.arity() != 1) {
            Doc doc = calls.blockToAlgebra(block, line(meta), endLine(meta));
            return surround("(", doc, ")");
        }

        Quoted value = block.args().get(0);
        if (value instanceof Quoted.Pair pair) {
            return tupleToAlgebra(meta, List.of(pair.left(), pair.right()));
        }
        if (value instanceof Quoted.QList list) {
            if (meta.hasFormat(Meta.FORMAT_LIST_HEREDOC)) {
                Doc string = Literals.heredoc(codePointsToString(list));
                return forceBreak(concat(line(text(Literals.SINGLE_HEREDOC), string), text(Literals.SINGLE_HEREDOC)));
            }
            if (meta.hasFormat(Meta.FORMAT_CHARLIST)) {
                Doc string = Literals.escapeString(codePointsToString(list), Literals.SINGLE_QUOTE);
                return concat(text(Literals.SINGLE_QUOTE), string, text(Literals.SINGLE_QUOTE));
            }
            return listToAlgebra(meta, list.items());
        }
        if (value instanceof Quoted.Str str) {
            if (meta.hasFormat(Meta.FORMAT_BIN_HEREDOC)) {
                Doc string = Literals.heredoc(str.value());
                return forceBreak(concat(line(text(Literals.DOUBLE_HEREDOC), string), text(Literals.DOUBLE_HEREDOC)));
            }
            Doc string = Literals.escapeString(str.value(), Literals.DOUBLE_QUOTE);
            return concat(text(Literals.DOUBLE_QUOTE), string, text(Literals.DOUBLE_QUOTE));
        }
        if (value instanceof Quoted.Atom atom) {
            return Literals.atom(atom.name());
        }
        if (value instanceof Quoted.Int) {
            return text(Literals.integer(meta.requireOriginal()));
        }
        if (value instanceof Quoted.Flt) {
            return text(Literals.floatNumber(meta.requireOriginal()));
        }
        if (QuotedForms.isCallOf(value, "unquote_splicing", 1)) {
            Quoted.Call splice = (Quoted.Call) value;
            return wrapInParens(localToAlgebra("unquote_splicing", splice.args(), context));
        }
        return quotedToAlgebra(value, context);
    }

    private static String codePointsToString(Quoted.QList list) {
        StringBuilder builder = new StringBuilder();
        for (Quoted item : list.items()) {
            if (!(item instanceof Quoted.Int codePoint)) {
                throw new IllegalStateException("charlist with a non integer element: " + item);
            }
            builder.appendCodePoint(codePoint.value().intValueExact());
        }
        return builder.toString();
    }

    private Doc aliasesToAlgebra(Quoted.Call call, Context context) {
        if (call.args().isEmpty()) {
            throw new IllegalStateException("alias without segments at line " + call.meta().line());
        }
        Quoted head = call.args().get(0);
        Doc doc = head instanceof Quoted.Atom atom
                ? text(atom.name())
                : quotedToAlgebraWithParensIfNecessary(head, context);

        for (Quoted segment : call.args().subList(1, call.arity())) {
            if (!(segment instanceof Quoted.Atom atom)) {
                throw new IllegalStateException("alias segment is not an atom: " + segment);
            }
            doc = concat(doc, text("." + atom.name()));
        }
        return doc;
    }

    // not(left in right) and left not in right
    private Doc notToAlgebra(Quoted.Call call, Context context) {
        if (call.arity() == 1 && QuotedForms.isCallOf(call.args().get(0), "in", 2)) {
            Quoted.Call in = (Quoted.Call) call.args().get(0);
            return binaryOpToAlgebra("in", "not in", call.meta(), in.args().get(0), in.args().get(1), context);
        }
        return localCall(call, context);
    }

    private Doc localCall(Quoted.Call call, Context context) {
        String fun = call.localName();
        List<Quoted> args = call.args();

        Optional<Doc> sigil = maybeSigilToAlgebra(fun, call.meta(), args);
        if (sigil.isPresent()) {
            return sigil.get();
        }
        if (args.size() == 1 && Operators.isUnaryOp(fun)) {
            return unaryOpToAlgebra(fun, args.get(0), context);
        }
        if (args.size() == 2 && Operators.isBinaryOp(fun)) {
            return binaryOpToAlgebra(fun, fun, call.meta(), args.get(0), args.get(1), context);
        }
        return localToAlgebra(fun, args, context);
    }

    // Operators

    Doc unaryOpToAlgebra(String op, Quoted arg, Context context) {
        Doc doc = quotedToAlgebra(arg, context.forceManyArgsOr(Context.OPERAND));

        // not and ! are nestable, all others are not
        boolean nested = (op.equals("!") || op.equals("not")) && QuotedForms.isCallOf(arg, op, 1);
        Doc wrapped = nested ? doc : wrapInParensIfNecessary(arg, doc);

        // not requires a space unless the operand was wrapped in parens
        String opString = op.equals("not") && wrapped == doc ? "not " : op;
        return concat(text(opString), wrapped);
    }

    Doc binaryOpToAlgebra(String op, String opString, Meta meta, Quoted left, Quoted right, Context context) {
        return binaryOpToAlgebra(op, opString, meta, left, null, right, context, null, state.getOperandNesting());
    }

    /** A binary operator whose left side is already laid out, as in guarded clause heads. */
    Doc binaryOpToAlgebra(String op, Meta meta, Supplier<Doc> left, Quoted right, Context context) {
        return binaryOpToAlgebra(op, op, meta, null, left, right, context, null, state.getOperandNesting());
    }

    /*
     * Operators are laid out by spacing class. No space, no newline and flex
     * operators rely on precedence and nest once. Operators that start the next
     * line on breaks only group when the parent is a different operator, so a
     * chain of them breaks as a whole.
     */
    private Doc binaryOpToAlgebra(String op, String opString, Meta meta, Quoted leftArg, Supplier<Doc> leftLayout,
                                  Quoted rightArg, Context context, OpInfo parentInfo, int nesting) {
        OpInfo opInfo = Operators.binaryOp(op)
                .orElseThrow(() -> new IllegalStateException("not a binary operator: " + op));
        Context leftContext = context.forceManyArgsOr(Context.PARENS_ARG);
        Context rightContext = context.forceManyArgsOr(Context.OPERAND);

        Doc left = leftLayout != null
                ? leftLayout.get()
                : binaryOperandToAlgebra(leftArg, leftContext, op, opInfo, Side.LEFT, 2);
        Doc right = binaryOperandToAlgebra(rightArg, rightContext, op, opInfo, Side.RIGHT, 0);

        switch (Operators.spacing(op)) {
            case NO_SPACE:
                return concat(left, text(opString), right);

            case NO_NEWLINE:
                return concat(left, text(" " + opString + " "), right);

            case LEFT_NEW_LINE: {
                String spaced = opString + " ";
                Doc doc = glue(left, concat(text(spaced), nestByLength(right, spaced)));
                if (meta.eol()) {
                    doc = forceBreak(doc);
                }
                return opInfo.equals(parentInfo) ? doc : group(doc);
            }

            case RIGHT_NEW_LINE: {
                String spaced = opString + " ";
                // a parent of the same precedence nests the left side, the
                // right side is nested when it is not the same operator
                if (opInfo.equals(parentInfo)) {
                    left = nestByLength(left, spaced);
                }
                if (!QuotedForms.isCallOf(rightArg, op, 2)) {
                    right = nestByLength(right, spaced);
                }
                Doc doc = glue(left, concat(text(spaced), right));
                return parentInfo == null || opInfo.equals(parentInfo) ? doc : group(doc);
            }

            default: {
                Doc leftDoc = left;
                return withNextBreakFits(nextBreakFits(rightArg), right, rightDoc ->
                        concat(leftDoc, group(nest(glue(text(" " + opString), group(rightDoc)), nesting, true))));
            }
        }
    }

    private Doc binaryOperandToAlgebra(Quoted operand, Context context, String parentOp, OpInfo parentInfo,
                                       Side side, int nesting) {
        // (not left) in right and (!left) in right keep their parens
        if (parentOp.equals("in") && side == Side.LEFT) {
            Quoted unary = QuotedForms.literalValue(operand);
            if (unary instanceof Quoted.Call call
                    && (call.isLocal("not") || call.isLocal("!"))
                    && call.arity() == 1) {
                return wrapInParens(unaryOpToAlgebra(call.localName(), call.args().get(0), context));
            }
        }

        if (operand instanceof Quoted.Call call && call.arity() == 2 && call.localName() != null) {
            String op = call.localName();
            Optional<OpInfo> info = Operators.binaryOp(op);
            if (info.isPresent()) {
                OpInfo opInfo = info.get();
                Quoted left = call.args().get(0);
                Quoted right = call.args().get(1);

                if (parentInfo.precedence() == opInfo.precedence() && parentInfo.associatesTo(side)) {
                    return binaryOpToAlgebra(op, op, call.meta(), left, null, right, context, opInfo, nesting);
                }
                Doc doc = binaryOpToAlgebra(op, op, call.meta(), left, null, right, context, opInfo, 2);
                if (Operators.operandNeedsParens(parentOp, parentInfo, op, opInfo, side)) {
                    return wrapInParens(doc);
                }
                return doc;
            }
        }

        if (operand instanceof Quoted.Call capture
                && capture.isLocal("&")
                && capture.arity() == 1
                && !(capture.args().get(0) instanceof Quoted.Int)) {
            Doc doc = quotedToAlgebra(operand, context);
            int capturePrecedence = Operators.unaryOp("&").orElseThrow().precedence();
            // x = &fun/1 reads the same without parens
            if (parentInfo.precedence() < capturePrecedence || (side == Side.RIGHT && parentOp.equals("="))) {
                return doc;
            }
            return wrapInParens(doc);
        }

        return quotedToAlgebra(operand, context);
    }

    // Module attributes

    private Doc moduleAttributeToAlgebra(Meta meta, Quoted arg, Context context) {
        // @Foo.Bar
        if (arg instanceof Quoted.Call aliases && aliases.isLocal(QuotedForms.ALIASES) && aliases.arity() >= 2) {
            Doc doc = quotedToAlgebra(arg, Context.PARENS_ARG);
            return concat(text("@("), doc, text(")"));
        }

        // @foo bar and @foo(bar)
        if (arg instanceof Quoted.Call call
                && call.localName() != null
                && !call.isLocal(QuotedForms.BLOCK)
                && !call.isLocal(QuotedForms.ALIASES)
                && call.arity() == 1
                && Identifiers.classify(call.localName()) == Identifiers.Kind.CALLABLE_LOCAL) {
            CallArgs args = calls.callArgsToAlgebra(call.args(), context, Parens.SKIP_UNLESS_MANY_ARGS, false);
            Doc doc = concat(text("@" + call.localName()), args.doc());
            return args.wrapInParens() ? wrapInParens(doc) : doc;
        }

        return unaryOpToAlgebra("@", arg, context);
    }

    // Captures: &1, &local/1, &Mod.remote/1, & &1 + &2

    private Doc captureToAlgebra(Quoted arg, Context context) {
        if (arg instanceof Quoted.Int integer) {
            return text("&" + integer.value());
        }
        Doc doc = captureTargetToAlgebra(arg, context);
        if (formatToString(doc).startsWith("&")) {
            return concat(text("& "), doc);
        }
        return concat(text("&"), doc);
    }

    private Doc captureTargetToAlgebra(Quoted arg, Context context) {
        if (QuotedForms.isCallOf(arg, "/", 2)) {
            Quoted.Call slash = (Quoted.Call) arg;
            Quoted function = slash.args().get(0);
            Quoted arity = QuotedForms.literalValue(slash.args().get(1));

            if (arity instanceof Quoted.Int arityValue) {
                Quoted.Call dot = QuotedForms.dotHead(function);
                if (dot != null
                        && ((Quoted.Call) function).args().isEmpty()
                        && dot.arity() == 2
                        && dot.args().get(1) instanceof Quoted.Atom fun) {
                    Quoted target = dot.args().get(0);
                    Doc targetDoc = remoteTargetToAlgebra(target);
                    String name = remoteFunToAlgebra(target, fun.name(), arityValue.value().intValueExact(),
                            Quoted.metaOf(function));
                    return concat(nest(targetDoc, 1), text("." + name + "/" + arityValue.value()));
                }
                if (function instanceof Quoted.Var var) {
                    return text(var.name() + "/" + arityValue.value());
                }
            }
        }

        if (arg instanceof Quoted.Call call && call.localName() != null && call.arity() == 2) {
            Doc doc = quotedToAlgebra(arg, context);
            return Operators.isBinaryOp(call.localName()) ? wrapInParens(doc) : doc;
        }

        return quotedToAlgebra(arg, context);
    }

    // Calls

    private Doc remoteToAlgebra(Quoted.Call call, Context context) {
        Quoted.Call dot = QuotedForms.dotHead(call);
        List<Quoted> args = call.args();

        if (dot != null && dot.arity() == 2 && dot.args().get(1) instanceof Quoted.Atom fun) {
            Quoted target = dot.args().get(0);
            Doc targetDoc = remoteTargetToAlgebra(target);

            // expression.{arguments}
            if (fun.is(QuotedForms.TUPLE)) {
                Doc tuple = tupleToAlgebra(Meta.EMPTY, args);
                return concat(targetDoc, text("."), tuple);
            }

            String name = remoteFunToAlgebra(target, fun.name(), args.size(), call.meta());

            // Mod.function() and var.function
            if (args.isEmpty()) {
                Doc doc = concat(targetDoc, text("."), text(name));
                return isModule(target) ? concat(doc, text("()")) : doc;
            }

            // expression.function(arguments)
            CallArgs callArgs = calls.callArgsToAlgebra(args, context, Parens.SKIP_IF_DO_END, true);
            Doc doc = concat(targetDoc, text("."), concat(text(name), callArgs.doc()));
            return callArgs.wrapInParens() ? wrapInParens(doc) : doc;
        }

        // expression.(arguments)
        if (dot != null && dot.arity() == 1) {
            Doc targetDoc = remoteTargetToAlgebra(dot.args().get(0));
            CallArgs callArgs = calls.callArgsToAlgebra(args, context, Parens.SKIP_IF_DO_END, true);
            Doc doc = concat(targetDoc, text("."), callArgs.doc());
            return callArgs.wrapInParens() ? wrapInParens(doc) : doc;
        }

        // call(call)(arguments)
        Doc targetDoc = quotedToAlgebra(call.target(), Context.NO_PARENS_ARG);
        CallArgs callArgs = calls.callArgsToAlgebra(args, context, Parens.REQUIRED, true);
        Doc doc = concat(targetDoc, callArgs.doc());
        return callArgs.wrapInParens() ? wrapInParens(doc) : doc;
    }

    private static boolean isModule(Quoted target) {
        if (target instanceof Quoted.Var var) {
            return var.name().equals("__MODULE__");
        }
        if (QuotedForms.literalValue(target) instanceof Quoted.Atom) {
            return true;
        }
        return target instanceof Quoted.Call call && call.isLocal(QuotedForms.ALIASES);
    }

    /**
     * The name of a remote function. A deprecated function of a module named
     * literally is replaced when the configured version allows it.
     */
    private String remoteFunToAlgebra(Quoted target, String fun, int arity, Meta meta) {
        if (state.getRenameDeprecatedAt() != null) {
            String module = moduleName(target);
            Optional<Deprecations.Deprecation> deprecation = Deprecations.lookup(module, fun, arity);
            if (deprecation.isPresent() && state.getRenameDeprecatedAt().matches(deprecation.get().requirement())) {
                String replacement = deprecation.get().replacement();
                state.recordRename(new FormatterState.Rename(meta.lineOr(0), module, fun, replacement, arity));
                return replacement;
            }
        }
        return Identifiers.inspectAsFunction(fun);
    }

    private static String moduleName(Quoted target) {
        if (target instanceof Quoted.Call aliases && aliases.isLocal(QuotedForms.ALIASES)) {
            StringBuilder name = new StringBuilder("Elixir");
            for (Quoted segment : aliases.args()) {
                if (!(segment instanceof Quoted.Atom atom)) {
                    return null;
                }
                name.append('.').append(atom.name());
            }
            return name.toString();
        }
        if (QuotedForms.literalValue(target) instanceof Quoted.Atom atom) {
            return atom.name();
        }
        return null;
    }

    private Doc remoteTargetToAlgebra(Quoted target) {
        if (target instanceof Quoted.Call fn && fn.isLocal("fn") && !fn.args().isEmpty()) {
            return wrapInParens(quotedToAlgebra(target, Context.NO_PARENS_ARG));
        }
        return quotedToAlgebraWithParensIfNecessary(target, Context.NO_PARENS_ARG);
    }

    private Doc localToAlgebra(String fun, List<Quoted> args, Context context) {
        Parens parens = state.isLocalWithoutParens(fun, args.size()) ? Parens.SKIP_UNLESS_MANY_ARGS : Parens.SKIP_IF_DO_END;
        CallArgs callArgs = calls.callArgsToAlgebra(args, context, parens, true);
        Doc doc = concat(text(fun), callArgs.doc());
        return callArgs.wrapInParens() ? wrapInParens(doc) : doc;
    }

    // Interpolation and sigils

    private static Function<String, Doc> escaper(String escape) {
        return string -> Literals.escapeString(string, escape);
    }

    private Doc interpolationToAlgebra(List<Quoted> entries, Function<String, Doc> escape, Doc acc, Doc last) {
        Doc doc = acc;
        for (Quoted entry : entries) {
            if (entry instanceof Quoted.Str str) {
                doc = concat(doc, escape.apply(str.value()));
                continue;
            }
            Quoted.Call toString = QuotedForms.interpolatedExpression(entry);
            if (toString == null) {
                throw new IllegalStateException("malformed interpolation segment: " + entry);
            }
            Meta meta = toString.meta();
            Doc expression = calls.blockToAlgebra(toString.args().get(0), line(meta), endLine(meta));
            doc = concat(doc, surround("#{", expression, "}"));
        }
        return concat(doc, last);
    }

    private Optional<Doc> maybeSigilToAlgebra(String fun, Meta meta, List<Quoted> args) {
        if (!fun.startsWith("sigil_")
                || fun.codePointCount(0, fun.length()) != "sigil_".length() + 1
                || args.size() != 2
                || !(args.get(0) instanceof Quoted.Call binary)
                || !binary.isLocal(QuotedForms.BITSTRING)
                || !(args.get(1) instanceof Quoted.QList modifierList)) {
            return Optional.empty();
        }

        List<Quoted> entries = binary.args();
        String modifiers = codePointsToString(modifierList);
        String opening = meta.requireTerminator();
        Doc acc = text("~" + fun.substring("sigil_".length()) + opening);

        if (opening.equals(Literals.DOUBLE_HEREDOC) || opening.equals(Literals.SINGLE_HEREDOC)) {
            acc = forceBreak(concat(acc, line()));
            return Optional.of(interpolationToAlgebra(entries, Literals::heredoc, acc, text(opening + modifiers)));
        }

        String closing = closingSigilTerminator(opening);
        return Optional.of(interpolationToAlgebra(entries, escaper(closing), acc, text(closing + modifiers)));
    }

    private static String closingSigilTerminator(String opening) {
        return switch (opening) {
            case "(" -> ")";
            case "[" -> "]";
            case "{" -> "}";
            case "<" -> ">";
            case "\"", "'", "|", "/" -> opening;
            default -> throw new IllegalStateException("unknown sigil terminator " + opening);
        };
    }

    // Bitstrings

    private Doc bitstringToAlgebra(Meta meta, List<Quoted> args) {
        int last = args.size() - 1;
        int[] index = {0};
        Doc argsDoc = comments.argsToAlgebraWithComments(args, meta,
                segment -> bitstringSegmentToAlgebra(segment, index[0]++, last));
        return surround("<<", argsDoc, ">>");
    }

    private Doc bitstringSegmentToAlgebra(Quoted segment, int index, int last) {
        Doc doc;
        if (QuotedForms.isCallOf(segment, QuotedForms.TYPE, 2)) {
            Quoted.Call type = (Quoted.Call) segment;
            Doc value = quotedToAlgebra(type.args().get(0), Context.PARENS_ARG);
            Doc spec = bitstringSpecToAlgebra(type.args().get(1));
            // x::(:foo), never x:::foo
            if (formatToString(spec).startsWith(":")) {
                spec = wrapInParens(spec);
            }
            doc = concat(value, text("::"), spec);
        } else {
            doc = quotedToAlgebra(segment, Context.PARENS_ARG);
        }
        return bitstringWrapParens(doc, index, last);
    }

    private Doc bitstringSpecToAlgebra(Quoted spec) {
        if (spec instanceof Quoted.Call call && (call.isLocal("-") || call.isLocal("*")) && call.arity() == 2) {
            Doc left = bitstringSpecToAlgebra(call.args().get(0));
            Doc right = quotedToAlgebraWithParensIfNecessary(call.args().get(1), Context.PARENS_ARG);
            return concat(left, text(call.localName()), right);
        }
        return quotedToAlgebraWithParensIfNecessary(spec, Context.PARENS_ARG);
    }

    private static Doc bitstringWrapParens(Doc doc, int index, int last) {
        if (index != 0 && index != last) {
            return doc;
        }
        String string = formatToString(doc);
        if ((index == 0 && string.startsWith("<<")) || (index == last && string.endsWith(">>"))) {
            return wrapInParens(doc);
        }
        return doc;
    }

    // Containers

    private Doc listToAlgebra(Meta meta, List<Quoted> args) {
        Doc argsDoc = comments.argsToAlgebraWithComments(args, meta, arg -> quotedToAlgebra(arg, Context.PARENS_ARG));
        return surround("[", argsDoc, "]");
    }

    private Doc mapToAlgebra(Meta meta, Doc name, List<Quoted> args) {
        Doc open = concat(text("%"), name, text("{"));

        // %{map | key: value}
        if (args.size() == 1 && QuotedForms.isCallOf(args.get(0), "|", 2)) {
            Quoted.Call update = (Quoted.Call) args.get(0);
            if (!(update.args().get(1) instanceof Quoted.QList fields)) {
                throw new IllegalStateException("map update without a list of fields at line " + meta.line());
            }
            Doc left = quotedToAlgebra(update.args().get(0), Context.PARENS_ARG);
            Doc right = comments.argsToAlgebraWithComments(fields.items(), meta,
                    arg -> quotedToAlgebra(arg, Context.PARENS_ARG));
            Doc argsDoc = group(glue(left, concat(text("| "), nest(right, 2))));
            return surround(open, argsDoc, text("}"), false);
        }

        Doc argsDoc = comments.argsToAlgebraWithComments(args, meta, arg -> quotedToAlgebra(arg, Context.PARENS_ARG));
        return surround(open, argsDoc, text("}"), false);
    }

    Doc tupleToAlgebra(Meta meta, List<Quoted> args) {
        Doc argsDoc = comments.argsToAlgebraWithComments(args, meta, arg -> quotedToAlgebra(arg, Context.PARENS_ARG));
        return surround("{", argsDoc, "}");
    }

    // Keywords

    static boolean isKeywordKey(Quoted key) {
        if (key instanceof Quoted.Call call && call.isLocal(QuotedForms.BLOCK) && call.arity() == 1) {
            return call.meta().hasFormat(Meta.FORMAT_KEYWORD);
        }
        if (QuotedForms.isRemote(key, QuotedForms.ERLANG, BINARY_TO_ATOM)
                && ((Quoted.Call) key).arity() == 2
                && ((Quoted.Call) key).args().get(0) instanceof Quoted.Call binary
                && binary.isLocal(QuotedForms.BITSTRING)) {
            return binary.meta().hasFormat(Meta.FORMAT_KEYWORD);
        }
        return false;
    }

    private Doc keywordKeyToAlgebra(Quoted key) {
        if (QuotedForms.literalValue(key) instanceof Quoted.Atom atom) {
            return text(Identifiers.inspectAsKey(atom.name()));
        }
        List<Quoted> entries = binaryToAtomEntries(key);
        if (entries == null) {
            throw new IllegalStateException("keyword key is neither an atom nor an interpolated atom: " + key);
        }
        return interpolationToAlgebra(entries, escaper(Literals.DOUBLE_QUOTE), text("\""), text("\": "));
    }

    /** True when every item is a keyword entry. */
    static boolean isKeyword(List<Quoted> items) {
        for (Quoted item : items) {
            if (!(item instanceof Quoted.Pair pair) || !isKeywordKey(pair.left())) {
                return false;
            }
        }
        return true;
    }

    // Helpers

    Doc argsToAlgebra(List<Quoted> args, Function<Quoted, Doc> fun) {
        if (args.isEmpty()) {
            return empty();
        }
        Doc doc = fun.apply(args.get(0));
        for (Quoted arg : args.subList(1, args.size())) {
            Doc argDoc = fun.apply(arg);
            doc = glue(concat(doc, text(",")), argDoc);
        }
        return doc;
    }

    Doc quotedToAlgebraWithParensIfNecessary(Quoted quoted, Context context) {
        Doc doc = quotedToAlgebra(quoted, context);
        return wrapInParensIfNecessary(quoted, doc);
    }

    private static Doc wrapInParensIfNecessary(Quoted quoted, Doc doc) {
        Quoted inner = quoted;
        while (QuotedForms.literalValue(inner) != null) {
            inner = QuotedForms.literalValue(inner);
        }
        if (isOperator(inner) && !isModuleAttributeRead(inner) && !isIntegerCapture(inner)) {
            return wrapInParens(doc);
        }
        return doc;
    }

    private static boolean isOperator(Quoted quoted) {
        if (!(quoted instanceof Quoted.Call call) || call.localName() == null) {
            return false;
        }
        return (call.arity() == 1 && Operators.isUnaryOp(call.localName()))
                || (call.arity() == 2 && Operators.isBinaryOp(call.localName()));
    }

    private static boolean isModuleAttributeRead(Quoted quoted) {
        return QuotedForms.isCallOf(quoted, "@", 1)
                && ((Quoted.Call) quoted).args().get(0) instanceof Quoted.Var var
                && Identifiers.classify(var.name()) == Identifiers.Kind.CALLABLE_LOCAL;
    }

    private static boolean isIntegerCapture(Quoted quoted) {
        return QuotedForms.isCallOf(quoted, "&", 1) && ((Quoted.Call) quoted).args().get(0) instanceof Quoted.Int;
    }

    /**
     * Whether {@code quoted} controls its own line breaks, so the enclosing
     * layout should not break before it.
     */
    static boolean nextBreakFits(Quoted quoted) {
        if (quoted instanceof Quoted.Pair pair) {
            return QuotedForms.literalValue(pair.left()) instanceof Quoted.Atom && nextBreakFits(pair.right());
        }
        if (!(quoted instanceof Quoted.Call call)) {
            return false;
        }
        Meta meta = call.meta();

        if (call.isLocal(QuotedForms.BITSTRING) && !call.args().isEmpty()) {
            return meta.hasFormat(Meta.FORMAT_BIN_HEREDOC) || !QuotedForms.isInterpolated(call.args());
        }
        if (QuotedForms.isRemote(call, QuotedForms.STRING, TO_CHARLIST)
                && call.arity() == 1
                && call.args().get(0) instanceof Quoted.Call binary
                && binary.isLocal(QuotedForms.BITSTRING)
                && !binary.args().isEmpty()) {
            return binary.meta().hasFormat(Meta.FORMAT_LIST_HEREDOC);
        }
        if (call.isLocal(QuotedForms.TUPLE)) {
            return true;
        }
        if (call.isLocal(QuotedForms.BLOCK) && call.arity() == 1) {
            Quoted value = call.args().get(0);
            if (value instanceof Quoted.Pair) {
                return true;
            }
            if (value instanceof Quoted.Str) {
                return meta.hasFormat(Meta.FORMAT_BIN_HEREDOC);
            }
            if (value instanceof Quoted.QList) {
                return !meta.hasFormat(Meta.FORMAT_CHARLIST);
            }
        }
        if ((call.isLocal("fn") || call.isLocal(QuotedForms.MAP) || call.isLocal(QuotedForms.STRUCT))
                && !call.args().isEmpty()) {
            return true;
        }
        if (call.localName() != null) {
            return call.localName().startsWith("sigil_")
                    && (Literals.DOUBLE_HEREDOC.equals(meta.terminator()) || Literals.SINGLE_HEREDOC.equals(meta.terminator()));
        }
        return false;
    }

    static Doc blockNextLine(Quoted statement) {
        return statement instanceof Quoted.Call call && call.isLocal("@") ? empty() : breakWith("");
    }
}
