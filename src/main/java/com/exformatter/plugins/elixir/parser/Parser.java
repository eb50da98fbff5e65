package com.exformatter.plugins.elixir.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.exformatter.plugins.elixir.ast.Meta;
import com.exformatter.plugins.elixir.ast.Quoted;
import com.exformatter.plugins.elixir.ast.QuotedForms;
import com.exformatter.plugins.elixir.format.Operators;

/**
 * Builds the quoted form of a token stream.
 * <p>
 * Binary operators are parsed by precedence climbing over the tables in
 * {@link Operators}. The parser keeps the metadata the formatter relies on:
 * literal wrappers, original number text, {@code newlines} between statements,
 * {@code eol} on containers, clauses and operators, and the end lines of
 * containers, anonymous functions and do/end blocks.
 */
public final class Parser {

    private static final Set<String> BLOCK_KEYWORDS = Set.of("else", "after", "rescue", "catch");
    private static final Set<String> RESERVED = Set.of("do", "end", "else", "after", "rescue", "catch");
    private static final Set<String> PREFIX_OPERATORS = Set.of("!", "^", "not", "~~~", "&", "@");
    private static final Map<Character, Integer> CHAR_ESCAPES = Map.ofEntries(
            Map.entry('0', 0), Map.entry('a', 7), Map.entry('b', 8), Map.entry('t', 9), Map.entry('n', 10),
            Map.entry('v', 11), Map.entry('f', 12), Map.entry('r', 13), Map.entry('e', 27), Map.entry('s', 32),
            Map.entry('d', 127));

    private static final int ASSOC_PRECEDENCE = 80;
    private static final int PIPE_PRECEDENCE = 70;
    private static final int DOT_PRECEDENCE = 310;

    private final List<Token> tokens;
    private int index;
    // Calls inside the arguments of a call without parentheses leave do/end
    // blocks to the outer call.
    private int noDoDepth;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Parses a whole file: a single expression or a block of them. */
    public Quoted parseFile() throws ParseException {
        List<Quoted> exprs = statements(false);
        if (!current().is(TokenKind.EOF)) {
            throw unexpected(current());
        }
        if (exprs.size() == 1) {
            return exprs.get(0);
        }
        return QuotedForms.block(Meta.EMPTY, exprs);
    }

    // Statements

    private List<Quoted> statements(boolean stopAtClause) throws ParseException {
        List<Quoted> exprs = new ArrayList<>();
        while (true) {
            int separators = skipEndOfExpressions();
            if (isStatementsEnd()) {
                break;
            }
            if (stopAtClause && isStabClauseStart()) {
                break;
            }
            if (!exprs.isEmpty() && separators < 0) {
                throw unexpected(current());
            }
            Quoted expr = expression();
            exprs.add(exprs.isEmpty() ? expr : withNewlines(expr, separators));
        }
        return exprs;
    }

    /** Skips newlines and semicolons, returning the newlines seen or -1 when there were none. */
    private int skipEndOfExpressions() {
        int count = -1;
        while (current().isEndOfExpression()) {
            count = Math.max(count, 0) + current().eolCount();
            index++;
        }
        return count;
    }

    private boolean isStatementsEnd() {
        Token token = current();
        return switch (token.kind()) {
            case EOF, RPAREN, RBRACKET, RBRACE, GTGT -> true;
            case IDENTIFIER -> token.text().equals("end") || BLOCK_KEYWORDS.contains(token.text());
            default -> false;
        };
    }

    private static Quoted withNewlines(Quoted expr, int newlines) {
        if (expr instanceof Quoted.Call call) {
            return call.withMeta(call.meta().withNewlines(newlines));
        }
        if (expr instanceof Quoted.Var var) {
            return new Quoted.Var(var.name(), var.meta().withNewlines(newlines), var.context());
        }
        return expr;
    }

    private static Quoted bodyOf(List<Quoted> exprs) {
        if (exprs.isEmpty()) {
            return QuotedForms.emptyBlock();
        }
        if (exprs.size() == 1) {
            return exprs.get(0);
        }
        return QuotedForms.block(Meta.EMPTY, exprs);
    }

    private Quoted expression() throws ParseException {
        return parseExpr(0);
    }

    // Operators

    private Quoted parseExpr(int minPrecedence) throws ParseException {
        Quoted left = unary(minPrecedence);

        while (current().is(TokenKind.OPERATOR)) {
            Token op = current();
            String lookup = op.text().equals("not in") ? "in" : op.text();
            Optional<Operators.OpInfo> info = Operators.binaryOp(lookup);
            if (info.isEmpty() || info.get().precedence() < minPrecedence) {
                break;
            }
            index++;
            skipEol();

            int precedence = info.get().precedence();
            boolean right = info.get().associativity() == Operators.Associativity.RIGHT;
            Quoted rightOperand = parseExpr(right ? precedence : precedence + 1);
            left = binary(op, left, rightOperand);
        }

        return left;
    }

    private static Quoted binary(Token op, Quoted left, Quoted right) {
        Meta meta = Meta.atLine(op.line()).withEol(op.newlineBefore() || op.eolAfter());

        if (op.text().equals("not in")) {
            Quoted in = Quoted.call("in", meta, List.of(left, right));
            return Quoted.call("not", meta, List.of(in));
        }
        // not left in right
        if (op.text().equals("in")
                && left instanceof Quoted.Call negation
                && (negation.isLocal("not") || negation.isLocal("!"))
                && negation.arity() == 1) {
            Quoted in = Quoted.call("in", meta, List.of(negation.args().get(0), right));
            return Quoted.call(negation.localName(), negation.meta(), List.of(in));
        }
        return Quoted.call(op.text(), meta, List.of(left, right));
    }

    private Quoted unary(int minPrecedence) throws ParseException {
        Token op = current();
        if (!op.is(TokenKind.OPERATOR) || !Operators.isUnaryOp(op.text())) {
            return postfix(primary(), minPrecedence);
        }

        index++;
        skipEol();
        Meta meta = Meta.atLine(op.line());

        if (op.text().equals("&") && isOperatorCapture()) {
            return Quoted.call("&", meta, List.of(operatorCapture()));
        }
        int precedence = Operators.unaryOp(op.text()).orElseThrow().precedence();
        Quoted operand = parseExpr(precedence + 1);
        Quoted call = Quoted.call(op.text(), meta, List.of(operand));
        return op.text().equals("@") ? postfix(call, minPrecedence) : call;
    }

    // &+/2 and &-/1
    private boolean isOperatorCapture() {
        Token name = current();
        Token slash = peek(1);
        return name.is(TokenKind.OPERATOR)
                && (Operators.isBinaryOp(name.text()) || Operators.isUnaryOp(name.text()))
                && slash.is(TokenKind.OPERATOR)
                && slash.text().equals("/")
                && peek(2).is(TokenKind.INT);
    }

    private Quoted operatorCapture() {
        Token name = advance();
        Token slash = advance();
        Token arity = advance();
        Quoted function = new Quoted.Var(name.text(), Meta.atLine(name.line()), "nil");
        Quoted arityValue = QuotedForms.literal(new Quoted.Int(integerValue(arity)),
                Meta.atLine(arity.line()).withOriginal(arity.text()));
        return Quoted.call("/", Meta.atLine(slash.line()), List.of(function, arityValue));
    }

    // Postfix: remote calls, aliases and access

    private Quoted postfix(Quoted expr, int minPrecedence) throws ParseException {
        Quoted result = expr;
        while (minPrecedence <= DOT_PRECEDENCE) {
            Token token = current();
            if (token.is(TokenKind.DOT)) {
                index++;
                skipEol();
                result = afterDot(result, token);
            } else if (token.is(TokenKind.LBRACKET) && !token.spaceBefore()) {
                result = access(result);
            } else if (token.is(TokenKind.LPAREN) && !token.spaceBefore() && previous().is(TokenKind.RPAREN)) {
                Meta meta = Meta.atLine(token.line());
                result = Quoted.call(result, meta, parenArgs());
            } else {
                break;
            }
        }
        return result;
    }

    private Quoted afterDot(Quoted target, Token dot) throws ParseException {
        Token name = current();
        Meta meta = Meta.atLine(dot.line());

        switch (name.kind()) {
            case ALIAS -> {
                index++;
                Quoted.Atom segment = new Quoted.Atom(name.text());
                if (target instanceof Quoted.Call aliases && aliases.isLocal(QuotedForms.ALIASES)) {
                    List<Quoted> segments = new ArrayList<>(aliases.args());
                    segments.add(segment);
                    return Quoted.call(QuotedForms.ALIASES, aliases.meta(), segments);
                }
                return Quoted.call(QuotedForms.ALIASES, meta, List.of(target, segment));
            }
            case LPAREN -> {
                Quoted anonymous = Quoted.call(QuotedForms.DOT, meta, List.of(target));
                return Quoted.call(anonymous, meta, parenArgs());
            }
            case LBRACE -> {
                Token open = advance();
                List<Quoted> items = containerItems(TokenKind.RBRACE, false);
                expect(TokenKind.RBRACE, "}", open);
                return QuotedForms.remote(target, QuotedForms.TUPLE, meta, items);
            }
            case IDENTIFIER, OPERATOR -> {
                index++;
                return remoteCall(target, name.text(), meta.withLine(name.line()));
            }
            case STRING -> {
                if (!name.isPlain()) {
                    throw unexpected(name);
                }
                index++;
                return remoteCall(target, name.plainText(), meta.withLine(name.line()));
            }
            default -> throw unexpected(name);
        }
    }

    private Quoted remoteCall(Quoted target, String fun, Meta meta) throws ParseException {
        Token next = current();
        List<Quoted> args;
        if (next.is(TokenKind.LPAREN) && !next.spaceBefore()) {
            args = parenArgs();
        } else if (startsNoParensArgs(next)) {
            args = noParensArgs();
        } else {
            args = new ArrayList<>();
        }
        args = maybeDoBlock(args);
        return QuotedForms.remote(target, fun, meta, args);
    }

    private Quoted access(Quoted target) throws ParseException {
        Token open = advance();
        int saved = enterContainer();
        try {
            skipEol();
            Quoted key = isKeywordStart() ? keywordList() : expression();
            skipEol();
            Token close = expect(TokenKind.RBRACKET, "]", open);
            Meta meta = Meta.atLine(open.line()).withEndLine(close.line()).withEol(open.eolAfter());
            return QuotedForms.remote(QuotedForms.ACCESS, "get", meta, List.of(target, key));
        } finally {
            noDoDepth = saved;
        }
    }

    // Primaries

    private Quoted primary() throws ParseException {
        Token token = current();
        Meta meta = Meta.atLine(token.line());

        switch (token.kind()) {
            case INT -> {
                index++;
                return QuotedForms.literal(new Quoted.Int(integerValue(token)), meta.withOriginal(token.text()));
            }
            case FLOAT -> {
                index++;
                double value = Double.parseDouble(token.text().replace("_", ""));
                return QuotedForms.literal(new Quoted.Flt(value), meta.withOriginal(token.text()));
            }
            case CHAR -> {
                index++;
                return QuotedForms.literal(Quoted.Int.of(charValue(token.text())), meta.withOriginal(token.text()));
            }
            case ATOM -> {
                index++;
                return QuotedForms.literal(new Quoted.Atom(token.text()), meta);
            }
            case ATOM_QUOTED -> {
                index++;
                if (token.isPlain()) {
                    return QuotedForms.literal(new Quoted.Atom(token.plainText()), meta);
                }
                return binaryToAtom(Quoted.call(QuotedForms.BITSTRING, meta, entries(token)), meta);
            }
            case STRING -> {
                index++;
                return string(token, meta);
            }
            case CHARLIST -> {
                index++;
                return charlist(token, meta);
            }
            case SIGIL -> {
                index++;
                return sigil(token, meta);
            }
            case CAPTURE_INT -> {
                index++;
                return Quoted.call("&", meta, List.of(new Quoted.Int(new BigInteger(token.text()))));
            }
            case ALIAS -> {
                index++;
                return Quoted.call(QuotedForms.ALIASES, meta, List.of(new Quoted.Atom(token.text())));
            }
            case IDENTIFIER -> {
                return identifier(token);
            }
            case LPAREN -> {
                return parens();
            }
            case LBRACKET -> {
                return list();
            }
            case LBRACE -> {
                return tuple();
            }
            case LTLT -> {
                return bitstring();
            }
            case PERCENT -> {
                return mapOrStruct();
            }
            case EOF -> throw new ParseException(token.line(), token.column(), "syntax error: expression is incomplete", "");
            default -> throw unexpected(token);
        }
    }

    private Quoted identifier(Token token) throws ParseException {
        String name = token.text();
        Meta meta = Meta.atLine(token.line());

        switch (name) {
            case "true", "false", "nil" -> {
                index++;
                return QuotedForms.literal(new Quoted.Atom(name), meta);
            }
            case "fn" -> {
                return fn();
            }
            default -> {
                if (RESERVED.contains(name)) {
                    throw unexpected(token);
                }
            }
        }

        index++;
        Token next = current();
        List<Quoted> args;
        if (next.is(TokenKind.LPAREN) && !next.spaceBefore()) {
            args = parenArgs();
        } else if (startsNoParensArgs(next)) {
            args = noParensArgs();
        } else if (next.isIdentifier("do") && noDoDepth == 0) {
            args = new ArrayList<>();
        } else {
            return new Quoted.Var(name, meta, "nil");
        }
        return Quoted.call(name, meta, maybeDoBlock(args));
    }

    private boolean startsNoParensArgs(Token token) {
        if (!token.spaceBefore()) {
            return false;
        }
        return switch (token.kind()) {
            case IDENTIFIER -> !RESERVED.contains(token.text());
            case ALIAS, INT, FLOAT, CHAR, ATOM, ATOM_QUOTED, STRING, CHARLIST, SIGIL, KW_IDENTIFIER, KW_QUOTED,
                    CAPTURE_INT, LBRACKET, LBRACE, LPAREN, LTLT, PERCENT -> true;
            case OPERATOR -> {
                if (PREFIX_OPERATORS.contains(token.text())) {
                    yield true;
                }
                // foo -1 is a call, foo - 1 is not
                yield (token.text().equals("-") || token.text().equals("+")) && !peek(1).spaceBefore();
            }
            default -> false;
        };
    }

    private Quoted string(Token token, Meta meta) throws ParseException {
        Meta stringMeta = token.heredoc() ? meta.withFormat(Meta.FORMAT_BIN_HEREDOC) : meta;
        if (token.isPlain()) {
            return QuotedForms.literal(new Quoted.Str(token.plainText()), stringMeta);
        }
        return Quoted.call(QuotedForms.BITSTRING, stringMeta, entries(token));
    }

    private Quoted charlist(Token token, Meta meta) throws ParseException {
        if (token.isPlain()) {
            String format = token.heredoc() ? Meta.FORMAT_LIST_HEREDOC : Meta.FORMAT_CHARLIST;
            return QuotedForms.literal(codePoints(token.plainText()), meta.withFormat(format));
        }
        Meta binaryMeta = token.heredoc() ? meta.withFormat(Meta.FORMAT_LIST_HEREDOC) : meta;
        Quoted binary = Quoted.call(QuotedForms.BITSTRING, binaryMeta, entries(token));
        return QuotedForms.remote(QuotedForms.STRING, "to_charlist", meta, List.of(binary));
    }

    private Quoted sigil(Token token, Meta meta) throws ParseException {
        Quoted binary = Quoted.call(QuotedForms.BITSTRING, meta, entries(token));
        Quoted modifiers = codePoints(token.modifiers());
        return Quoted.call("sigil_" + token.text(), meta.withTerminator(token.terminator()), List.of(binary, modifiers));
    }

    private static Quoted binaryToAtom(Quoted binary, Meta meta) {
        return QuotedForms.remote(QuotedForms.ERLANG, "binary_to_atom", meta, List.of(binary, new Quoted.Atom("utf8")));
    }

    private static Quoted.QList codePoints(String text) {
        List<Quoted> items = new ArrayList<>();
        text.codePoints().forEach(codePoint -> items.add(Quoted.Int.of(codePoint)));
        return new Quoted.QList(items);
    }

    /** Binaries and {@code Kernel.to_string/1} segments of a string-like token. */
    private static List<Quoted> entries(Token token) throws ParseException {
        List<Quoted> entries = new ArrayList<>();
        for (Token.Part part : token.parts()) {
            if (part.isLiteral()) {
                entries.add(new Quoted.Str(part.literal()));
                continue;
            }
            Parser inner = new Parser(part.tokens());
            List<Quoted> exprs = inner.statements(false);
            if (!inner.current().is(TokenKind.EOF)) {
                throw unexpected(inner.current());
            }
            Meta meta = Meta.atLine(part.line()).withEndLine(part.endLine());
            entries.add(QuotedForms.interpolation(bodyOf(exprs), meta));
        }
        return entries;
    }

    private static BigInteger integerValue(Token token) {
        String text = token.text().replace("_", "");
        if (text.startsWith("0x")) {
            return new BigInteger(text.substring(2), 16);
        }
        if (text.startsWith("0o")) {
            return new BigInteger(text.substring(2), 8);
        }
        if (text.startsWith("0b")) {
            return new BigInteger(text.substring(2), 2);
        }
        return new BigInteger(text);
    }

    // ?a and ?\n
    private static int charValue(String text) {
        if (text.charAt(1) != '\\') {
            return text.codePointAt(1);
        }
        int escaped = text.codePointAt(2);
        Integer value = escaped < Character.MAX_VALUE ? CHAR_ESCAPES.get((char) escaped) : null;
        return value != null ? value : escaped;
    }

    // Call arguments

    private List<Quoted> parenArgs() throws ParseException {
        Token open = advance();
        int saved = enterContainer();
        try {
            skipEol();
            List<Quoted> args = containerItems(TokenKind.RPAREN, false);
            expect(TokenKind.RPAREN, ")", open);
            return args;
        } finally {
            noDoDepth = saved;
        }
    }

    private List<Quoted> noParensArgs() throws ParseException {
        noDoDepth++;
        try {
            List<Quoted> args = new ArrayList<>();
            while (true) {
                if (isKeywordStart()) {
                    args.add(keywordList());
                    break;
                }
                args.add(expression());
                if (!current().is(TokenKind.COMMA)) {
                    break;
                }
                index++;
            }
            return args;
        } finally {
            noDoDepth--;
        }
    }

    /**
     * Comma separated items up to {@code closer}, which is left in place. Keyword
     * entries are appended one by one with {@code flattenKeywords}, and as a
     * trailing keyword list otherwise.
     */
    private List<Quoted> containerItems(TokenKind closer, boolean flattenKeywords) throws ParseException {
        List<Quoted> items = new ArrayList<>();
        skipEol();
        while (!current().is(closer)) {
            if (isKeywordStart()) {
                Quoted.QList keywords = keywordList();
                if (flattenKeywords) {
                    items.addAll(keywords.items());
                } else {
                    items.add(keywords);
                }
                skipEol();
                if (current().is(TokenKind.COMMA)) {
                    index++;
                    skipEol();
                }
                break;
            }
            items.add(expression());
            skipEol();
            if (!current().is(TokenKind.COMMA)) {
                break;
            }
            index++;
            skipEol();
        }
        return items;
    }

    private boolean isKeywordStart() {
        return current().is(TokenKind.KW_IDENTIFIER) || current().is(TokenKind.KW_QUOTED);
    }

    private Quoted.QList keywordList() throws ParseException {
        List<Quoted> pairs = new ArrayList<>();
        while (true) {
            Token key = advance();
            skipEol();
            Quoted value = expression();
            pairs.add(new Quoted.Pair(keywordKey(key), value));

            if (current().is(TokenKind.COMMA)
                    && (peek(1).is(TokenKind.KW_IDENTIFIER) || peek(1).is(TokenKind.KW_QUOTED))) {
                index++;
                continue;
            }
            return new Quoted.QList(pairs);
        }
    }

    private static Quoted keywordKey(Token key) throws ParseException {
        Meta meta = Meta.atLine(key.line()).withFormat(Meta.FORMAT_KEYWORD);
        if (key.is(TokenKind.KW_IDENTIFIER)) {
            return QuotedForms.literal(new Quoted.Atom(key.text()), meta);
        }
        if (key.isPlain()) {
            return QuotedForms.literal(new Quoted.Atom(key.plainText()), meta);
        }
        Quoted binary = Quoted.call(QuotedForms.BITSTRING, meta, entries(key));
        return binaryToAtom(binary, Meta.atLine(key.line()));
    }

    // do/end blocks

    private List<Quoted> maybeDoBlock(List<Quoted> args) throws ParseException {
        if (noDoDepth > 0 || !current().isIdentifier("do")) {
            return args;
        }
        List<Quoted> withBlock = new ArrayList<>(args);
        withBlock.add(doBlock());
        return withBlock;
    }

    private Quoted doBlock() throws ParseException {
        Token doToken = advance();
        List<Token> keys = new ArrayList<>();
        List<Quoted> bodies = new ArrayList<>();

        Token key = doToken;
        while (true) {
            keys.add(key);
            bodies.add(blockBody());

            Token next = current();
            if (next.is(TokenKind.IDENTIFIER) && BLOCK_KEYWORDS.contains(next.text())) {
                key = advance();
                continue;
            }
            if (next.isIdentifier("end")) {
                break;
            }
            throw missingTerminator("end", doToken, next);
        }
        Token end = advance();

        List<Quoted> entries = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            Token keyToken = keys.get(i);
            Meta meta = Meta.atLine(keyToken.line()).withFormat(Meta.FORMAT_BLOCK);
            if (i == 0) {
                meta = meta.withEndLine(end.line());
            }
            Quoted keyQuoted = QuotedForms.literal(new Quoted.Atom(keyToken.text()), meta);
            entries.add(new Quoted.Pair(keyQuoted, bodies.get(i)));
        }
        return new Quoted.QList(entries);
    }

    private Quoted blockBody() throws ParseException {
        int saved = enterContainer();
        try {
            skipEndOfExpressions();
            if (isStabClauseStart()) {
                return new Quoted.QList(stabClauses());
            }
            return bodyOf(statements(false));
        } finally {
            noDoDepth = saved;
        }
    }

    // Clauses

    /** True when a {@code ->} follows on the current expression. */
    private boolean isStabClauseStart() {
        int depth = 0;
        for (int i = index; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.kind()) {
                case LPAREN, LBRACKET, LBRACE, LTLT -> depth++;
                case RPAREN, RBRACKET, RBRACE, GTGT -> {
                    if (depth == 0) {
                        return false;
                    }
                    depth--;
                }
                case IDENTIFIER -> {
                    if (token.text().equals("fn") || token.text().equals("do")) {
                        depth++;
                    } else if (token.text().equals("end")) {
                        if (depth == 0) {
                            return false;
                        }
                        depth--;
                    } else if (depth == 0 && BLOCK_KEYWORDS.contains(token.text())) {
                        return false;
                    }
                }
                case EOL, SEMICOLON -> {
                    if (depth == 0) {
                        return false;
                    }
                }
                case OPERATOR -> {
                    if (depth == 0 && token.text().equals("->")) {
                        return true;
                    }
                }
                case EOF -> {
                    return false;
                }
                default -> {
                }
            }
        }
        return false;
    }

    private List<Quoted> stabClauses() throws ParseException {
        List<Quoted> clauses = new ArrayList<>();
        while (true) {
            skipEndOfExpressions();
            if (isStatementsEnd()) {
                return clauses;
            }
            clauses.add(stabClause());
        }
    }

    private Quoted stabClause() throws ParseException {
        List<Quoted> args = new ArrayList<>();

        if (current().is(TokenKind.LPAREN) && peek(1).is(TokenKind.RPAREN) && peek(2).isOperator("->")) {
            index += 2;
        } else if (!current().isOperator("->")) {
            while (true) {
                if (isKeywordStart()) {
                    args.add(keywordList());
                    break;
                }
                args.add(expression());
                if (!current().is(TokenKind.COMMA)) {
                    break;
                }
                index++;
            }
        }

        Token arrow = current();
        if (!arrow.isOperator("->")) {
            throw unexpected(arrow);
        }
        index++;

        Quoted body = bodyOf(statements(true));
        Meta meta = Meta.atLine(arrow.line()).withEol(arrow.eolAfter());
        return Quoted.call(QuotedForms.STAB, meta, List.of(new Quoted.QList(guardedArgs(args)), body));
    }

    // a, b when c -> becomes when(a, b, c) ->
    private static List<Quoted> guardedArgs(List<Quoted> args) {
        if (args.size() < 2) {
            return args;
        }
        Quoted last = args.get(args.size() - 1);
        if (!QuotedForms.isCallOf(last, "when", 2)) {
            return args;
        }
        Quoted.Call when = (Quoted.Call) last;
        List<Quoted> whenArgs = new ArrayList<>(args.subList(0, args.size() - 1));
        whenArgs.addAll(when.args());
        return List.of(Quoted.call("when", when.meta(), whenArgs));
    }

    private Quoted fn() throws ParseException {
        Token fnToken = advance();
        int saved = enterContainer();
        try {
            List<Quoted> clauses = stabClauses();
            if (!current().isIdentifier("end")) {
                throw missingTerminator("end", fnToken, current());
            }
            Token end = advance();
            return Quoted.call("fn", Meta.atLine(fnToken.line()).withEndLine(end.line()), clauses);
        } finally {
            noDoDepth = saved;
        }
    }

    // Containers

    private Quoted parens() throws ParseException {
        Token open = advance();
        int saved = enterContainer();
        try {
            skipEndOfExpressions();
            boolean emptyArgsClause = current().is(TokenKind.LPAREN)
                    && peek(1).is(TokenKind.RPAREN)
                    && peek(2).isOperator("->");
            if (emptyArgsClause || isStabClauseStart()) {
                List<Quoted> clauses = stabClauses();
                expect(TokenKind.RPAREN, ")", open);
                return new Quoted.QList(clauses);
            }

            List<Quoted> exprs = statements(false);
            Token close = expect(TokenKind.RPAREN, ")", open);
            Meta meta = Meta.atLine(open.line()).withEndLine(close.line());

            if (exprs.size() == 1) {
                Quoted expr = exprs.get(0);
                // (not x) stays a block so that it is not merged into an outer in
                boolean negation = QuotedForms.isCallOf(expr, "not", 1) || QuotedForms.isCallOf(expr, "!", 1);
                return negation ? QuotedForms.block(meta, exprs) : expr;
            }
            return QuotedForms.block(meta, exprs);
        } finally {
            noDoDepth = saved;
        }
    }

    private Quoted list() throws ParseException {
        Token open = advance();
        int saved = enterContainer();
        try {
            List<Quoted> items = containerItems(TokenKind.RBRACKET, true);
            Token close = expect(TokenKind.RBRACKET, "]", open);
            return QuotedForms.literal(new Quoted.QList(items), containerMeta(open, close));
        } finally {
            noDoDepth = saved;
        }
    }

    private Quoted tuple() throws ParseException {
        Token open = advance();
        int saved = enterContainer();
        try {
            List<Quoted> items = containerItems(TokenKind.RBRACE, false);
            Token close = expect(TokenKind.RBRACE, "}", open);
            Meta meta = containerMeta(open, close);
            if (items.size() == 2) {
                return QuotedForms.literal(new Quoted.Pair(items.get(0), items.get(1)), meta);
            }
            return Quoted.call(QuotedForms.TUPLE, meta, items);
        } finally {
            noDoDepth = saved;
        }
    }

    private Quoted bitstring() throws ParseException {
        Token open = advance();
        int saved = enterContainer();
        try {
            List<Quoted> items = containerItems(TokenKind.GTGT, false);
            Token close = expect(TokenKind.GTGT, ">>", open);
            return Quoted.call(QuotedForms.BITSTRING, containerMeta(open, close), items);
        } finally {
            noDoDepth = saved;
        }
    }

    private Quoted mapOrStruct() throws ParseException {
        Token percent = advance();
        if (current().is(TokenKind.LBRACE) && !current().spaceBefore()) {
            return map(percent);
        }

        Quoted name = structName();
        if (!current().is(TokenKind.LBRACE)) {
            throw unexpected(current());
        }
        Quoted map = map(percent);
        return Quoted.call(QuotedForms.STRUCT, Meta.atLine(percent.line()), List.of(name, map));
    }

    private Quoted structName() throws ParseException {
        Token token = current();
        Quoted name;
        if (token.is(TokenKind.ALIAS)) {
            index++;
            name = Quoted.call(QuotedForms.ALIASES, Meta.atLine(token.line()), List.of(new Quoted.Atom(token.text())));
        } else if (token.is(TokenKind.IDENTIFIER) && !RESERVED.contains(token.text())) {
            index++;
            name = new Quoted.Var(token.text(), Meta.atLine(token.line()), "nil");
        } else if (token.isOperator("@") || token.isOperator("^")) {
            index++;
            Quoted operand = structName();
            return Quoted.call(token.text(), Meta.atLine(token.line()), List.of(operand));
        } else {
            throw unexpected(token);
        }

        while (current().is(TokenKind.DOT) && peek(1).is(TokenKind.ALIAS)) {
            Token dot = advance();
            name = afterDot(name, dot);
        }
        return name;
    }

    private Quoted map(Token percent) throws ParseException {
        Token open = advance();
        int saved = enterContainer();
        try {
            skipEol();
            List<Quoted> args = new ArrayList<>();

            if (isKeywordStart()) {
                args.addAll(mapEntries());
            } else if (!current().is(TokenKind.RBRACE)) {
                Quoted first = parseExpr(PIPE_PRECEDENCE + 1);
                skipEol();
                Token op = current();
                if (op.isOperator("|")) {
                    index++;
                    skipEol();
                    Meta meta = Meta.atLine(op.line()).withEol(op.newlineBefore() || op.eolAfter());
                    Quoted updates = new Quoted.QList(mapEntries());
                    args.add(Quoted.call("|", meta, List.of(first, updates)));
                } else {
                    args.add(association(first));
                    if (current().is(TokenKind.COMMA)) {
                        index++;
                        args.addAll(mapEntries());
                    }
                }
            }

            Token close = expect(TokenKind.RBRACE, "}", open);
            Meta meta = Meta.atLine(percent.line()).withEndLine(close.line()).withEol(open.eolAfter());
            return Quoted.call(QuotedForms.MAP, meta, args);
        } finally {
            noDoDepth = saved;
        }
    }

    private List<Quoted> mapEntries() throws ParseException {
        List<Quoted> entries = new ArrayList<>();
        skipEol();
        while (!current().is(TokenKind.RBRACE)) {
            if (isKeywordStart()) {
                entries.addAll(keywordList().items());
            } else {
                entries.add(association(parseExpr(ASSOC_PRECEDENCE + 1)));
            }
            skipEol();
            if (!current().is(TokenKind.COMMA)) {
                break;
            }
            index++;
            skipEol();
        }
        return entries;
    }

    private Quoted association(Quoted key) throws ParseException {
        skipEol();
        if (!current().isOperator("=>")) {
            throw unexpected(current());
        }
        index++;
        skipEol();
        Quoted value = expression();
        skipEol();
        return new Quoted.Pair(key, value);
    }

    private static Meta containerMeta(Token open, Token close) {
        return Meta.atLine(open.line()).withEndLine(close.line()).withEol(open.eolAfter());
    }

    private int enterContainer() {
        int saved = noDoDepth;
        noDoDepth = 0;
        return saved;
    }

    // Cursor

    private Token current() {
        return tokens.get(index);
    }

    private Token previous() {
        return index > 0 ? tokens.get(index - 1) : current();
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = current();
        if (!token.is(TokenKind.EOF)) {
            index++;
        }
        return token;
    }

    private void skipEol() {
        while (current().is(TokenKind.EOL)) {
            index++;
        }
    }

    private Token expect(TokenKind kind, String text, Token open) throws ParseException {
        Token token = current();
        if (!token.is(kind)) {
            throw missingTerminator(text, open, token);
        }
        index++;
        return token;
    }

    private static ParseException missingTerminator(String terminator, Token open, Token found) {
        if (found.is(TokenKind.EOF)) {
            return new ParseException(found.line(), found.column(),
                    "missing terminator: " + terminator + " (for \"" + open.text() + "\" starting at line "
                            + open.line() + ")", "");
        }
        return unexpected(found);
    }

    private static ParseException unexpected(Token token) {
        if (token.is(TokenKind.EOF)) {
            return new ParseException(token.line(), token.column(), "syntax error: expression is incomplete", "");
        }
        return new ParseException(token.line(), token.column(), "syntax error before: ", token.describe());
    }
}
