package com.exformatter.plugins.elixir.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits Elixir source into tokens and collects its comments.
 * <p>
 * Newlines are folded into end-of-line tokens that count them; a comma or a
 * semicolon absorbs the newlines that follow it, and a newline before an
 * operator that can only be binary is dropped. String contents are kept
 * unescaped, except for escaped terminators which lose their backslash.
 */
public final class Tokenizer {

    private static final List<String> OPERATORS = List.of(
            "===", "!==", "<<<", ">>>", "&&&", "|||", "^^^", "~~~", "<<~", "~>>", "<~>", "<|>",
            "==", "!=", "=~", "<=", ">=", "&&", "||", "|>", "++", "--", "<>", "::", "<-", "->", "=>",
            "~>", "<~", "\\\\", "..",
            "<", ">", "+", "-", "*", "/", "=", "|", "!", "^", "&", "@");

    private static final Set<String> WORD_OPERATORS = Set.of("and", "or", "in", "when", "not");

    /** Operators after which a preceding newline is not an expression end. */
    private static final Set<String> BINARY_ONLY = Set.of(
            "===", "!==", "<<<", ">>>", "&&&", "|||", "^^^", "<<~", "~>>", "<~>", "<|>",
            "==", "!=", "=~", "<=", ">=", "&&", "||", "|>", "++", "--", "<>", "::", "<-", "=>",
            "~>", "<~", "\\\\", "..", "<", ">", "*", "/", "=", "|",
            "and", "or", "in", "when", "not in");

    private static final List<String> SPECIAL_ATOMS = List.of("<<>>", "%{}", "{}", "...", "%", ".");

    private static final Map<Character, Character> SIGIL_PAIRS = Map.of(
            '(', ')', '[', ']', '{', '}', '<', '>', '/', '/', '|', '|', '"', '"', '\'', '\'');

    private final String source;
    private final List<SourceComment> comments = new ArrayList<>();
    private int pos;
    private int line;
    private int column = 1;

    public Tokenizer(String source, int startLine) {
        this.source = source;
        this.line = startLine;
    }

    /**
     * Tokenizes the whole source. The returned list always ends with an
     * {@link TokenKind#EOF} token.
     */
    public List<Token> tokenize() throws ParseException {
        List<Token> tokens = new ArrayList<>();
        run(tokens, false);
        tokens.add(Token.simple(TokenKind.EOF, "", line, column, true));
        return tokens;
    }

    public List<SourceComment> getComments() {
        return Collections.unmodifiableList(comments);
    }

    // The main loop. Inside an interpolation it returns after the closing brace.
    private void run(List<Token> tokens, boolean interpolation) throws ParseException {
        int openLine = line;
        int braces = 0;
        boolean space = false;

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
                space = true;
                continue;
            }
            if (c == '\\' && peek(1) == '\n') {
                advance();
                advance();
                space = true;
                continue;
            }
            if (c == '\n') {
                newline(tokens);
                space = true;
                continue;
            }
            if (c == '#') {
                comment(tokens);
                space = true;
                continue;
            }
            if (c == '}' && interpolation && braces == 0) {
                advance();
                return;
            }

            Token token = next(space);
            if (token.is(TokenKind.LBRACE)) {
                braces++;
            } else if (token.is(TokenKind.RBRACE)) {
                braces--;
            }
            add(tokens, token);
            space = false;
        }

        if (interpolation) {
            throw new ParseException(line, column,
                    "missing interpolation terminator: } (for interpolation starting at line " + openLine + ")", "");
        }
    }

    private void add(List<Token> tokens, Token token) {
        Token previous = last(tokens);
        if (token.is(TokenKind.OPERATOR) && BINARY_ONLY.contains(token.text())
                && previous != null && previous.is(TokenKind.EOL)) {
            tokens.remove(tokens.size() - 1);
            token = token.withNewlineBefore();
        }
        tokens.add(token);
    }

    private void newline(List<Token> tokens) {
        int newlineLine = line;
        int newlineColumn = column;
        advance();

        Token previous = last(tokens);
        if (previous == null) {
            return;
        }
        if (previous.is(TokenKind.EOL) || previous.is(TokenKind.COMMA) || previous.is(TokenKind.SEMICOLON)) {
            tokens.set(tokens.size() - 1, previous.withEolCount(previous.eolCount() + 1));
            return;
        }
        tokens.set(tokens.size() - 1, previous.withEolAfter());
        tokens.add(Token.simple(TokenKind.EOL, "", newlineLine, newlineColumn, true).withEolCount(1));
    }

    private void comment(List<Token> tokens) {
        int commentLine = line;
        int start = pos;
        while (pos < source.length() && source.charAt(pos) != '\n') {
            advance();
        }
        String text = source.substring(start, pos).stripTrailing();

        comments.add(new SourceComment(commentLine, previousEol(tokens), nextEol(), formatComment(text)));

        Token previous = last(tokens);
        if (previous != null && previous.is(TokenKind.EOL)) {
            tokens.set(tokens.size() - 1, previous.withEolCount(0));
        }
    }

    private static Integer previousEol(List<Token> tokens) {
        Token previous = last(tokens);
        if (previous == null) {
            return 1;
        }
        boolean separator = previous.is(TokenKind.EOL) || previous.is(TokenKind.COMMA) || previous.is(TokenKind.SEMICOLON);
        if (separator && previous.eolCount() > 0) {
            return previous.eolCount();
        }
        return null;
    }

    private int nextEol() {
        int count = 0;
        int index = pos;
        while (index < source.length()) {
            char c = source.charAt(index);
            if (c == '\n') {
                count++;
            } else if (c != ' ' && c != '\t' && c != '\r') {
                break;
            }
            index++;
        }
        return count;
    }

    /** {@code #foo} becomes {@code # foo}; runs of leading {@code #} are kept. */
    static String formatComment(String text) {
        int hashes = 0;
        while (hashes < text.length() && text.charAt(hashes) == '#') {
            hashes++;
        }
        if (hashes == text.length()) {
            return text;
        }
        String rest = text.substring(hashes);
        if (rest.startsWith(" ") || rest.startsWith("!")) {
            return text;
        }
        return text.substring(0, hashes) + " " + rest;
    }

    // Tokens

    private Token next(boolean space) throws ParseException {
        int startLine = line;
        int startColumn = column;
        char c = source.charAt(pos);

        if (isDigit(c)) {
            return number(space);
        }
        if (isIdentifierStart(c)) {
            return identifier(space);
        }
        if (Character.isUpperCase(c)) {
            return alias(space);
        }

        switch (c) {
            case '"':
            case '\'':
                return stringLike(c, space);
            case ':':
                if (peek(1) == ':') {
                    break;
                }
                return atom(space);
            case '?':
                return character(space);
            case '~':
                if (Character.isLetter(peek(1))) {
                    return sigil(space);
                }
                break;
            case '&':
                if (isDigit(peek(1))) {
                    advance();
                    int start = pos;
                    while (pos < source.length() && isDigit(source.charAt(pos))) {
                        advance();
                    }
                    return Token.simple(TokenKind.CAPTURE_INT, source.substring(start, pos), startLine, startColumn, space);
                }
                break;
            case '(':
                advance();
                return Token.simple(TokenKind.LPAREN, "(", startLine, startColumn, space);
            case ')':
                advance();
                return Token.simple(TokenKind.RPAREN, ")", startLine, startColumn, space);
            case '[':
                advance();
                return Token.simple(TokenKind.LBRACKET, "[", startLine, startColumn, space);
            case ']':
                advance();
                return Token.simple(TokenKind.RBRACKET, "]", startLine, startColumn, space);
            case '{':
                advance();
                return Token.simple(TokenKind.LBRACE, "{", startLine, startColumn, space);
            case '}':
                advance();
                return Token.simple(TokenKind.RBRACE, "}", startLine, startColumn, space);
            case ',':
                advance();
                return Token.simple(TokenKind.COMMA, ",", startLine, startColumn, space);
            case ';':
                advance();
                return Token.simple(TokenKind.SEMICOLON, ";", startLine, startColumn, space);
            case '%':
                advance();
                return Token.simple(TokenKind.PERCENT, "%", startLine, startColumn, space);
            case '.':
                if (source.startsWith("...", pos)) {
                    skip(3);
                    return Token.simple(TokenKind.IDENTIFIER, "...", startLine, startColumn, space);
                }
                if (!source.startsWith("..", pos)) {
                    advance();
                    return Token.simple(TokenKind.DOT, ".", startLine, startColumn, space);
                }
                break;
            case '<':
                if (source.startsWith("<<", pos) && !source.startsWith("<<<", pos) && !source.startsWith("<<~", pos)) {
                    skip(2);
                    return Token.simple(TokenKind.LTLT, "<<", startLine, startColumn, space);
                }
                break;
            case '>':
                if (source.startsWith(">>", pos) && !source.startsWith(">>>", pos)) {
                    skip(2);
                    return Token.simple(TokenKind.GTGT, ">>", startLine, startColumn, space);
                }
                break;
            default:
                break;
        }

        String op = matchOperator(pos);
        if (op != null) {
            skip(op.length());
            // [+: 2]
            if (isKeywordColon()) {
                advance();
                return Token.simple(TokenKind.KW_IDENTIFIER, op, startLine, startColumn, space);
            }
            return Token.simple(TokenKind.OPERATOR, op, startLine, startColumn, space);
        }
        throw new ParseException(startLine, startColumn, "unexpected token: ", String.valueOf(c));
    }

    private String matchOperator(int at) {
        for (String op : OPERATORS) {
            if (source.startsWith(op, at)) {
                return op;
            }
        }
        return null;
    }

    private Token number(boolean space) throws ParseException {
        int startLine = line;
        int startColumn = column;
        int start = pos;

        if (source.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'b' || peek(1) == 'o')) {
            char base = peek(1);
            skip(2);
            int digits = pos;
            while (pos < source.length() && (isDigitOfBase(source.charAt(pos), base) || source.charAt(pos) == '_')) {
                advance();
            }
            if (pos == digits) {
                throw new ParseException(startLine, startColumn, "invalid number: ", source.substring(start, pos));
            }
            return Token.simple(TokenKind.INT, source.substring(start, pos), startLine, startColumn, space);
        }

        digits();
        boolean isFloat = false;
        if (pos < source.length() && source.charAt(pos) == '.' && isDigit(peek(1))) {
            isFloat = true;
            advance();
            digits();
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int exponent = pos;
                advance();
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    advance();
                }
                if (pos >= source.length() || !isDigit(source.charAt(pos))) {
                    throw new ParseException(startLine, startColumn, "invalid float number: ",
                            source.substring(start, exponent + 1));
                }
                digits();
            }
        }
        TokenKind kind = isFloat ? TokenKind.FLOAT : TokenKind.INT;
        return Token.simple(kind, source.substring(start, pos), startLine, startColumn, space);
    }

    private void digits() {
        while (pos < source.length() && (isDigit(source.charAt(pos)) || (source.charAt(pos) == '_' && isDigit(peek(1))))) {
            advance();
        }
    }

    private Token identifier(boolean space) {
        int startLine = line;
        int startColumn = column;
        String name = word();

        if (isKeywordColon()) {
            advance();
            return Token.simple(TokenKind.KW_IDENTIFIER, name, startLine, startColumn, space);
        }
        if (name.equals("not") && followedByIn()) {
            return Token.simple(TokenKind.OPERATOR, "not in", startLine, startColumn, space);
        }
        if (WORD_OPERATORS.contains(name)) {
            return Token.simple(TokenKind.OPERATOR, name, startLine, startColumn, space);
        }
        return Token.simple(TokenKind.IDENTIFIER, name, startLine, startColumn, space);
    }

    private Token alias(boolean space) {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            advance();
        }
        String name = source.substring(start, pos);
        if (isKeywordColon()) {
            advance();
            return Token.simple(TokenKind.KW_IDENTIFIER, name, startLine, startColumn, space);
        }
        return Token.simple(TokenKind.ALIAS, name, startLine, startColumn, space);
    }

    private String word() {
        int start = pos;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            advance();
        }
        if (pos < source.length() && (source.charAt(pos) == '?' || source.charAt(pos) == '!')) {
            advance();
        }
        return source.substring(start, pos);
    }

    private boolean isKeywordColon() {
        if (pos >= source.length() || source.charAt(pos) != ':') {
            return false;
        }
        char after = peek(1);
        return after == ' ' || after == '\t' || after == '\n' || after == '\r' || after == 0;
    }

    private boolean followedByIn() {
        int index = pos;
        while (index < source.length() && (source.charAt(index) == ' ' || source.charAt(index) == '\t')) {
            index++;
        }
        if (index == pos || !source.startsWith("in", index)) {
            return false;
        }
        int end = index + 2;
        if (end < source.length() && (isIdentifierPart(source.charAt(end)) || source.charAt(end) == ':')) {
            return false;
        }
        skip(end - pos);
        return true;
    }

    private Token atom(boolean space) throws ParseException {
        int startLine = line;
        int startColumn = column;
        advance();

        if (pos < source.length() && source.charAt(pos) == '"') {
            advance();
            List<Token.Part> parts = scanParts("\"", true, 0, -1, startLine);
            return Token.quoted(TokenKind.ATOM_QUOTED, parts, false, startLine, startColumn, space);
        }
        if (pos < source.length() && (isIdentifierStart(source.charAt(pos)) || Character.isUpperCase(source.charAt(pos)))) {
            int start = pos;
            while (pos < source.length() && (isIdentifierPart(source.charAt(pos)) || source.charAt(pos) == '@')) {
                advance();
            }
            if (pos < source.length() && (source.charAt(pos) == '?' || source.charAt(pos) == '!')) {
                advance();
            }
            return Token.simple(TokenKind.ATOM, source.substring(start, pos), startLine, startColumn, space);
        }
        for (String special : SPECIAL_ATOMS) {
            if (source.startsWith(special, pos)) {
                skip(special.length());
                return Token.simple(TokenKind.ATOM, special, startLine, startColumn, space);
            }
        }
        String op = matchOperator(pos);
        if (op == null && source.startsWith("not", pos)) {
            op = "not";
        }
        if (op != null) {
            skip(op.length());
            return Token.simple(TokenKind.ATOM, op, startLine, startColumn, space);
        }
        throw new ParseException(startLine, startColumn, "unexpected token: ", ":");
    }

    private Token character(boolean space) throws ParseException {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        advance();
        if (pos >= source.length()) {
            throw new ParseException(startLine, startColumn, "unexpected token: ", "?");
        }
        if (source.charAt(pos) == '\\') {
            advance();
        }
        if (pos >= source.length()) {
            throw new ParseException(startLine, startColumn, "unexpected token: ", "?\\");
        }
        int codePoint = source.codePointAt(pos);
        skip(Character.charCount(codePoint));
        return Token.simple(TokenKind.CHAR, source.substring(start, pos), startLine, startColumn, space);
    }

    private Token stringLike(char quote, boolean space) throws ParseException {
        int startLine = line;
        int startColumn = column;
        TokenKind kind = quote == '"' ? TokenKind.STRING : TokenKind.CHARLIST;
        String triple = String.valueOf(quote).repeat(3);

        if (source.startsWith(triple, pos)) {
            skip(3);
            List<Token.Part> parts = heredoc(triple, true, startLine);
            return Token.quoted(kind, parts, true, startLine, startColumn, space);
        }

        advance();
        List<Token.Part> parts = scanParts(String.valueOf(quote), true, 0, -1, startLine);
        if (isKeywordColon()) {
            advance();
            return Token.quoted(TokenKind.KW_QUOTED, parts, false, startLine, startColumn, space);
        }
        return Token.quoted(kind, parts, false, startLine, startColumn, space);
    }

    private Token sigil(boolean space) throws ParseException {
        int startLine = line;
        int startColumn = column;
        advance();
        char letter = source.charAt(pos);
        advance();
        boolean interpolate = Character.isLowerCase(letter);

        List<Token.Part> parts;
        String terminator;
        if (source.startsWith("\"\"\"", pos) || source.startsWith("'''", pos)) {
            terminator = source.substring(pos, pos + 3);
            skip(3);
            parts = heredoc(terminator, interpolate, startLine);
        } else {
            char open = pos < source.length() ? source.charAt(pos) : 0;
            Character close = SIGIL_PAIRS.get(open);
            if (close == null) {
                throw new ParseException(startLine, startColumn, "invalid sigil delimiter: ",
                        open == 0 ? "" : String.valueOf(open));
            }
            terminator = String.valueOf(open);
            advance();
            parts = scanParts(String.valueOf(close), interpolate, 0, -1, startLine);
        }

        int start = pos;
        while (pos < source.length() && Character.isLetterOrDigit(source.charAt(pos))) {
            advance();
        }
        String modifiers = source.substring(start, pos);
        return Token.sigil(String.valueOf(letter), parts, terminator, modifiers, startLine, startColumn, space);
    }

    /**
     * Reads a heredoc body after its opening delimiter. The indentation of the
     * closing delimiter is removed from every line.
     */
    private List<Token.Part> heredoc(String delimiter, boolean interpolate, int startLine) throws ParseException {
        while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t' || source.charAt(pos) == '\r')) {
            advance();
        }
        if (pos >= source.length() || source.charAt(pos) != '\n') {
            throw new ParseException(line, column,
                    "heredoc allows only zero or more whitespace characters followed by a new line after ", delimiter);
        }
        advance();

        int lineStart = pos;
        int closingStart = -1;
        int indent = 0;
        while (lineStart <= source.length()) {
            int index = lineStart;
            while (index < source.length() && (source.charAt(index) == ' ' || source.charAt(index) == '\t')) {
                index++;
            }
            if (source.startsWith(delimiter, index)) {
                closingStart = lineStart;
                indent = index - lineStart;
                break;
            }
            int end = source.indexOf('\n', lineStart);
            if (end < 0) {
                break;
            }
            lineStart = end + 1;
        }
        if (closingStart < 0) {
            throw new ParseException(line, column,
                    "missing terminator: " + delimiter + " (for heredoc starting at line " + startLine + ")", "");
        }

        skipIndent(indent, closingStart);
        List<Token.Part> parts = scanParts(null, interpolate, indent, closingStart, startLine);
        skip(indent + delimiter.length());
        return parts;
    }

    /**
     * Scans string content up to {@code closing}, or up to {@code limit} when
     * there is no closing delimiter to look for.
     */
    private List<Token.Part> scanParts(String closing, boolean interpolate, int indent, int limit, int startLine)
            throws ParseException {
        List<Token.Part> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        while (true) {
            if (limit >= 0 && pos >= limit) {
                break;
            }
            if (pos >= source.length()) {
                throw new ParseException(line, column,
                        "missing terminator: " + closing + " (for string starting at line " + startLine + ")", "");
            }
            char c = source.charAt(pos);

            if (closing != null && source.startsWith(closing, pos)) {
                skip(closing.length());
                break;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                char escaped = source.charAt(pos + 1);
                if (closing != null && closing.length() == 1 && escaped == closing.charAt(0)) {
                    literal.append(escaped);
                } else {
                    literal.append(c).append(escaped);
                }
                advance();
                advance();
                continue;
            }
            if (interpolate && c == '#' && peek(1) == '{') {
                if (literal.length() > 0) {
                    parts.add(Token.Part.literal(literal.toString()));
                    literal.setLength(0);
                }
                int interpolationLine = line;
                skip(2);
                List<Token> tokens = new ArrayList<>();
                run(tokens, true);
                tokens.add(Token.simple(TokenKind.EOF, "", line, column, true));
                parts.add(Token.Part.interpolation(tokens, interpolationLine, line));
                continue;
            }
            literal.append(c);
            advance();
            if (c == '\n' && indent > 0) {
                skipIndent(indent, limit);
            }
        }

        if (literal.length() > 0) {
            parts.add(Token.Part.literal(literal.toString()));
        }
        return parts;
    }

    private void skipIndent(int indent, int limit) {
        int skipped = 0;
        while (skipped < indent && pos < source.length() && (limit < 0 || pos < limit)
                && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
            advance();
            skipped++;
        }
    }

    // Cursor

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : 0;
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private void skip(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    private static Token last(List<Token> tokens) {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isDigitOfBase(char c, char base) {
        return switch (base) {
            case 'x' -> isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            case 'o' -> c >= '0' && c <= '7';
            default -> c == '0' || c == '1';
        };
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLowerCase(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
