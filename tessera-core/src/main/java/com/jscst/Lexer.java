package com.jscst;

import com.jscst.cst.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into tokens, attaching every whitespace and comment character to
 * exactly one token as leading or trailing trivia.
 *
 * <p>Regular expressions and template literals are kept as single opaque tokens. A slash
 * is read as a regular expression or a division from the previous token alone; where that
 * guess is wrong the parser calls {@link #rescanRegex(Token)}. An unterminated string,
 * comment, template or regular expression throws {@link ParseException}.</p>
 */
public class Lexer {

    private final String source;
    private final int length;
    private int pos = 0;
    private int trailingEnd = 0;

    // Last non-trivia token type, used to tell a regex from a division
    private TokenType lastSignificant = null;

    public Lexer(String source) {
        this.source = source;
        this.length = source.length();
        skipHashbang();
    }

    /**
     * Scan the whole source. The list ends with the EOF token.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * Scan the next token, or EOF once the source is exhausted.
     */
    public Token next() {
        int leadingStart = trailingEnd;
        boolean lineBreak = skipLeadingTrivia();
        Span leading = new Span(leadingStart, pos);

        if (pos >= length) {
            Span end = Span.empty(length);
            return new Token(TokenType.EOF, "", end, leading, end, lineBreak);
        }

        int start = pos;
        TokenType type = scanToken();
        return finish(type, start, leading, lineBreak);
    }

    /**
     * Scan again from {@code slash}, a {@code /} or {@code /=} token read as an operator, as
     * the start of a regular expression. Scanning continues after the expression, so tokens
     * already read past {@code slash} must be discarded.
     */
    Token rescanRegex(Token slash) {
        pos = slash.start();
        scanRegex();
        return finish(TokenType.REGEX, slash.start(), slash.leading(), slash.lineBreakBefore());
    }

    private Token finish(TokenType type, int start, Span leading, boolean lineBreak) {
        Span span = new Span(start, pos);
        skipTrailingTrivia();
        Span trailing = new Span(span.end(), pos);

        trailingEnd = pos;
        lastSignificant = type;
        return new Token(type, source.substring(start, span.end()), span, leading, trailing, lineBreak);
    }

    // ========================================================================
    // Trivia
    // ========================================================================

    private void skipHashbang() {
        if (source.startsWith("#!")) {
            while (pos < length && !LineTerminators.isLineTerminator(source.charAt(pos))) {
                pos++;
            }
        }
    }

    /**
     * Consume whitespace, line terminators and comments before a token.
     * @return true if a line terminator was consumed, including one inside a block comment
     */
    private boolean skipLeadingTrivia() {
        boolean lineBreak = false;
        while (pos < length) {
            char ch = source.charAt(pos);
            if (LineTerminators.isLineTerminator(ch)) {
                lineBreak = true;
                pos++;
            } else if (isWhitespace(ch)) {
                pos++;
            } else if (ch == '/' && peekChar(1) == '/') {
                skipLineComment();
            } else if (ch == '/' && peekChar(1) == '*') {
                int commentStart = pos;
                skipBlockComment();
                if (LineTerminators.containsLineTerminator(source, commentStart, pos)) {
                    lineBreak = true;
                }
            } else {
                break;
            }
        }
        return lineBreak;
    }

    /**
     * Consume trivia after a token up to, not including, the next line terminator.
     * A block comment spanning lines is left for the next token's leading trivia.
     */
    private void skipTrailingTrivia() {
        while (pos < length) {
            char ch = source.charAt(pos);
            if (isWhitespace(ch)) {
                pos++;
            } else if (ch == '/' && peekChar(1) == '/') {
                skipLineComment();
            } else if (ch == '/' && peekChar(1) == '*') {
                int close = source.indexOf("*/", pos + 2);
                if (close < 0 || LineTerminators.containsLineTerminator(source, pos, close)) {
                    return;
                }
                pos = close + 2;
            } else {
                return;
            }
        }
    }

    private void skipLineComment() {
        pos += 2;
        while (pos < length && !LineTerminators.isLineTerminator(source.charAt(pos))) {
            pos++;
        }
    }

    private void skipBlockComment() {
        int start = pos;
        int close = source.indexOf("*/", pos + 2);
        if (close < 0) {
            throw fatal(start, length, "'*/'");
        }
        pos = close + 2;
    }

    private static boolean isWhitespace(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\u000B' || ch == '\f' || ch == '\u00A0' || ch == '\uFEFF'
            || Character.getType(ch) == Character.SPACE_SEPARATOR;
    }

    // ========================================================================
    // Tokens
    // ========================================================================

    private TokenType scanToken() {
        char ch = source.charAt(pos);

        if (isIdentifierStart(ch)) {
            return scanIdentifierOrKeyword();
        }
        if (isDigit(ch) || (ch == '.' && isDigit(peekChar(1)))) {
            scanNumber();
            return TokenType.NUMBER;
        }
        if (ch == '"' || ch == '\'') {
            scanString();
            return TokenType.STRING;
        }
        if (ch == '`') {
            scanTemplate();
            return TokenType.TEMPLATE;
        }
        if (ch == '/' && regexAllowed()) {
            scanRegex();
            return TokenType.REGEX;
        }

        for (TokenType punctuator : TokenType.punctuatorsLongestFirst()) {
            if (source.startsWith(punctuator.text(), pos)) {
                // `?.` followed by a digit is a conditional with a fraction: a ?.5 : b
                if (punctuator == TokenType.QUESTION_DOT && isDigit(peekChar(2))) {
                    continue;
                }
                pos += punctuator.text().length();
                return punctuator;
            }
        }

        pos += Character.charCount(source.codePointAt(pos));
        return TokenType.INVALID;
    }

    private TokenType scanIdentifierOrKeyword() {
        int start = pos;
        boolean escaped = false;
        while (pos < length) {
            char ch = source.charAt(pos);
            if (ch == '\\') {
                escaped = true;
                skipUnicodeEscape();
            } else if (pos == start ? isIdentifierStart(ch) : isIdentifierPart(ch)) {
                pos += Character.charCount(source.codePointAt(pos));
            } else {
                break;
            }
        }
        if (escaped) {
            // Escaped keywords are identifiers as far as the token stream goes
            return TokenType.IDENTIFIER;
        }
        TokenType keyword = TokenType.keyword(source.substring(start, pos));
        return keyword != null ? keyword : TokenType.IDENTIFIER;
    }

    private void skipUnicodeEscape() {
        pos++; // backslash
        if (peekChar(0) == 'u') {
            pos++;
            if (peekChar(0) == '{') {
                while (pos < length && source.charAt(pos) != '}') {
                    pos++;
                }
                if (pos < length) {
                    pos++;
                }
            } else {
                for (int i = 0; i < 4 && pos < length && isHexDigit(source.charAt(pos)); i++) {
                    pos++;
                }
            }
        }
    }

    private void scanNumber() {
        char ch = source.charAt(pos);
        if (ch == '0' && "xXoObB".indexOf(peekChar(1)) >= 0 && peekChar(1) != '\0') {
            pos += 2;
            while (pos < length && (isHexDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            scanDigits();
            if (peekChar(0) == '.') {
                pos++;
                scanDigits();
            }
            char e = peekChar(0);
            if (e == 'e' || e == 'E') {
                char next = peekChar(1);
                if (isDigit(next) || ((next == '+' || next == '-') && isDigit(peekChar(2)))) {
                    pos += (next == '+' || next == '-') ? 2 : 1;
                    scanDigits();
                }
            }
        }
        if (peekChar(0) == 'n') {
            pos++; // BigInt suffix
        }
    }

    private void scanDigits() {
        while (pos < length && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void scanString() {
        int start = pos;
        char quote = source.charAt(pos++);
        while (pos < length) {
            char ch = source.charAt(pos);
            if (ch == quote) {
                pos++;
                return;
            }
            if (ch == '\\') {
                pos++;
                if (peekChar(0) == '\r' && peekChar(1) == '\n') {
                    pos++;
                }
                if (pos < length) {
                    pos++;
                }
            } else if (ch == '\n' || ch == '\r') {
                throw fatal(start, pos, "closing " + quote);
            } else {
                pos++;
            }
        }
        throw fatal(start, pos, "closing " + quote);
    }

    private void scanTemplate() {
        int start = pos;
        pos++; // opening backtick
        while (pos < length) {
            char ch = source.charAt(pos);
            if (ch == '`') {
                pos++;
                return;
            }
            if (ch == '\\') {
                pos = Math.min(length, pos + 2);
            } else if (ch == '$' && peekChar(1) == '{') {
                pos += 2;
                skipSubstitution(start);
            } else {
                pos++;
            }
        }
        throw fatal(start, pos, "'`'");
    }

    /**
     * Skip the body of a {@code ${...}} substitution, tracking nested braces, strings,
     * templates and comments so that a {@code }} inside them does not close it.
     */
    private void skipSubstitution(int templateStart) {
        int depth = 1;
        while (pos < length) {
            char ch = source.charAt(pos);
            if (ch == '{') {
                depth++;
                pos++;
            } else if (ch == '}') {
                pos++;
                if (--depth == 0) {
                    return;
                }
            } else if (ch == '"' || ch == '\'') {
                scanString();
            } else if (ch == '`') {
                scanTemplate();
            } else if (ch == '/' && peekChar(1) == '/') {
                skipLineComment();
            } else if (ch == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else {
                pos++;
            }
        }
        throw fatal(templateStart, pos, "'}'");
    }

    private void scanRegex() {
        int start = pos;
        pos++; // opening slash
        boolean inClass = false;
        while (pos < length) {
            char ch = source.charAt(pos);
            if (LineTerminators.isLineTerminator(ch)) {
                break;
            }
            if (ch == '\\') {
                pos++;
                if (pos < length && LineTerminators.isLineTerminator(source.charAt(pos))) {
                    break;
                }
                pos++;
            } else if (ch == '[') {
                inClass = true;
                pos++;
            } else if (ch == ']') {
                inClass = false;
                pos++;
            } else if (ch == '/' && !inClass) {
                pos++;
                while (pos < length && isIdentifierPart(source.charAt(pos))) {
                    pos++;
                }
                return;
            } else {
                pos++;
            }
        }
        throw fatal(start, pos, "closing '/'");
    }

    private boolean regexAllowed() {
        if (lastSignificant == null) {
            return true;
        }
        return switch (lastSignificant) {
            case IDENTIFIER, NUMBER, STRING, TEMPLATE, REGEX,
                 RPAREN, RBRACKET, RBRACE,
                 THIS, NULL, TRUE, FALSE,
                 PLUS_PLUS, MINUS_MINUS -> false;
            default -> true;
        };
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private char peekChar(int offset) {
        int at = pos + offset;
        return at < length ? source.charAt(at) : '\0';
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isHexDigit(char ch) {
        return isDigit(ch) || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F');
    }

    private static boolean isIdentifierStart(char ch) {
        return ch == '$' || ch == '_' || ch == '\\' || Character.isLetter(ch)
            || Character.isHighSurrogate(ch) || Character.isUnicodeIdentifierStart(ch);
    }

    private static boolean isIdentifierPart(char ch) {
        return ch == '$' || ch == '_' || ch == '\u200C' || ch == '\u200D'
            || Character.isLetterOrDigit(ch) || Character.isSurrogate(ch)
            || Character.isUnicodeIdentifierPart(ch) && !Character.isIdentifierIgnorable(ch);
    }

    private ParseException fatal(int start, int end, String expected) {
        String found = end >= length ? "end of input" : "line terminator";
        return new ParseException(new Diagnostic(DiagnosticKind.LEXICAL_ERROR, new Span(start, end), expected, found));
    }
}
