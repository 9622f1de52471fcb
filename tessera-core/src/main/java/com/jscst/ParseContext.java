package com.jscst;

import com.jscst.cst.LiteralWhitespace;
import com.jscst.cst.Span;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * State of one parse: the token cursor, the diagnostics collected so far, the identifier
 * table and the grammar context flags. Shared by reference between the statement,
 * expression and declaration parsers of the same unit and never between units.
 */
final class ParseContext {

    private static final Logger logger = Logger.getLogger(ParseContext.class.getName());

    final ParserOptions options;

    private final Lexer lexer;
    private final List<Token> tokens = new ArrayList<>();  // scanned so far
    private final Diagnostics diagnostics;
    private final Interner interner = new Interner();
    private int current = 0;

    // Grammar context
    int functionDepth = 0;                               // > 0 inside a function body - allows return
    int loopDepth = 0;                                   // > 0 inside a loop - allows break and continue
    int switchDepth = 0;                                 // > 0 inside a switch - allows break
    Map<String, Boolean> labels = new HashMap<>();       // label -> labels an iteration statement
    boolean resyncRequested = false;                     // set by an ASI violation, handled per statement

    private int nesting = 0;                             // open statements, bodies and recursive expression steps
    private boolean abandoned = false;                   // nested too deeply, rest of the unit skipped

    final ExpressionParser expressions;
    final DeclarationParser declarations;
    final StatementParser statements;

    ParseContext(Lexer lexer, ParserOptions options) {
        this.lexer = lexer;
        this.options = options;
        this.diagnostics = new Diagnostics(options.maxDiagnostics());
        this.expressions = new ExpressionParser(this);
        this.declarations = new DeclarationParser(this);
        this.statements = new StatementParser(this);
    }

    // ========================================================================
    // Cursor
    // ========================================================================

    Token peek() {
        return tokenAt(current);
    }

    /**
     * Token {@code offset} places after the current one, or EOF past the end.
     */
    Token peekAhead(int offset) {
        return tokenAt(current + offset);
    }

    Token previous() {
        return tokens.get(current - 1);
    }

    Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
        }
        return token;
    }

    boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token tokenAt(int index) {
        while (tokens.size() <= index) {
            if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.EOF) {
                return tokens.get(tokens.size() - 1);
            }
            tokens.add(lexer.next());
        }
        return tokens.get(index);
    }

    /**
     * Read the current {@code /} or {@code /=} again as a regular expression, where an
     * operand is expected. Tokens scanned after it are discarded and scanned again.
     */
    void rescanAsRegex() {
        Token slash = peek();
        tokens.subList(current + 1, tokens.size()).clear();
        tokens.set(current, lexer.rescanRegex(slash));
    }

    int tokenCount() {
        return tokens.size();
    }

    boolean check(TokenType type) {
        return peek().type() == type;
    }

    boolean checkAhead(int offset, TokenType type) {
        return peekAhead(offset).type() == type;
    }

    int position() {
        return current;
    }

    /**
     * Consume a mandatory token. When it is missing, report it and return zero-width
     * trivia at the end of the last consumed token in its place.
     */
    LiteralWhitespace expect(TokenType type) {
        if (check(type)) {
            return advance().whitespace();
        }
        reportExpected(type.describe());
        return LiteralWhitespace.empty(lastEnd());
    }

    /**
     * End offset of the last consumed token, 0 before the first one.
     */
    int lastEnd() {
        return current > 0 ? previous().end() : 0;
    }

    /**
     * Span from {@code start} to the end of the last consumed token. When nothing was
     * consumed since {@code start} the span is empty at the end of the last consumed token,
     * which keeps placeholder nodes inside their parent.
     */
    Span spanFrom(int start) {
        int end = lastEnd();
        return end < start ? Span.empty(end) : new Span(start, end);
    }

    // ========================================================================
    // Nesting
    // ========================================================================

    /**
     * Open one level of statement or expression nesting. Past
     * {@link ParserOptions#maxNestingDepth()} the unit is abandoned and this returns false;
     * the caller then returns a placeholder without calling {@link #exitNesting()}.
     */
    boolean enterNesting() {
        if (abandoned) {
            return false;
        }
        if (nesting >= options.maxNestingDepth()) {
            abandonTooDeep();
            return false;
        }
        nesting++;
        return true;
    }

    void exitNesting() {
        nesting--;
    }

    /**
     * Report {@link DiagnosticKind#NESTING_TOO_DEEP} at the current token and skip every
     * remaining token. Enclosing routines then see end of input and close their nodes, and
     * nothing they report is recorded.
     */
    void abandonTooDeep() {
        Token found = peek();
        report(DiagnosticKind.NESTING_TOO_DEEP, found.span(),
            "at most " + options.maxNestingDepth() + " levels of nesting", found.describe());
        while (!isAtEnd()) {
            current++;
        }
        abandoned = true;
        logger.warning("Skipped input from offset " + found.start() + ", nested too deeply");
    }

    // ========================================================================
    // Diagnostics
    // ========================================================================

    void report(DiagnosticKind kind, Span span, String expected, String found) {
        if (abandoned) {
            return;
        }
        diagnostics.report(new Diagnostic(kind, span, expected, found));
    }

    void reportExpected(String expected) {
        Token found = peek();
        report(DiagnosticKind.EXPECTED_TOKEN, found.span(), expected, found.describe());
    }

    List<Diagnostic> diagnostics() {
        return diagnostics.reported();
    }

    int droppedDiagnostics() {
        return diagnostics.dropped();
    }

    String intern(String name) {
        return interner.intern(name);
    }
}
