package com.jscst;

import com.jscst.cst.BlockStmt;
import com.jscst.cst.BreakStmt;
import com.jscst.cst.Case;
import com.jscst.cst.CatchClause;
import com.jscst.cst.ContinueStmt;
import com.jscst.cst.Declarator;
import com.jscst.cst.DoWhileStmt;
import com.jscst.cst.EmptyStmt;
import com.jscst.cst.Expr;
import com.jscst.cst.ExprStmt;
import com.jscst.cst.ForInStmt;
import com.jscst.cst.ForStmt;
import com.jscst.cst.ForStmtInit;
import com.jscst.cst.IfStmt;
import com.jscst.cst.InvalidExpr;
import com.jscst.cst.LabelledStmt;
import com.jscst.cst.LiteralExpr;
import com.jscst.cst.LiteralKind;
import com.jscst.cst.LiteralWhitespace;
import com.jscst.cst.ReturnStmt;
import com.jscst.cst.Semicolon;
import com.jscst.cst.Span;
import com.jscst.cst.Stmt;
import com.jscst.cst.StmtListItem;
import com.jscst.cst.SwitchStmt;
import com.jscst.cst.ThrowStmt;
import com.jscst.cst.TryStmt;
import com.jscst.cst.VarKind;
import com.jscst.cst.VarStmt;
import com.jscst.cst.WhileStmt;
import com.jscst.cst.WithStmt;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Recursive-descent parser for statements and statement lists.
 *
 * <p>Every routine returns a complete node. Missing mandatory tokens are reported and
 * replaced by zero-width trivia, and an ASI violation makes the enclosing
 * {@link #parseStatement()} call discard tokens up to the next statement boundary.</p>
 */
final class StatementParser {

    private static final Logger logger = Logger.getLogger(StatementParser.class.getName());

    private final ParseContext ctx;

    StatementParser(ParseContext ctx) {
        this.ctx = ctx;
    }

    // ========================================================================
    // Statement lists
    // ========================================================================

    /**
     * Parse statement list items until end of input or one of {@code terminators},
     * which is left unconsumed.
     */
    List<StmtListItem> parseStatementList(TokenType... terminators) {
        return parseStatementList(new ArrayList<>(), terminators);
    }

    /**
     * Parse statement list items into {@code items}, which holds every completed item even
     * when parsing stops early.
     */
    List<StmtListItem> parseStatementList(List<StmtListItem> items, TokenType... terminators) {
        while (!ctx.isAtEnd() && !atAny(terminators)) {
            Token token = ctx.peek();
            if (cannotStartStatement(token.type())) {
                ctx.report(DiagnosticKind.UNEXPECTED_TOKEN, token.span(), "statement", token.describe());
                ctx.advance();
                continue;
            }

            int before = ctx.position();
            StmtListItem item = parseStatementListItem();
            if (ctx.position() == before) {
                // Nothing consumed: drop the placeholder and step over the token
                ctx.report(DiagnosticKind.UNEXPECTED_TOKEN, token.span(), "statement", token.describe());
                ctx.advance();
                continue;
            }
            items.add(item);
        }
        return items;
    }

    private StmtListItem parseStatementListItem() {
        if (ctx.check(TokenType.FUNCTION) && ctx.checkAhead(1, TokenType.IDENTIFIER)) {
            return ctx.declarations.parseFunctionDeclaration();
        }
        return parseStatement();
    }

    /**
     * Parse one statement, then resynchronize if it ended in an ASI violation.
     */
    Stmt parseStatement() {
        if (!ctx.enterNesting()) {
            return emptyBlock();
        }
        try {
            Stmt stmt = parseStatementBody();
            if (ctx.resyncRequested) {
                resynchronize();
            }
            return stmt;
        } finally {
            ctx.exitNesting();
        }
    }

    /**
     * Parse the body of an {@code if}, loop, {@code with} or label, where only a statement
     * and no declaration may appear.
     */
    private Stmt parseSubStatement() {
        Token token = ctx.peek();
        if (token.type() == TokenType.FUNCTION) {
            ctx.report(DiagnosticKind.DECLARATION_NOT_ALLOWED, token.span(), "statement", "function declaration");
        } else if (token.type() == TokenType.CONST || startsLetDeclaration()) {
            ctx.report(DiagnosticKind.DECLARATION_NOT_ALLOWED, token.span(), "statement", "lexical declaration");
        }
        return parseStatement();
    }

    private Stmt parseStatementBody() {
        Token token = ctx.peek();

        return switch (token.type()) {
            case VAR, CONST -> parseVariableStatement();
            case LET -> startsLetDeclaration() ? parseVariableStatement() : parseExpressionStatement();
            case LBRACE -> parseBlock();
            case SEMICOLON -> new EmptyStmt(token.span(), ctx.advance().whitespace());
            case IF -> parseIfStatement();
            case SWITCH -> parseSwitchStatement();
            case THROW -> parseThrowStatement();
            case WHILE -> parseWhileStatement();
            case DO -> parseDoWhileStatement();
            case BREAK -> parseBreakStatement();
            case CONTINUE -> parseContinueStatement();
            case RETURN -> parseReturnStatement();
            case TRY -> parseTryStatement();
            case FOR -> parseForStatement();
            case WITH -> parseWithStatement();
            case DEBUGGER -> parseDebuggerStatement();
            default -> parseExpressionStatement();
        };
    }

    // ========================================================================
    // Semicolon-terminated statements
    // ========================================================================

    private VarStmt parseVariableStatement() {
        Token keyword = ctx.advance();
        List<Declarator> declared = new ArrayList<>();
        List<LiteralWhitespace> commas = new ArrayList<>();
        parseDeclarators(false, declared, commas);
        Semicolon semi = consumeSemicolon();
        return new VarStmt(ctx.spanFrom(keyword.start()), varKind(keyword.type()), keyword.whitespace(),
            declared, commas, semi);
    }

    /**
     * The declaration in a {@code for} head. Its semicolon belongs to the loop, so the
     * statement's own is always implicit.
     */
    private VarStmt parseForDeclaration() {
        Token keyword = ctx.advance();
        List<Declarator> declared = new ArrayList<>();
        List<LiteralWhitespace> commas = new ArrayList<>();
        parseDeclarators(true, declared, commas);
        return new VarStmt(ctx.spanFrom(keyword.start()), varKind(keyword.type()), keyword.whitespace(),
            declared, commas, Semicolon.IMPLICIT);
    }

    private void parseDeclarators(boolean noIn, List<Declarator> declared, List<LiteralWhitespace> commas) {
        while (true) {
            LiteralExpr name = ctx.expressions.bindingIdentifier();
            LiteralWhitespace initializerWhitespace = null;
            Expr value = null;
            if (ctx.check(TokenType.ASSIGN)) {
                initializerWhitespace = ctx.advance().whitespace();
                value = ctx.expressions.parseAssignment(noIn);
            }
            declared.add(new Declarator(name, initializerWhitespace, value));

            if (!ctx.check(TokenType.COMMA)) {
                return;
            }
            commas.add(ctx.advance().whitespace());
        }
    }

    private Stmt parseExpressionStatement() {
        int start = ctx.peek().start();
        Expr expr = ctx.expressions.parseExpression(false);

        if (expr instanceof LiteralExpr label
                && label.literalKind() == LiteralKind.IDENTIFIER
                && ctx.check(TokenType.COLON)) {
            return parseLabelledStatement(label);
        }

        // A recovered expression may begin at an empty placeholder before the first token
        Semicolon semi = consumeSemicolon();
        return new ExprStmt(ctx.spanFrom(Math.min(start, expr.span().start())), expr, semi);
    }

    private ExprStmt parseDebuggerStatement() {
        Token keyword = ctx.advance();
        LiteralExpr expr = new LiteralExpr(keyword.span(), LiteralKind.DEBUGGER, keyword.lexeme(), keyword.whitespace());
        Semicolon semi = consumeSemicolon();
        return new ExprStmt(ctx.spanFrom(keyword.start()), expr, semi);
    }

    private ThrowStmt parseThrowStatement() {
        Token keyword = ctx.advance();

        // No line terminator is allowed between 'throw' and its operand
        if (ctx.peek().lineBreakBefore()) {
            ctx.report(DiagnosticKind.ILLEGAL_LINE_BREAK, ctx.peek().span(), "expression", "line terminator");
        }

        Expr arg = ctx.expressions.parseExpression(false);
        Semicolon semi = consumeSemicolon();
        return new ThrowStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), arg, semi);
    }

    private ReturnStmt parseReturnStatement() {
        Token keyword = ctx.advance();

        if (ctx.functionDepth == 0 && !ctx.options.allowReturnOutsideFunction()) {
            ctx.report(DiagnosticKind.ILLEGAL_RETURN, keyword.span(), "function body", keyword.describe());
        }

        // [no LineTerminator here]: a line break after 'return' ends the statement
        Expr value = null;
        if (!endsRestrictedProduction()) {
            value = ctx.expressions.parseExpression(false);
        }

        Semicolon semi = consumeSemicolon();
        return new ReturnStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), value, semi);
    }

    private BreakStmt parseBreakStatement() {
        Token keyword = ctx.advance();
        LiteralExpr label = parseJumpLabel();

        if (label == null && ctx.loopDepth == 0 && ctx.switchDepth == 0) {
            ctx.report(DiagnosticKind.ILLEGAL_JUMP, keyword.span(), "enclosing loop or switch", keyword.describe());
        }
        if (label != null && !ctx.labels.containsKey(label.raw())) {
            ctx.report(DiagnosticKind.UNDEFINED_LABEL, label.span(), "label", "'" + label.raw() + "'");
        }

        Semicolon semi = consumeSemicolon();
        return new BreakStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), label, semi);
    }

    private ContinueStmt parseContinueStatement() {
        Token keyword = ctx.advance();
        LiteralExpr label = parseJumpLabel();

        if (ctx.loopDepth == 0) {
            ctx.report(DiagnosticKind.ILLEGAL_JUMP, keyword.span(), "enclosing loop", keyword.describe());
        }
        if (label != null) {
            Boolean iteration = ctx.labels.get(label.raw());
            if (iteration == null) {
                ctx.report(DiagnosticKind.UNDEFINED_LABEL, label.span(), "label", "'" + label.raw() + "'");
            } else if (!iteration) {
                ctx.report(DiagnosticKind.ILLEGAL_JUMP, label.span(), "iteration label", "'" + label.raw() + "'");
            }
        }

        Semicolon semi = consumeSemicolon();
        return new ContinueStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), label, semi);
    }

    private LiteralExpr parseJumpLabel() {
        if (ctx.check(TokenType.IDENTIFIER) && !ctx.peek().lineBreakBefore()) {
            return ctx.expressions.identifier(ctx.advance());
        }
        return null;
    }

    /**
     * True when the token after a restricted keyword cannot continue the statement: a
     * line terminator precedes it, or it is {@code ;}, {@code }} or end of input.
     */
    private boolean endsRestrictedProduction() {
        Token next = ctx.peek();
        return next.lineBreakBefore()
            || next.type() == TokenType.SEMICOLON
            || next.type() == TokenType.RBRACE
            || next.type() == TokenType.EOF;
    }

    // ========================================================================
    // Compound statements
    // ========================================================================

    /**
     * Parse {@code { ... }}. Without an opening brace nothing is consumed and an empty
     * block is returned in its place.
     */
    BlockStmt parseBlock() {
        if (!ctx.check(TokenType.LBRACE)) {
            ctx.reportExpected(TokenType.LBRACE.describe());
            return emptyBlock();
        }

        Token open = ctx.advance();
        List<StmtListItem> stmts = parseStatementList(TokenType.RBRACE);
        LiteralWhitespace close = ctx.expect(TokenType.RBRACE);
        return new BlockStmt(ctx.spanFrom(open.start()), open.whitespace(), stmts, close);
    }

    /**
     * Zero-width block at the end of the last consumed token.
     */
    BlockStmt emptyBlock() {
        LiteralWhitespace missing = LiteralWhitespace.empty(ctx.lastEnd());
        return new BlockStmt(Span.empty(ctx.lastEnd()), missing, List.of(), missing);
    }

    private IfStmt parseIfStatement() {
        Token keyword = ctx.advance();
        LiteralWhitespace openParen = ctx.expect(TokenType.LPAREN);
        Expr condition = ctx.expressions.parseExpression(false);
        LiteralWhitespace closeParen = ctx.expect(TokenType.RPAREN);

        Stmt cons = parseSubStatement();

        LiteralWhitespace elseWhitespace = null;
        Stmt alt = null;
        if (ctx.check(TokenType.ELSE)) {
            elseWhitespace = ctx.advance().whitespace();
            alt = parseSubStatement();
        }

        return new IfStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), openParen, condition, closeParen,
            cons, elseWhitespace, alt);
    }

    private SwitchStmt parseSwitchStatement() {
        Token keyword = ctx.advance();
        LiteralWhitespace openParen = ctx.expect(TokenType.LPAREN);
        Expr test = ctx.expressions.parseExpression(false);
        LiteralWhitespace closeParen = ctx.expect(TokenType.RPAREN);
        LiteralWhitespace openBrace = ctx.expect(TokenType.LBRACE);

        List<Case> cases = new ArrayList<>();
        boolean hasDefault = false;

        ctx.switchDepth++;
        try {
            while (!ctx.check(TokenType.RBRACE) && !ctx.isAtEnd()) {
                Token clause = ctx.peek();

                if (clause.type() == TokenType.CASE) {
                    ctx.advance();
                    Expr caseTest = ctx.expressions.parseExpression(false);
                    LiteralWhitespace colon = ctx.expect(TokenType.COLON);
                    List<StmtListItem> cons = parseCaseBody();
                    cases.add(new Case(ctx.spanFrom(clause.start()), false, clause.whitespace(), caseTest, colon, cons));

                } else if (clause.type() == TokenType.DEFAULT) {
                    ctx.advance();
                    LiteralWhitespace colon = ctx.expect(TokenType.COLON);
                    List<StmtListItem> cons = parseCaseBody();
                    Span span = ctx.spanFrom(clause.start());
                    if (hasDefault) {
                        // Kept as a case with an invalid test so the switch still has one default
                        ctx.report(DiagnosticKind.DUPLICATE_DEFAULT, clause.span(), "'case'", clause.describe());
                        InvalidExpr placeholder = new InvalidExpr(Span.empty(clause.end()), null);
                        cases.add(new Case(span, false, clause.whitespace(), placeholder, colon, cons));
                    } else {
                        hasDefault = true;
                        cases.add(new Case(span, true, clause.whitespace(), null, colon, cons));
                    }

                } else {
                    ctx.report(DiagnosticKind.UNEXPECTED_TOKEN, clause.span(), "'case' or 'default'", clause.describe());
                    skipToCaseClause();
                }
            }
        } finally {
            ctx.switchDepth--;
        }

        LiteralWhitespace closeBrace = ctx.expect(TokenType.RBRACE);
        return new SwitchStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), openParen, test, closeParen,
            openBrace, cases, closeBrace);
    }

    private List<StmtListItem> parseCaseBody() {
        return parseStatementList(TokenType.CASE, TokenType.DEFAULT, TokenType.RBRACE);
    }

    /**
     * Discard tokens in a switch body up to the next clause or the closing brace.
     */
    private void skipToCaseClause() {
        int depth = 0;
        do {
            TokenType type = ctx.advance().type();
            if (type == TokenType.LBRACE) {
                depth++;
            } else if (type == TokenType.RBRACE) {
                depth--;
            }
        } while (!ctx.isAtEnd()
            && !(depth <= 0 && (ctx.check(TokenType.CASE) || ctx.check(TokenType.DEFAULT) || ctx.check(TokenType.RBRACE))));
    }

    private WhileStmt parseWhileStatement() {
        Token keyword = ctx.advance();
        LiteralWhitespace openParen = ctx.expect(TokenType.LPAREN);
        Expr condition = ctx.expressions.parseExpression(false);
        LiteralWhitespace closeParen = ctx.expect(TokenType.RPAREN);
        Stmt cons = parseLoopBody();
        return new WhileStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), openParen, condition, closeParen, cons);
    }

    private DoWhileStmt parseDoWhileStatement() {
        Token keyword = ctx.advance();
        Stmt cons = parseLoopBody();

        LiteralWhitespace whileWhitespace = ctx.expect(TokenType.WHILE);
        LiteralWhitespace openParen = ctx.expect(TokenType.LPAREN);
        Expr condition = ctx.expressions.parseExpression(false);
        LiteralWhitespace closeParen = ctx.expect(TokenType.RPAREN);

        // The statement ends after ')' even when more follows on the same line
        Semicolon semi = ctx.check(TokenType.SEMICOLON)
            ? new Semicolon.Explicit(ctx.advance().whitespace())
            : Semicolon.IMPLICIT;

        return new DoWhileStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), cons, whileWhitespace,
            openParen, condition, closeParen, semi);
    }

    private Stmt parseForStatement() {
        Token keyword = ctx.advance();
        LiteralWhitespace openParen = ctx.expect(TokenType.LPAREN);

        ForStmtInit init = null;
        if (ctx.check(TokenType.VAR) || ctx.check(TokenType.CONST) || startsLetDeclaration()) {
            init = parseForDeclaration();
        } else if (!ctx.check(TokenType.SEMICOLON)) {
            init = ctx.expressions.parseExpression(true);
        }

        if (init != null && ctx.check(TokenType.IN)) {
            LiteralWhitespace inWhitespace = ctx.advance().whitespace();
            Expr right = ctx.expressions.parseExpression(false);
            LiteralWhitespace closeParen = ctx.expect(TokenType.RPAREN);
            Stmt body = parseLoopBody();
            return new ForInStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), openParen, init, inWhitespace,
                right, closeParen, body);
        }

        LiteralWhitespace initSemicolon = ctx.expect(TokenType.SEMICOLON);
        Expr test = ctx.check(TokenType.SEMICOLON) ? null : ctx.expressions.parseExpression(false);
        LiteralWhitespace testSemicolon = ctx.expect(TokenType.SEMICOLON);
        Expr update = ctx.check(TokenType.RPAREN) ? null : ctx.expressions.parseExpression(false);
        LiteralWhitespace closeParen = ctx.expect(TokenType.RPAREN);
        Stmt body = parseLoopBody();

        return new ForStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), openParen, init, initSemicolon,
            test, testSemicolon, update, closeParen, body);
    }

    private Stmt parseLoopBody() {
        ctx.loopDepth++;
        try {
            return parseSubStatement();
        } finally {
            ctx.loopDepth--;
        }
    }

    private LabelledStmt parseLabelledStatement(LiteralExpr label) {
        LiteralWhitespace colon = ctx.advance().whitespace();

        TokenType next = ctx.peek().type();
        boolean iteration = next == TokenType.FOR || next == TokenType.WHILE || next == TokenType.DO;

        Boolean shadowed = ctx.labels.put(label.raw(), iteration);
        try {
            Stmt body = parseSubStatement();
            return new LabelledStmt(ctx.spanFrom(label.span().start()), label, colon, body);
        } finally {
            if (shadowed == null) {
                ctx.labels.remove(label.raw());
            } else {
                ctx.labels.put(label.raw(), shadowed);
            }
        }
    }

    private TryStmt parseTryStatement() {
        Token keyword = ctx.advance();
        BlockStmt test = parseBlock();

        CatchClause handler = null;
        if (ctx.check(TokenType.CATCH)) {
            Token catchToken = ctx.advance();
            LiteralWhitespace openParen = null;
            LiteralExpr param = null;
            LiteralWhitespace closeParen = null;
            // Optional catch binding: catch { ... }
            if (ctx.check(TokenType.LPAREN)) {
                openParen = ctx.advance().whitespace();
                param = ctx.expressions.bindingIdentifier();
                closeParen = ctx.expect(TokenType.RPAREN);
            }
            BlockStmt body = parseBlock();
            handler = new CatchClause(ctx.spanFrom(catchToken.start()), catchToken.whitespace(), openParen, param,
                closeParen, body);
        }

        LiteralWhitespace finalWhitespace = null;
        BlockStmt finalizer = null;
        if (ctx.check(TokenType.FINALLY)) {
            finalWhitespace = ctx.advance().whitespace();
            finalizer = parseBlock();
        }

        if (handler == null && finalizer == null) {
            Token found = ctx.peek();
            ctx.report(DiagnosticKind.MISSING_CATCH_OR_FINALLY, found.span(), "'catch' or 'finally'", found.describe());
        }

        return new TryStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), test, handler, finalWhitespace, finalizer);
    }

    private WithStmt parseWithStatement() {
        Token keyword = ctx.advance();
        if (ctx.options.strictMode()) {
            ctx.report(DiagnosticKind.STRICT_MODE_VIOLATION, keyword.span(), "statement", keyword.describe());
        }

        LiteralWhitespace openParen = ctx.expect(TokenType.LPAREN);
        Expr object = ctx.expressions.parseExpression(false);
        LiteralWhitespace closeParen = ctx.expect(TokenType.RPAREN);
        Stmt body = parseSubStatement();
        return new WithStmt(ctx.spanFrom(keyword.start()), keyword.whitespace(), openParen, object, closeParen, body);
    }

    // ========================================================================
    // ASI and recovery
    // ========================================================================

    /**
     * Terminate a statement: an explicit {@code ;}, or an implicit one before {@code }},
     * end of input or a line break. Anything else is an ASI violation; the statement
     * still ends here and the caller resynchronizes.
     */
    Semicolon consumeSemicolon() {
        if (ctx.check(TokenType.SEMICOLON)) {
            return new Semicolon.Explicit(ctx.advance().whitespace());
        }

        Token next = ctx.peek();
        if (next.type() == TokenType.RBRACE || next.type() == TokenType.EOF || next.lineBreakBefore()) {
            return Semicolon.IMPLICIT;
        }

        ctx.report(DiagnosticKind.ASI_VIOLATION, next.span(), TokenType.SEMICOLON.describe(), next.describe());
        ctx.resyncRequested = true;
        return Semicolon.IMPLICIT;
    }

    /**
     * Discard tokens until {@code ;} or a {@code }} at the current nesting level, a line
     * break, or a token that starts a statement. Discards at most
     * {@link ParserOptions#maxRecoverySkip()} tokens.
     */
    private void resynchronize() {
        ctx.resyncRequested = false;

        int limit = ctx.options.maxRecoverySkip();
        int from = ctx.peek().start();
        int skipped = 0;
        int depth = 0;

        while (!ctx.isAtEnd() && skipped < limit) {
            Token token = ctx.peek();
            if (depth == 0 && (token.type() == TokenType.SEMICOLON || token.type() == TokenType.RBRACE)) {
                break;
            }
            if (skipped > 0 && token.lineBreakBefore()) {
                break;
            }
            if (startsStatement(token.type())) {
                break;
            }

            if (token.type() == TokenType.LBRACE) {
                depth++;
            } else if (token.type() == TokenType.RBRACE) {
                depth--;
            }
            ctx.advance();
            skipped++;
        }

        logger.fine("Resynchronized at offset " + from + ", skipped " + skipped + " tokens");
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private boolean atAny(TokenType... types) {
        for (TokenType type : types) {
            if (ctx.check(type)) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@code let} starts a declaration only when a binding name follows it.
     */
    private boolean startsLetDeclaration() {
        return ctx.check(TokenType.LET) && ctx.checkAhead(1, TokenType.IDENTIFIER);
    }

    private static VarKind varKind(TokenType type) {
        return switch (type) {
            case LET -> VarKind.LET;
            case CONST -> VarKind.CONST;
            default -> VarKind.VAR;
        };
    }

    static boolean startsStatement(TokenType type) {
        return switch (type) {
            case VAR, CONST, IF, SWITCH, THROW, WHILE, DO, BREAK, CONTINUE,
                 RETURN, TRY, FOR, WITH, FUNCTION, DEBUGGER -> true;
            default -> false;
        };
    }

    private static boolean cannotStartStatement(TokenType type) {
        return switch (type) {
            case RBRACE, RPAREN, RBRACKET, CASE, DEFAULT, ELSE, CATCH, FINALLY -> true;
            default -> false;
        };
    }
}
