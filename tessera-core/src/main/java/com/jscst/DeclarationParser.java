package com.jscst;

import com.jscst.cst.BlockStmt;
import com.jscst.cst.FunctionDecl;
import com.jscst.cst.FunctionExpr;
import com.jscst.cst.LiteralExpr;
import com.jscst.cst.LiteralWhitespace;
import com.jscst.cst.Parameters;
import com.jscst.cst.Span;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses function declarations and function expressions, which share their parameter
 * list and body grammar.
 */
final class DeclarationParser {

    private final ParseContext ctx;

    DeclarationParser(ParseContext ctx) {
        this.ctx = ctx;
    }

    FunctionDecl parseFunctionDeclaration() {
        Token keyword = ctx.advance();
        LiteralExpr name = ctx.expressions.bindingIdentifier();
        Parameters params = parseParameters();
        BlockStmt body = parseFunctionBody();
        return new FunctionDecl(ctx.spanFrom(keyword.start()), keyword.whitespace(), name, params, body);
    }

    FunctionExpr parseFunctionExpression() {
        Token keyword = ctx.advance();
        LiteralExpr name = null;
        if (ctx.check(TokenType.IDENTIFIER)) {
            name = ctx.expressions.identifier(ctx.advance());
        }
        Parameters params = parseParameters();
        BlockStmt body = parseFunctionBody();
        return new FunctionExpr(ctx.spanFrom(keyword.start()), keyword.whitespace(), name, params, body);
    }

    private Parameters parseParameters() {
        if (!ctx.check(TokenType.LPAREN)) {
            ctx.reportExpected(TokenType.LPAREN.describe());
            LiteralWhitespace missing = LiteralWhitespace.empty(ctx.lastEnd());
            return new Parameters(Span.empty(ctx.lastEnd()), missing, List.of(), List.of(), missing);
        }

        Token open = ctx.advance();
        List<LiteralExpr> params = new ArrayList<>();
        List<LiteralWhitespace> commas = new ArrayList<>();

        while (!ctx.check(TokenType.RPAREN) && !ctx.isAtEnd()) {
            params.add(ctx.expressions.bindingIdentifier());
            if (!ctx.check(TokenType.COMMA)) {
                break;
            }
            commas.add(ctx.advance().whitespace());
        }

        LiteralWhitespace close = ctx.expect(TokenType.RPAREN);
        return new Parameters(ctx.spanFrom(open.start()), open.whitespace(), params, commas, close);
    }

    /**
     * A function body starts a new context: {@code return} becomes legal and enclosing
     * loops, switches and labels are no longer targets.
     */
    private BlockStmt parseFunctionBody() {
        if (!ctx.enterNesting()) {
            return ctx.statements.emptyBlock();
        }
        int savedLoopDepth = ctx.loopDepth;
        int savedSwitchDepth = ctx.switchDepth;
        Map<String, Boolean> savedLabels = ctx.labels;

        ctx.functionDepth++;
        ctx.loopDepth = 0;
        ctx.switchDepth = 0;
        ctx.labels = new HashMap<>();
        try {
            return ctx.statements.parseBlock();
        } finally {
            ctx.functionDepth--;
            ctx.loopDepth = savedLoopDepth;
            ctx.switchDepth = savedSwitchDepth;
            ctx.labels = savedLabels;
            ctx.exitNesting();
        }
    }
}
