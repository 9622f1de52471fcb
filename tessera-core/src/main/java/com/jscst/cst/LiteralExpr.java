package com.jscst.cst;

/**
 * A single-token expression: identifier, keyword literal, number, string, regex or template.
 */
public record LiteralExpr(
    Span span,
    LiteralKind literalKind,
    String raw,
    LiteralWhitespace whitespace
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.LITERAL;
    }
}
