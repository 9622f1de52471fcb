package com.jscst.cst;

public record GroupingExpr(
    Span span,
    LiteralWhitespace openParenWhitespace,
    Expr expr,
    LiteralWhitespace closeParenWhitespace
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.GROUPING;
    }
}
