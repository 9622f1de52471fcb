package com.jscst.cst;

public record NewExpr(
    Span span,
    LiteralWhitespace newWhitespace,
    Expr target,
    Arguments arguments  // null for `new Foo`
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.NEW;
    }
}
