package com.jscst.cst;

public record CallExpr(
    Span span,
    Expr callee,
    Arguments arguments
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.CALL;
    }
}
