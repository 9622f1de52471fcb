package com.jscst.cst;

public record UnaryExpr(
    Span span,
    UnaryOp op,
    LiteralWhitespace opWhitespace,
    Expr object
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.UNARY;
    }
}
