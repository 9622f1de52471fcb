package com.jscst.cst;

public record BinaryExpr(
    Span span,
    Expr left,
    BinaryOp op,
    LiteralWhitespace opWhitespace,
    Expr right
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.BINARY;
    }
}
