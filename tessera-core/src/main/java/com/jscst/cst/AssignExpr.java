package com.jscst.cst;

public record AssignExpr(
    Span span,
    Expr target,
    AssignOp op,
    LiteralWhitespace opWhitespace,
    Expr value
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.ASSIGN;
    }
}
