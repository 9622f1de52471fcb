package com.jscst.cst;

public record UpdateExpr(
    Span span,
    boolean prefix,
    UpdateOp op,
    LiteralWhitespace opWhitespace,
    Expr object
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.UPDATE;
    }
}
