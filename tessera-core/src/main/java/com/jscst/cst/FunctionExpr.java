package com.jscst.cst;

public record FunctionExpr(
    Span span,
    LiteralWhitespace functionWhitespace,
    LiteralExpr name,  // Can be null
    Parameters params,
    BlockStmt body
) implements Expr {
    @Override
    public ExprKind kind() {
        return ExprKind.FUNCTION;
    }
}
