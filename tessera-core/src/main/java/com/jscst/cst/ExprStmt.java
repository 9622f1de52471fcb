package com.jscst.cst;

public record ExprStmt(
    Span span,
    Expr expr,
    Semicolon semi
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.EXPR;
    }
}
