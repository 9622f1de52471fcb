package com.jscst.cst;

public record ReturnStmt(
    Span span,
    LiteralWhitespace returnWhitespace,
    Expr value,  // Can be null
    Semicolon semi
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.RETURN;
    }
}
