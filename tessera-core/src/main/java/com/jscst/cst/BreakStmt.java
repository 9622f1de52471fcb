package com.jscst.cst;

public record BreakStmt(
    Span span,
    LiteralWhitespace breakWhitespace,
    LiteralExpr label,  // Can be null
    Semicolon semi
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.BREAK;
    }
}
