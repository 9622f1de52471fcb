package com.jscst.cst;

public record ContinueStmt(
    Span span,
    LiteralWhitespace continueWhitespace,
    LiteralExpr label,  // Can be null
    Semicolon semi
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.CONTINUE;
    }
}
