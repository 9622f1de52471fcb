package com.jscst.cst;

public record ThrowStmt(
    Span span,
    LiteralWhitespace throwWhitespace,
    Expr arg,
    Semicolon semi
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.THROW;
    }
}
