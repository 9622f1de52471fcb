package com.jscst.cst;

public record EmptyStmt(
    Span span,
    LiteralWhitespace semiWhitespace
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.EMPTY;
    }
}
