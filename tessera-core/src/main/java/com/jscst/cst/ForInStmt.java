package com.jscst.cst;

public record ForInStmt(
    Span span,
    LiteralWhitespace forWhitespace,
    LiteralWhitespace openParenWhitespace,
    ForStmtInit left,
    LiteralWhitespace inWhitespace,
    Expr right,
    LiteralWhitespace closeParenWhitespace,
    Stmt body
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.FOR_IN;
    }
}
