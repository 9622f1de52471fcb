package com.jscst.cst;

public record ForStmt(
    Span span,
    LiteralWhitespace forWhitespace,
    LiteralWhitespace openParenWhitespace,
    ForStmtInit init,  // Can be null
    LiteralWhitespace initSemicolonWhitespace,
    Expr test,         // Can be null
    LiteralWhitespace testSemicolonWhitespace,
    Expr update,       // Can be null
    LiteralWhitespace closeParenWhitespace,
    Stmt body
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.FOR;
    }
}
