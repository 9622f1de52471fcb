package com.jscst.cst;

public record WithStmt(
    Span span,
    LiteralWhitespace withWhitespace,
    LiteralWhitespace openParenWhitespace,
    Expr object,
    LiteralWhitespace closeParenWhitespace,
    Stmt body
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.WITH;
    }
}
