package com.jscst.cst;

public record DoWhileStmt(
    Span span,
    LiteralWhitespace doWhitespace,
    Stmt cons,
    LiteralWhitespace whileWhitespace,
    LiteralWhitespace openParenWhitespace,
    Expr condition,
    LiteralWhitespace closeParenWhitespace,
    Semicolon semi
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.DO_WHILE;
    }
}
