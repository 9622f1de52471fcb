package com.jscst.cst;

public record WhileStmt(
    Span span,
    LiteralWhitespace whileWhitespace,
    LiteralWhitespace openParenWhitespace,
    Expr condition,
    LiteralWhitespace closeParenWhitespace,
    Stmt cons
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.WHILE;
    }
}
