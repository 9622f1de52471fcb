package com.jscst.cst;

public record IfStmt(
    Span span,
    LiteralWhitespace ifWhitespace,
    LiteralWhitespace openParenWhitespace,
    Expr condition,
    LiteralWhitespace closeParenWhitespace,
    Stmt cons,
    LiteralWhitespace elseWhitespace,  // Can be null
    Stmt alt                           // Can be null
) implements Stmt {
    public IfStmt {
        if ((elseWhitespace == null) != (alt == null)) {
            throw new IllegalArgumentException("An else branch needs both its keyword and its statement");
        }
    }

    @Override
    public StmtKind kind() {
        return StmtKind.IF;
    }
}
