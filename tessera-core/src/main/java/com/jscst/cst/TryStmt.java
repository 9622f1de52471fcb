package com.jscst.cst;

public record TryStmt(
    Span span,
    LiteralWhitespace tryWhitespace,
    BlockStmt test,
    CatchClause handler,                // Can be null
    LiteralWhitespace finalWhitespace,  // whitespace of `finally`, null without a finalizer
    BlockStmt finalizer                 // Can be null
) implements Stmt {
    public TryStmt {
        if ((finalWhitespace == null) != (finalizer == null)) {
            throw new IllegalArgumentException("A finalizer needs both its keyword and its block");
        }
    }

    @Override
    public StmtKind kind() {
        return StmtKind.TRY;
    }
}
