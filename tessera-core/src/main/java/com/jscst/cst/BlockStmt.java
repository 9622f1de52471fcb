package com.jscst.cst;

import java.util.List;

public record BlockStmt(
    Span span,
    LiteralWhitespace openBraceWhitespace,
    List<StmtListItem> stmts,
    LiteralWhitespace closeBraceWhitespace
) implements Stmt {
    public BlockStmt {
        stmts = List.copyOf(stmts);
    }

    @Override
    public StmtKind kind() {
        return StmtKind.BLOCK;
    }
}
