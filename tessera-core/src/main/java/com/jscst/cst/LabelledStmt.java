package com.jscst.cst;

public record LabelledStmt(
    Span span,
    LiteralExpr label,
    LiteralWhitespace colonWhitespace,
    Stmt body
) implements Stmt {
    @Override
    public StmtKind kind() {
        return StmtKind.LABELLED;
    }
}
