package com.jscst.cst;

import java.util.List;

public record SwitchStmt(
    Span span,
    LiteralWhitespace switchWhitespace,
    LiteralWhitespace openParenWhitespace,
    Expr test,
    LiteralWhitespace closeParenWhitespace,
    LiteralWhitespace openBraceWhitespace,
    List<Case> cases,
    LiteralWhitespace closeBraceWhitespace
) implements Stmt {
    public SwitchStmt {
        cases = List.copyOf(cases);
        if (cases.stream().filter(Case::isDefault).count() > 1) {
            throw new IllegalArgumentException("A switch has at most one default case");
        }
    }

    @Override
    public StmtKind kind() {
        return StmtKind.SWITCH;
    }
}
