package com.jscst.cst;

import java.util.List;

public record VarStmt(
    Span span,
    VarKind declarationKind,
    LiteralWhitespace varWhitespace,
    List<Declarator> declared,
    List<LiteralWhitespace> commaWhitespaces,
    Semicolon semi
) implements Stmt, ForStmtInit {
    public VarStmt {
        declared = List.copyOf(declared);
        commaWhitespaces = List.copyOf(commaWhitespaces);
    }

    @Override
    public StmtKind kind() {
        return StmtKind.VARIABLE;
    }
}
