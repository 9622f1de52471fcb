package com.jscst.cst;

public sealed interface Stmt extends StmtListItem permits
    VarStmt,
    EmptyStmt,
    BlockStmt,
    ExprStmt,
    IfStmt,
    SwitchStmt,
    ThrowStmt,
    WhileStmt,
    DoWhileStmt,
    LabelledStmt,
    BreakStmt,
    ContinueStmt,
    ReturnStmt,
    TryStmt,
    ForStmt,
    ForInStmt,
    WithStmt {

    StmtKind kind();
}
