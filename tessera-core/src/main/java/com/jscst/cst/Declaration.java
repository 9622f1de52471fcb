package com.jscst.cst;

public sealed interface Declaration extends StmtListItem permits FunctionDecl {
}
