package com.jscst.cst;

/**
 * An entry of a statement list (program, block or case body): a declaration or a statement.
 */
public sealed interface StmtListItem extends Node permits Stmt, Declaration {
}
