package com.jscst.cst;

public enum UnaryOp {
    NOT("!"),
    BIT_NOT("~"),
    PLUS("+"),
    MINUS("-"),
    TYPEOF("typeof"),
    VOID("void"),
    DELETE("delete");

    private final String text;

    UnaryOp(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
