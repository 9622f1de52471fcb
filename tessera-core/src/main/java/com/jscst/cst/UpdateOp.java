package com.jscst.cst;

public enum UpdateOp {
    INCREMENT("++"),
    DECREMENT("--");

    private final String text;

    UpdateOp(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
