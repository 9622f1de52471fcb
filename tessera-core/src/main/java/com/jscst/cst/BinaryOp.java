package com.jscst.cst;

/**
 * Binary and logical operators with their binding power; a higher power binds tighter.
 */
public enum BinaryOp {
    NULLISH("??", 4),
    OR("||", 5),
    AND("&&", 6),
    BIT_OR("|", 7),
    BIT_XOR("^", 8),
    BIT_AND("&", 9),
    EQ("==", 10),
    NOT_EQ("!=", 10),
    STRICT_EQ("===", 10),
    STRICT_NOT_EQ("!==", 10),
    LESS("<", 11),
    LESS_EQ("<=", 11),
    GREATER(">", 11),
    GREATER_EQ(">=", 11),
    IN("in", 11),
    INSTANCEOF("instanceof", 11),
    SHL("<<", 12),
    SHR(">>", 12),
    USHR(">>>", 12),
    ADD("+", 13),
    SUB("-", 13),
    MUL("*", 14),
    DIV("/", 14),
    MOD("%", 14),
    EXP("**", 15);

    private final String text;
    private final int bindingPower;

    BinaryOp(String text, int bindingPower) {
        this.text = text;
        this.bindingPower = bindingPower;
    }

    public String text() {
        return text;
    }

    public int bindingPower() {
        return bindingPower;
    }

    public boolean rightAssociative() {
        return this == EXP;
    }
}
