package com.jscst.cst;

public record Declarator(
    Span span,
    LiteralExpr name,
    LiteralWhitespace initializerWhitespace,  // whitespace of the `=`, null without a value
    Expr value                                // Can be null
) implements Node {
    public Declarator {
        if ((initializerWhitespace == null) != (value == null)) {
            throw new IllegalArgumentException("Initializer whitespace must be present exactly when a value is");
        }
    }

    public Declarator(LiteralExpr name, LiteralWhitespace initializerWhitespace, Expr value) {
        this(new Span(name.span().start(), (value != null ? value.span() : name.span()).end()),
             name,
             initializerWhitespace,
             value);
    }
}
