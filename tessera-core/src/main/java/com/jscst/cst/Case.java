package com.jscst.cst;

import java.util.List;

/**
 * A {@code case test:} or {@code default:} clause of a switch.
 */
public record Case(
    Span span,
    boolean isDefault,
    LiteralWhitespace whitespace,       // of the `case` or `default` keyword
    Expr test,                          // null for the default case
    LiteralWhitespace colonWhitespace,
    List<StmtListItem> cons
) implements Node {
    public Case {
        if (isDefault != (test == null)) {
            throw new IllegalArgumentException("Only the default case has no test");
        }
        cons = List.copyOf(cons);
    }
}
