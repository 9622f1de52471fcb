package com.jscst.cst;

import java.util.List;

/**
 * Root of a parsed source unit.
 */
public record Script(
    Span span,
    List<StmtListItem> items,
    LiteralWhitespace eofWhitespace  // leading trivia of the end of input
) implements Node {
    public Script {
        items = List.copyOf(items);
    }
}
