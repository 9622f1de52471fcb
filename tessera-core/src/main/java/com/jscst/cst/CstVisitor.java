package com.jscst.cst;

/**
 * Receives the direct parts of one node in source order, see
 * {@link CstWalker#forEachInOrder(Node, CstVisitor)}.
 */
public interface CstVisitor {

    /**
     * A significant token owned by the node itself, with its trivia.
     */
    default void token(LiteralWhitespace whitespace) {
    }

    /**
     * A direct child node. The walker does not descend into it.
     */
    default void child(Node node) {
    }
}
