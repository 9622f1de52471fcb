package com.jscst.json;

import com.jscst.cst.Node;
import com.jscst.cst.Script;

/**
 * Reads concrete syntax trees written by a {@link CstJsonSerializer}.
 */
public interface CstJsonDeserializer {

    /**
     * @throws CstJsonException if {@code json} is not a serialized script
     */
    Script deserializeScript(String json) throws CstJsonException;

    /**
     * Reads a node of a known type, e.g. a single statement or expression.
     *
     * @param json the serialized node
     * @param type the node type, or one of the sum types such as {@code Stmt.class}
     * @param <T>  the node type
     * @throws CstJsonException if {@code json} does not hold a node of {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws CstJsonException;
}
