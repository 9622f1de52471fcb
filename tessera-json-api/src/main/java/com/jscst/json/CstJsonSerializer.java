package com.jscst.json;

import com.jscst.ParseResult;
import com.jscst.cst.Node;

/**
 * Writes concrete syntax trees as JSON. Every polymorphic node carries a {@code "type"}
 * property naming its record, so the output can be read back by a {@link CstJsonDeserializer}.
 */
public interface CstJsonSerializer {

    /**
     * @throws CstJsonException if the node cannot be written
     */
    String serialize(Node node) throws CstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented for reading.
     *
     * @throws CstJsonException if the node cannot be written
     */
    String serializePretty(Node node) throws CstJsonException;

    /**
     * Writes a whole parse result: the script together with its diagnostics.
     *
     * @throws CstJsonException if the result cannot be written
     */
    String serialize(ParseResult result, boolean pretty) throws CstJsonException;
}
