package com.jscst.json;

/**
 * Unchecked failure while converting a tree to or from JSON.
 */
public class CstJsonException extends RuntimeException {

    public CstJsonException(String message) {
        super(message);
    }

    public CstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
