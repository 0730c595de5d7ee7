package com.txt2tex.json;

import com.txt2tex.ast.Node;

/**
 * Writes parse trees as JSON. Every object carries a {@code "type"} field naming
 * its node class, so documents and bare expressions can be told apart on read.
 */
public interface AstJsonSerializer {

    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)} with indentation, for dumps meant to be read.
     */
    String serializePretty(Node node) throws AstJsonException;
}
