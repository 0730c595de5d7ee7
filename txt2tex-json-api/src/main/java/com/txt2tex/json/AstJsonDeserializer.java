package com.txt2tex.json;

import com.txt2tex.ast.Document;
import com.txt2tex.ast.Node;
import com.txt2tex.ast.ParseResult;

/**
 * Reads JSON written by an {@link AstJsonSerializer} back into immutable nodes.
 */
public interface AstJsonDeserializer {

    /**
     * Reads the result of a top-level parse: either a {@link Document} or a bare
     * expression, chosen by the root object's {@code "type"}.
     */
    ParseResult deserializeResult(String json) throws AstJsonException;

    Document deserializeDocument(String json) throws AstJsonException;

    /**
     * Reads a single node of a known kind.
     *
     * @param json the JSON text
     * @param type the expected node class or sealed interface
     * @param <T> the node type
     * @return the node
     * @throws AstJsonException if the JSON is malformed or names another node type
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
