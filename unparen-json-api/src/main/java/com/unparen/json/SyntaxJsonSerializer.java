package com.unparen.json;

import com.unparen.ast.SyntaxNode;

/**
 * Writes syntax nodes as JSON.
 */
public interface SyntaxJsonSerializer {

    /**
     * Serializes a syntax node and everything below it.
     *
     * @param node the node to serialize
     * @return the compact JSON form of the node
     * @throws SyntaxJsonException if serialization fails
     */
    String serialize(SyntaxNode node) throws SyntaxJsonException;

    /**
     * Serializes a syntax node as indented JSON.
     *
     * @param node the node to serialize
     * @return the pretty-printed JSON form of the node
     * @throws SyntaxJsonException if serialization fails
     */
    String serializePretty(SyntaxNode node) throws SyntaxJsonException;
}
