package com.unparen.json;

import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxTree;

/**
 * Reads syntax nodes from JSON.
 */
public interface SyntaxJsonDeserializer {

    /**
     * Deserializes a node of any syntax, as named by its {@code "syntax"} property.
     *
     * @param json the JSON text
     * @return the deserialized node
     * @throws SyntaxJsonException if the text is not a valid syntax node
     */
    SyntaxNode deserialize(String json) throws SyntaxJsonException;

    /**
     * Deserializes a node of an expected type.
     *
     * @param json the JSON text
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws SyntaxJsonException if the text is not a valid node of that type
     */
    <T extends SyntaxNode> T deserialize(String json, Class<T> type) throws SyntaxJsonException;

    /**
     * Deserializes a node and indexes it as the root of a {@link SyntaxTree}.
     *
     * @param json the JSON text
     * @return a tree rooted at the deserialized node
     * @throws SyntaxJsonException if the text is not a valid syntax node
     */
    default SyntaxTree deserializeTree(String json) throws SyntaxJsonException {
        SyntaxNode root = deserialize(json);
        try {
            return SyntaxTree.of(root);
        } catch (IllegalArgumentException e) {
            throw new SyntaxJsonException("Deserialized node is not a valid tree", e);
        }
    }
}
