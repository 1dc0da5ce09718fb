package com.unparen.ast;

/**
 * A node or a token of a syntax tree.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {
}
