package com.unparen.ast;

/**
 * A parenthesized wrapper around exactly one expression or pattern. Either
 * delimiter may be a missing token when the source was incomplete.
 */
public sealed interface ParenthesizedNode extends SyntaxNode permits ParenthesizedExpression, ParenthesizedPattern {

    SyntaxToken openParenToken();

    SyntaxToken closeParenToken();

    /**
     * The wrapped expression or pattern.
     */
    SyntaxNode inner();

    default boolean hasMissingDelimiter() {
        return openParenToken().missing() || closeParenToken().missing();
    }
}
