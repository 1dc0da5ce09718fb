package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code < constant}, {@code >= constant} and the like.
 */
public record RelationalPattern(SyntaxToken operatorToken, ExpressionSyntax expression) implements PatternSyntax {

    public RelationalPattern {
        Objects.requireNonNull(operatorToken, "operatorToken");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.RELATIONAL_PATTERN;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(operatorToken, expression);
    }
}
