package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code = value} in a variable declarator.
 */
public record EqualsValueClause(SyntaxToken equalsToken, ExpressionSyntax value) implements SyntaxNode {

    public EqualsValueClause {
        Objects.requireNonNull(equalsToken, "equalsToken");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.EQUALS_VALUE_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(equalsToken, value);
    }
}
