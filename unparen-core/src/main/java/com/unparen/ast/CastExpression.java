package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code (T)expression}.
 */
public record CastExpression(
    SyntaxToken openParenToken,
    TypeSyntax type,
    SyntaxToken closeParenToken,
    ExpressionSyntax expression
) implements ExpressionSyntax {

    public CastExpression {
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CAST_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openParenToken, type, closeParenToken, expression);
    }
}
