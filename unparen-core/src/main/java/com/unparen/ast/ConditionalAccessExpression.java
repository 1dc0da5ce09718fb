package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code expression?.whenNotNull}; the right side starts with a member binding.
 */
public record ConditionalAccessExpression(
    ExpressionSyntax expression,
    SyntaxToken questionToken,
    ExpressionSyntax whenNotNull
) implements ExpressionSyntax {

    public ConditionalAccessExpression {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(questionToken, "questionToken");
        Objects.requireNonNull(whenNotNull, "whenNotNull");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CONDITIONAL_ACCESS_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(expression, questionToken, whenNotNull);
    }
}
