package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code condition ? whenTrue : whenFalse}.
 */
public record ConditionalExpression(
    ExpressionSyntax condition,
    SyntaxToken questionToken,
    ExpressionSyntax whenTrue,
    SyntaxToken colonToken,
    ExpressionSyntax whenFalse
) implements ExpressionSyntax {

    public ConditionalExpression {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(questionToken, "questionToken");
        Objects.requireNonNull(whenTrue, "whenTrue");
        Objects.requireNonNull(colonToken, "colonToken");
        Objects.requireNonNull(whenFalse, "whenFalse");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CONDITIONAL_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(condition, questionToken, whenTrue, colonToken, whenFalse);
    }
}
