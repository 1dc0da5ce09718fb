package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code expression.name}.
 */
public record MemberAccessExpression(
    ExpressionSyntax expression,
    SyntaxToken dotToken,
    IdentifierName name
) implements ExpressionSyntax {

    public MemberAccessExpression {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(dotToken, "dotToken");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SIMPLE_MEMBER_ACCESS_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(expression, dotToken, name);
    }
}
