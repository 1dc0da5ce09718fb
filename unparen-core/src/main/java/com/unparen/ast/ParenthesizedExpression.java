package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ParenthesizedExpression(
    SyntaxToken openParenToken,
    ExpressionSyntax expression,
    SyntaxToken closeParenToken
) implements ExpressionSyntax, ParenthesizedNode {

    public ParenthesizedExpression {
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
    }

    @Override
    public ExpressionSyntax inner() {
        return expression;
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.PARENTHESIZED_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openParenToken, expression, closeParenToken);
    }
}
