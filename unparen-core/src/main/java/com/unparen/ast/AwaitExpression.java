package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record AwaitExpression(SyntaxToken awaitKeyword, ExpressionSyntax expression) implements ExpressionSyntax {

    public AwaitExpression {
        Objects.requireNonNull(awaitKeyword, "awaitKeyword");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.AWAIT_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(awaitKeyword, expression);
    }
}
