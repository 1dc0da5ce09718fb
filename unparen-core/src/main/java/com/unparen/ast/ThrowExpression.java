package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ThrowExpression(SyntaxToken throwKeyword, ExpressionSyntax expression) implements ExpressionSyntax {

    public ThrowExpression {
        Objects.requireNonNull(throwKeyword, "throwKeyword");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.THROW_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(throwKeyword, expression);
    }
}
