package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ElementAccessExpression(
    ExpressionSyntax expression,
    BracketedArgumentList argumentList
) implements ExpressionSyntax {

    public ElementAccessExpression {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(argumentList, "argumentList");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ELEMENT_ACCESS_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(expression, argumentList);
    }
}
