package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record InvocationExpression(ExpressionSyntax expression, ArgumentList argumentList) implements ExpressionSyntax {

    public InvocationExpression {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(argumentList, "argumentList");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.INVOCATION_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(expression, argumentList);
    }
}
