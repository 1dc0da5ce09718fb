package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record RefExpression(SyntaxToken refKeyword, ExpressionSyntax expression) implements ExpressionSyntax {

    public RefExpression {
        Objects.requireNonNull(refKeyword, "refKeyword");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.REF_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(refKeyword, expression);
    }
}
