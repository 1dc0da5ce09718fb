package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ThisExpression(SyntaxToken token) implements ExpressionSyntax {

    public ThisExpression {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.THIS_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(token);
    }
}
