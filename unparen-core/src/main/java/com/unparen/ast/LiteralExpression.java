package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record LiteralExpression(SyntaxKind kind, SyntaxToken token) implements ExpressionSyntax {

    public LiteralExpression {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(token, "token");
        if (!kind.isLiteral()) {
            throw new IllegalArgumentException("Not a literal kind: " + kind);
        }
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(token);
    }
}
