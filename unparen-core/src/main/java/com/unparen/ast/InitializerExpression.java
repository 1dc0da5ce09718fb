package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code { a, b, c }} as an array, object or collection initializer.
 */
public record InitializerExpression(
    SyntaxKind kind,
    SyntaxToken openBraceToken,
    List<ExpressionSyntax> expressions,
    List<SyntaxToken> separators,
    SyntaxToken closeBraceToken
) implements ExpressionSyntax {

    public InitializerExpression {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(openBraceToken, "openBraceToken");
        expressions = ChildList.nodes(expressions, separators, "InitializerExpression");
        separators = ChildList.separators(separators);
        Objects.requireNonNull(closeBraceToken, "closeBraceToken");
        if (!kind.isInitializer()) {
            throw new IllegalArgumentException("Not an initializer kind: " + kind);
        }
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openBraceToken, ChildList.separated(expressions, separators), closeBraceToken);
    }
}
