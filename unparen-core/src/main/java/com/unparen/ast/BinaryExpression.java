package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * A binary operator application. {@code x is T} and {@code x as T} are binary
 * expressions whose right operand is a type.
 */
public record BinaryExpression(
    SyntaxKind kind,
    ExpressionSyntax left,
    SyntaxToken operatorToken,
    ExpressionSyntax right
) implements ExpressionSyntax {

    public BinaryExpression {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operatorToken, "operatorToken");
        Objects.requireNonNull(right, "right");
        if (!kind.isBinaryExpression()) {
            throw new IllegalArgumentException("Not a binary expression kind: " + kind);
        }
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(left, operatorToken, right);
    }
}
