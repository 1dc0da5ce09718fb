package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * Simple and compound assignment, right-associative.
 */
public record AssignmentExpression(
    SyntaxKind kind,
    ExpressionSyntax left,
    SyntaxToken operatorToken,
    ExpressionSyntax right
) implements ExpressionSyntax {

    public AssignmentExpression {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operatorToken, "operatorToken");
        Objects.requireNonNull(right, "right");
        if (!kind.isAssignment()) {
            throw new IllegalArgumentException("Not an assignment kind: " + kind);
        }
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(left, operatorToken, right);
    }
}
