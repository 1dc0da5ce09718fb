package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code +x}, {@code -x}, {@code ~x}, {@code !x}, {@code ++x}, {@code --x},
 * {@code &x}, {@code *x} and {@code ^x}.
 */
public record PrefixUnaryExpression(
    SyntaxKind kind,
    SyntaxToken operatorToken,
    ExpressionSyntax operand
) implements ExpressionSyntax {

    public PrefixUnaryExpression {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(operatorToken, "operatorToken");
        Objects.requireNonNull(operand, "operand");
        if (!kind.isPrefixUnaryExpression()) {
            throw new IllegalArgumentException("Not a prefix unary kind: " + kind);
        }
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(operatorToken, operand);
    }
}
