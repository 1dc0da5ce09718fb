package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code x++}, {@code x--} and {@code x!}.
 */
public record PostfixUnaryExpression(
    SyntaxKind kind,
    ExpressionSyntax operand,
    SyntaxToken operatorToken
) implements ExpressionSyntax {

    public PostfixUnaryExpression {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(operand, "operand");
        Objects.requireNonNull(operatorToken, "operatorToken");
        if (!kind.isPostfixUnaryExpression()) {
            throw new IllegalArgumentException("Not a postfix unary kind: " + kind);
        }
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(operand, operatorToken);
    }
}
