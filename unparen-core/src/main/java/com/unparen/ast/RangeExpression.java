package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code a..b}; either operand may be absent.
 */
public record RangeExpression(
    ExpressionSyntax leftOperand,
    SyntaxToken operatorToken,
    ExpressionSyntax rightOperand
) implements ExpressionSyntax {

    public RangeExpression {
        Objects.requireNonNull(operatorToken, "operatorToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.RANGE_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(leftOperand, operatorToken, rightOperand);
    }
}
