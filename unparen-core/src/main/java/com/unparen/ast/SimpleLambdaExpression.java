package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code x => body}, where the body is an expression or a {@link Block}.
 */
public record SimpleLambdaExpression(
    SyntaxToken parameter,
    SyntaxToken arrowToken,
    SyntaxNode body
) implements ExpressionSyntax {

    public SimpleLambdaExpression {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(arrowToken, "arrowToken");
        Objects.requireNonNull(body, "body");
        if (!(body instanceof ExpressionSyntax) && !(body instanceof Block)) {
            throw new IllegalArgumentException("Lambda body must be an expression or a block: " + body.kind());
        }
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SIMPLE_LAMBDA_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(parameter, arrowToken, body);
    }
}
