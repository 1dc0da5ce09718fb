package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code $"text {hole} text"}.
 */
public record InterpolatedStringExpression(
    SyntaxToken stringStartToken,
    List<InterpolatedStringContent> contents,
    SyntaxToken stringEndToken
) implements ExpressionSyntax {

    public InterpolatedStringExpression {
        Objects.requireNonNull(stringStartToken, "stringStartToken");
        contents = ChildList.copy(contents);
        Objects.requireNonNull(stringEndToken, "stringEndToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.INTERPOLATED_STRING_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(stringStartToken, contents, stringEndToken);
    }
}
