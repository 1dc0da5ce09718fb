package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * A hole {@code {expression:format}} inside an interpolated string. The first
 * unparenthesized {@code :} in the hole starts the format clause.
 */
public record Interpolation(
    SyntaxToken openBraceToken,
    ExpressionSyntax expression,
    InterpolationFormatClause formatClause,
    SyntaxToken closeBraceToken
) implements InterpolatedStringContent {

    public Interpolation {
        Objects.requireNonNull(openBraceToken, "openBraceToken");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(closeBraceToken, "closeBraceToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.INTERPOLATION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openBraceToken, expression, formatClause, closeBraceToken);
    }
}
