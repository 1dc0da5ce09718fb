package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code expression is pattern}.
 */
public record IsPatternExpression(
    ExpressionSyntax expression,
    SyntaxToken isKeyword,
    PatternSyntax pattern
) implements ExpressionSyntax {

    public IsPatternExpression {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(isKeyword, "isKeyword");
        Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.IS_PATTERN_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(expression, isKeyword, pattern);
    }
}
