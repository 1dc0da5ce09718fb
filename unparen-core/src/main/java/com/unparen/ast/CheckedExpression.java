package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code checked(expression)} or {@code unchecked(expression)}.
 */
public record CheckedExpression(
    SyntaxKind kind,
    SyntaxToken keyword,
    SyntaxToken openParenToken,
    ExpressionSyntax expression,
    SyntaxToken closeParenToken
) implements ExpressionSyntax {

    public CheckedExpression {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(keyword, "keyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        if (!kind.isChecked()) {
            throw new IllegalArgumentException("Not a checked kind: " + kind);
        }
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(keyword, openParenToken, expression, closeParenToken);
    }
}
