package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code => expression} as the body of an expression-bodied member.
 */
public record ArrowExpressionClause(SyntaxToken arrowToken, ExpressionSyntax expression) implements SyntaxNode {

    public ArrowExpressionClause {
        Objects.requireNonNull(arrowToken, "arrowToken");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ARROW_EXPRESSION_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(arrowToken, expression);
    }
}
