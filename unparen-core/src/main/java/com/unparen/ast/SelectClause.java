package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record SelectClause(SyntaxToken selectKeyword, ExpressionSyntax expression) implements SyntaxNode {

    public SelectClause {
        Objects.requireNonNull(selectKeyword, "selectKeyword");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SELECT_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(selectKeyword, expression);
    }
}
