package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code when (filterExpression)} on a catch clause.
 */
public record CatchFilterClause(
    SyntaxToken whenKeyword,
    SyntaxToken openParenToken,
    ExpressionSyntax filterExpression,
    SyntaxToken closeParenToken
) implements SyntaxNode {

    public CatchFilterClause {
        Objects.requireNonNull(whenKeyword, "whenKeyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(filterExpression, "filterExpression");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CATCH_FILTER_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(whenKeyword, openParenToken, filterExpression, closeParenToken);
    }
}
