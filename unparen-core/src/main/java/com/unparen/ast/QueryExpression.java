package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code from x in source where cond select value}: a leading {@code from}, any
 * number of body clauses, and a final {@code select}.
 */
public record QueryExpression(
    FromClause fromClause,
    List<QueryClause> clauses,
    SelectClause selectClause
) implements ExpressionSyntax {

    public QueryExpression {
        Objects.requireNonNull(fromClause, "fromClause");
        clauses = ChildList.copy(clauses);
        Objects.requireNonNull(selectClause, "selectClause");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.QUERY_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(fromClause, clauses, selectClause);
    }
}
