package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record WhereClause(SyntaxToken whereKeyword, ExpressionSyntax condition) implements QueryClause {

    public WhereClause {
        Objects.requireNonNull(whereKeyword, "whereKeyword");
        Objects.requireNonNull(condition, "condition");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.WHERE_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(whereKeyword, condition);
    }
}
