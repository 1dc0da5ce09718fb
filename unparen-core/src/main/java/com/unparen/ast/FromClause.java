package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record FromClause(
    SyntaxToken fromKeyword,
    SyntaxToken identifier,
    SyntaxToken inKeyword,
    ExpressionSyntax expression
) implements QueryClause {

    public FromClause {
        Objects.requireNonNull(fromKeyword, "fromKeyword");
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(inKeyword, "inKeyword");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.FROM_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(fromKeyword, identifier, inKeyword, expression);
    }
}
