package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record WhenClause(SyntaxToken whenKeyword, ExpressionSyntax condition) implements SyntaxNode {

    public WhenClause {
        Objects.requireNonNull(whenKeyword, "whenKeyword");
        Objects.requireNonNull(condition, "condition");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.WHEN_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(whenKeyword, condition);
    }
}
