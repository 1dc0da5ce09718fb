package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ElseClause(SyntaxToken elseKeyword, StatementSyntax statement) implements SyntaxNode {

    public ElseClause {
        Objects.requireNonNull(elseKeyword, "elseKeyword");
        Objects.requireNonNull(statement, "statement");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ELSE_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(elseKeyword, statement);
    }
}
