package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record IfStatement(
    SyntaxToken ifKeyword,
    SyntaxToken openParenToken,
    ExpressionSyntax condition,
    SyntaxToken closeParenToken,
    StatementSyntax statement,
    ElseClause elseClause
) implements StatementSyntax {

    public IfStatement {
        Objects.requireNonNull(ifKeyword, "ifKeyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        Objects.requireNonNull(statement, "statement");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.IF_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(ifKeyword, openParenToken, condition, closeParenToken, statement, elseClause);
    }
}
