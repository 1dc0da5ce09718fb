package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record UsingStatement(
    SyntaxToken usingKeyword,
    SyntaxToken openParenToken,
    ExpressionSyntax expression,
    SyntaxToken closeParenToken,
    StatementSyntax statement
) implements StatementSyntax {

    public UsingStatement {
        Objects.requireNonNull(usingKeyword, "usingKeyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        Objects.requireNonNull(statement, "statement");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.USING_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(usingKeyword, openParenToken, expression, closeParenToken, statement);
    }
}
