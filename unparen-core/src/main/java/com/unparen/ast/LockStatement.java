package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record LockStatement(
    SyntaxToken lockKeyword,
    SyntaxToken openParenToken,
    ExpressionSyntax expression,
    SyntaxToken closeParenToken,
    StatementSyntax statement
) implements StatementSyntax {

    public LockStatement {
        Objects.requireNonNull(lockKeyword, "lockKeyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        Objects.requireNonNull(statement, "statement");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.LOCK_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(lockKeyword, openParenToken, expression, closeParenToken, statement);
    }
}
