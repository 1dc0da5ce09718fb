package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record WhileStatement(
    SyntaxToken whileKeyword,
    SyntaxToken openParenToken,
    ExpressionSyntax condition,
    SyntaxToken closeParenToken,
    StatementSyntax statement
) implements StatementSyntax {

    public WhileStatement {
        Objects.requireNonNull(whileKeyword, "whileKeyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        Objects.requireNonNull(statement, "statement");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.WHILE_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(whileKeyword, openParenToken, condition, closeParenToken, statement);
    }
}
