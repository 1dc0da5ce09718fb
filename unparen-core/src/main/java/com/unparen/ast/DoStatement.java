package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record DoStatement(
    SyntaxToken doKeyword,
    StatementSyntax statement,
    SyntaxToken whileKeyword,
    SyntaxToken openParenToken,
    ExpressionSyntax condition,
    SyntaxToken closeParenToken,
    SyntaxToken semicolonToken
) implements StatementSyntax {

    public DoStatement {
        Objects.requireNonNull(doKeyword, "doKeyword");
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(whileKeyword, "whileKeyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        Objects.requireNonNull(semicolonToken, "semicolonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.DO_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(doKeyword, statement, whileKeyword, openParenToken, condition, closeParenToken,
            semicolonToken);
    }
}
