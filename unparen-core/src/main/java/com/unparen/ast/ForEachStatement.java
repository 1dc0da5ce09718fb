package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ForEachStatement(
    SyntaxToken forEachKeyword,
    SyntaxToken openParenToken,
    TypeSyntax type,
    SyntaxToken identifier,
    SyntaxToken inKeyword,
    ExpressionSyntax expression,
    SyntaxToken closeParenToken,
    StatementSyntax statement
) implements StatementSyntax {

    public ForEachStatement {
        Objects.requireNonNull(forEachKeyword, "forEachKeyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(inKeyword, "inKeyword");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        Objects.requireNonNull(statement, "statement");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.FOR_EACH_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(forEachKeyword, openParenToken, type, identifier, inKeyword, expression,
            closeParenToken, statement);
    }
}
