package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code for (declaration-or-initializers; condition; incrementors) statement}.
 * Only the condition slot is a bare expression context; initializers and
 * incrementors are statement expressions in a comma list.
 */
public record ForStatement(
    SyntaxToken forKeyword,
    SyntaxToken openParenToken,
    VariableDeclaration declaration,
    List<ExpressionSyntax> initializers,
    List<SyntaxToken> initializerSeparators,
    SyntaxToken firstSemicolonToken,
    ExpressionSyntax condition,
    SyntaxToken secondSemicolonToken,
    List<ExpressionSyntax> incrementors,
    List<SyntaxToken> incrementorSeparators,
    SyntaxToken closeParenToken,
    StatementSyntax statement
) implements StatementSyntax {

    public ForStatement {
        Objects.requireNonNull(forKeyword, "forKeyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        initializers = ChildList.nodes(initializers, initializerSeparators, "ForStatement initializers");
        initializerSeparators = ChildList.separators(initializerSeparators);
        Objects.requireNonNull(firstSemicolonToken, "firstSemicolonToken");
        Objects.requireNonNull(secondSemicolonToken, "secondSemicolonToken");
        incrementors = ChildList.nodes(incrementors, incrementorSeparators, "ForStatement incrementors");
        incrementorSeparators = ChildList.separators(incrementorSeparators);
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        Objects.requireNonNull(statement, "statement");
        if (declaration != null && !initializers.isEmpty()) {
            throw new IllegalArgumentException("ForStatement has both a declaration and initializers");
        }
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.FOR_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(forKeyword, openParenToken, declaration,
            ChildList.separated(initializers, initializerSeparators), firstSemicolonToken, condition,
            secondSemicolonToken, ChildList.separated(incrementors, incrementorSeparators), closeParenToken,
            statement);
    }
}
