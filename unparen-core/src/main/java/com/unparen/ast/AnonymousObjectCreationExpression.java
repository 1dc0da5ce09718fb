package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code new { A = x, y }}.
 */
public record AnonymousObjectCreationExpression(
    SyntaxToken newKeyword,
    SyntaxToken openBraceToken,
    List<AnonymousObjectMemberDeclarator> initializers,
    List<SyntaxToken> separators,
    SyntaxToken closeBraceToken
) implements ExpressionSyntax {

    public AnonymousObjectCreationExpression {
        Objects.requireNonNull(newKeyword, "newKeyword");
        Objects.requireNonNull(openBraceToken, "openBraceToken");
        initializers = ChildList.nodes(initializers, separators, "AnonymousObjectCreationExpression");
        separators = ChildList.separators(separators);
        Objects.requireNonNull(closeBraceToken, "closeBraceToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ANONYMOUS_OBJECT_CREATION_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(newKeyword, openBraceToken, ChildList.separated(initializers, separators), closeBraceToken);
    }
}
