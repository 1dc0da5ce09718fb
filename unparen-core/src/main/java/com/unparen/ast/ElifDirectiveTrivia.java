package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code #elif condition}
 */
public record ElifDirectiveTrivia(
    SyntaxToken hashToken,
    SyntaxToken elifKeyword,
    ExpressionSyntax condition,
    SyntaxToken endOfDirectiveToken
) implements DirectiveTrivia {

    public ElifDirectiveTrivia {
        Objects.requireNonNull(hashToken, "hashToken");
        Objects.requireNonNull(elifKeyword, "elifKeyword");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(endOfDirectiveToken, "endOfDirectiveToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ELIF_DIRECTIVE_TRIVIA;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(hashToken, elifKeyword, condition, endOfDirectiveToken);
    }
}
