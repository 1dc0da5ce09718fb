package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code #if condition}
 */
public record IfDirectiveTrivia(
    SyntaxToken hashToken,
    SyntaxToken ifKeyword,
    ExpressionSyntax condition,
    SyntaxToken endOfDirectiveToken
) implements DirectiveTrivia {

    public IfDirectiveTrivia {
        Objects.requireNonNull(hashToken, "hashToken");
        Objects.requireNonNull(ifKeyword, "ifKeyword");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(endOfDirectiveToken, "endOfDirectiveToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.IF_DIRECTIVE_TRIVIA;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(hashToken, ifKeyword, condition, endOfDirectiveToken);
    }
}
