package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code x switch { pattern => value, ... }}.
 */
public record SwitchExpression(
    ExpressionSyntax governingExpression,
    SyntaxToken switchKeyword,
    SyntaxToken openBraceToken,
    List<SwitchExpressionArm> arms,
    List<SyntaxToken> separators,
    SyntaxToken closeBraceToken
) implements ExpressionSyntax {

    public SwitchExpression {
        Objects.requireNonNull(governingExpression, "governingExpression");
        Objects.requireNonNull(switchKeyword, "switchKeyword");
        Objects.requireNonNull(openBraceToken, "openBraceToken");
        arms = ChildList.nodes(arms, separators, "SwitchExpression");
        separators = ChildList.separators(separators);
        Objects.requireNonNull(closeBraceToken, "closeBraceToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SWITCH_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(governingExpression, switchKeyword, openBraceToken,
            ChildList.separated(arms, separators), closeBraceToken);
    }
}
