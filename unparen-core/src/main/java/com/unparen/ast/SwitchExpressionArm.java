package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record SwitchExpressionArm(
    PatternSyntax pattern,
    WhenClause whenClause,
    SyntaxToken equalsGreaterThanToken,
    ExpressionSyntax expression
) implements SyntaxNode {

    public SwitchExpressionArm {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(equalsGreaterThanToken, "equalsGreaterThanToken");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SWITCH_EXPRESSION_ARM;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(pattern, whenClause, equalsGreaterThanToken, expression);
    }
}
