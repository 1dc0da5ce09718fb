package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record SwitchStatement(
    SyntaxToken switchKeyword,
    SyntaxToken openParenToken,
    ExpressionSyntax expression,
    SyntaxToken closeParenToken,
    SyntaxToken openBraceToken,
    List<SwitchSection> sections,
    SyntaxToken closeBraceToken
) implements StatementSyntax {

    public SwitchStatement {
        Objects.requireNonNull(switchKeyword, "switchKeyword");
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
        Objects.requireNonNull(openBraceToken, "openBraceToken");
        sections = ChildList.copy(sections);
        Objects.requireNonNull(closeBraceToken, "closeBraceToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SWITCH_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(switchKeyword, openParenToken, expression, closeParenToken, openBraceToken, sections,
            closeBraceToken);
    }
}
