package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ParenthesizedPattern(
    SyntaxToken openParenToken,
    PatternSyntax pattern,
    SyntaxToken closeParenToken
) implements PatternSyntax, ParenthesizedNode {

    public ParenthesizedPattern {
        Objects.requireNonNull(openParenToken, "openParenToken");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(closeParenToken, "closeParenToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.PARENTHESIZED_PATTERN;
    }

    @Override
    public PatternSyntax inner() {
        return pattern;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openParenToken, pattern, closeParenToken);
    }
}
