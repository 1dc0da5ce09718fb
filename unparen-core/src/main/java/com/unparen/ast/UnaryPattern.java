package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code not pattern}.
 */
public record UnaryPattern(SyntaxToken operatorToken, PatternSyntax pattern) implements PatternSyntax {

    public UnaryPattern {
        Objects.requireNonNull(operatorToken, "operatorToken");
        Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.NOT_PATTERN;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(operatorToken, pattern);
    }
}
