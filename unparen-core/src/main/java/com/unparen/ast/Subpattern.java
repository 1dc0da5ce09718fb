package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code Name: pattern} inside a property pattern clause.
 */
public record Subpattern(NameColon nameColon, PatternSyntax pattern) implements SyntaxNode {

    public Subpattern {
        Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SUBPATTERN;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(nameColon, pattern);
    }
}
