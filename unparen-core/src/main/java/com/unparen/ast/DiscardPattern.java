package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record DiscardPattern(SyntaxToken underscoreToken) implements PatternSyntax {

    public DiscardPattern {
        Objects.requireNonNull(underscoreToken, "underscoreToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.DISCARD_PATTERN;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(underscoreToken);
    }
}
