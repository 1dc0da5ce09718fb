package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record TypePattern(TypeSyntax type) implements PatternSyntax {

    public TypePattern {
        Objects.requireNonNull(type, "type");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.TYPE_PATTERN;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(type);
    }
}
