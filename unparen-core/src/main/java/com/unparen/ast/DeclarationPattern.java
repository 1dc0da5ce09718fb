package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code T name}.
 */
public record DeclarationPattern(TypeSyntax type, SyntaxToken designation) implements PatternSyntax {

    public DeclarationPattern {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(designation, "designation");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.DECLARATION_PATTERN;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(type, designation);
    }
}
