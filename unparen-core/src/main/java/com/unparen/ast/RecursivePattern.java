package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code T { A: p, B: q } name}; the type and the designation are optional.
 */
public record RecursivePattern(
    TypeSyntax type,
    PropertyPatternClause propertyPatternClause,
    SyntaxToken designation
) implements PatternSyntax {

    public RecursivePattern {
        Objects.requireNonNull(propertyPatternClause, "propertyPatternClause");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.RECURSIVE_PATTERN;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(type, propertyPatternClause, designation);
    }
}
