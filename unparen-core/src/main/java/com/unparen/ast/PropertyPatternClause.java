package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record PropertyPatternClause(
    SyntaxToken openBraceToken,
    List<Subpattern> subpatterns,
    List<SyntaxToken> separators,
    SyntaxToken closeBraceToken
) implements SyntaxNode {

    public PropertyPatternClause {
        Objects.requireNonNull(openBraceToken, "openBraceToken");
        subpatterns = ChildList.nodes(subpatterns, separators, "PropertyPatternClause");
        separators = ChildList.separators(separators);
        Objects.requireNonNull(closeBraceToken, "closeBraceToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.PROPERTY_PATTERN_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openBraceToken, ChildList.separated(subpatterns, separators), closeBraceToken);
    }
}
