package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record VarPattern(SyntaxToken varKeyword, SyntaxToken designation) implements PatternSyntax {

    public VarPattern {
        Objects.requireNonNull(varKeyword, "varKeyword");
        Objects.requireNonNull(designation, "designation");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.VAR_PATTERN;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(varKeyword, designation);
    }
}
