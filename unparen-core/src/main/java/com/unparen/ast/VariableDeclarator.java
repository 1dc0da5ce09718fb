package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record VariableDeclarator(SyntaxToken identifier, EqualsValueClause initializer) implements SyntaxNode {

    public VariableDeclarator {
        Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.VARIABLE_DECLARATOR;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(identifier, initializer);
    }
}
