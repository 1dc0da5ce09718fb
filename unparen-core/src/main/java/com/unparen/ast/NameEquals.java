package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record NameEquals(IdentifierName name, SyntaxToken equalsToken) implements SyntaxNode {

    public NameEquals {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(equalsToken, "equalsToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.NAME_EQUALS;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(name, equalsToken);
    }
}
