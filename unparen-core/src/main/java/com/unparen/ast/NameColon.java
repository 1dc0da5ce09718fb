package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record NameColon(IdentifierName name, SyntaxToken colonToken) implements SyntaxNode {

    public NameColon {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(colonToken, "colonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.NAME_COLON;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(name, colonToken);
    }
}
