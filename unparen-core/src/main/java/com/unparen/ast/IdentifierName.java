package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record IdentifierName(SyntaxToken identifier) implements NameSyntax {

    public IdentifierName {
        Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.IDENTIFIER_NAME;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(identifier);
    }
}
