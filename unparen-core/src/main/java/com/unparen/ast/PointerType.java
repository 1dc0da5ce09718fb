package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record PointerType(TypeSyntax elementType, SyntaxToken asteriskToken) implements TypeSyntax {

    public PointerType {
        Objects.requireNonNull(elementType, "elementType");
        Objects.requireNonNull(asteriskToken, "asteriskToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.POINTER_TYPE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(elementType, asteriskToken);
    }
}
