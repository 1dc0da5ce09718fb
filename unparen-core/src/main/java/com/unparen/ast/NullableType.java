package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record NullableType(TypeSyntax elementType, SyntaxToken questionToken) implements TypeSyntax {

    public NullableType {
        Objects.requireNonNull(elementType, "elementType");
        Objects.requireNonNull(questionToken, "questionToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.NULLABLE_TYPE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(elementType, questionToken);
    }
}
