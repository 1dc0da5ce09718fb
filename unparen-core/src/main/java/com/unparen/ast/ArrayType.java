package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ArrayType(
    TypeSyntax elementType,
    SyntaxToken openBracketToken,
    SyntaxToken closeBracketToken
) implements TypeSyntax {

    public ArrayType {
        Objects.requireNonNull(elementType, "elementType");
        Objects.requireNonNull(openBracketToken, "openBracketToken");
        Objects.requireNonNull(closeBracketToken, "closeBracketToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ARRAY_TYPE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(elementType, openBracketToken, closeBracketToken);
    }
}
