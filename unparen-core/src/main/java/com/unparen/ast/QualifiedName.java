package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code left.right} in a type position.
 */
public record QualifiedName(
    NameSyntax left,
    SyntaxToken dotToken,
    IdentifierName right
) implements NameSyntax {

    public QualifiedName {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(dotToken, "dotToken");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.QUALIFIED_NAME;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(left, dotToken, right);
    }
}
