package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code left and right} or {@code left or right}.
 */
public record BinaryPattern(
    SyntaxKind kind,
    PatternSyntax left,
    SyntaxToken operatorToken,
    PatternSyntax right
) implements PatternSyntax {

    public BinaryPattern {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operatorToken, "operatorToken");
        Objects.requireNonNull(right, "right");
        if (!kind.isBinaryPattern()) {
            throw new IllegalArgumentException("Not a binary pattern kind: " + kind);
        }
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(left, operatorToken, right);
    }
}
