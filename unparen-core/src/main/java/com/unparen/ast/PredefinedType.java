package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * A keyword type such as {@code int} or {@code string}.
 */
public record PredefinedType(SyntaxToken keyword) implements TypeSyntax {

    public PredefinedType {
        Objects.requireNonNull(keyword, "keyword");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.PREDEFINED_TYPE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(keyword);
    }
}
