package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record InterpolatedStringText(SyntaxToken textToken) implements InterpolatedStringContent {

    public InterpolatedStringText {
        Objects.requireNonNull(textToken, "textToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.INTERPOLATED_STRING_TEXT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(textToken);
    }
}
