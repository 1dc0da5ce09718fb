package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record InterpolationFormatClause(SyntaxToken colonToken, SyntaxToken formatStringToken) implements SyntaxNode {

    public InterpolationFormatClause {
        Objects.requireNonNull(colonToken, "colonToken");
        Objects.requireNonNull(formatStringToken, "formatStringToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.INTERPOLATION_FORMAT_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(colonToken, formatStringToken);
    }
}
