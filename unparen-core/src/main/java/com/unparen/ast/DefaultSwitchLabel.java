package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record DefaultSwitchLabel(SyntaxToken defaultKeyword, SyntaxToken colonToken) implements SwitchLabel {

    public DefaultSwitchLabel {
        Objects.requireNonNull(defaultKeyword, "defaultKeyword");
        Objects.requireNonNull(colonToken, "colonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.DEFAULT_SWITCH_LABEL;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(defaultKeyword, colonToken);
    }
}
