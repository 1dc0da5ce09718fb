package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code case constant:}
 */
public record CaseSwitchLabel(SyntaxToken caseKeyword, ExpressionSyntax value, SyntaxToken colonToken) implements SwitchLabel {

    public CaseSwitchLabel {
        Objects.requireNonNull(caseKeyword, "caseKeyword");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(colonToken, "colonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CASE_SWITCH_LABEL;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(caseKeyword, value, colonToken);
    }
}
