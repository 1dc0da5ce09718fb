package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code case pattern when condition:}
 */
public record CasePatternSwitchLabel(
    SyntaxToken caseKeyword,
    PatternSyntax pattern,
    WhenClause whenClause,
    SyntaxToken colonToken
) implements SwitchLabel {

    public CasePatternSwitchLabel {
        Objects.requireNonNull(caseKeyword, "caseKeyword");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(colonToken, "colonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CASE_PATTERN_SWITCH_LABEL;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(caseKeyword, pattern, whenClause, colonToken);
    }
}
