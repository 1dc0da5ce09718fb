package com.unparen.ast;

import java.util.List;

public record SwitchSection(List<SwitchLabel> labels, List<StatementSyntax> statements) implements SyntaxNode {

    public SwitchSection {
        labels = ChildList.copy(labels);
        statements = ChildList.copy(statements);
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("SwitchSection needs at least one label");
        }
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.SWITCH_SECTION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(labels, statements);
    }
}
