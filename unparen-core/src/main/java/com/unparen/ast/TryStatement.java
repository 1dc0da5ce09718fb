package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record TryStatement(SyntaxToken tryKeyword, Block block, List<CatchClause> catches) implements StatementSyntax {

    public TryStatement {
        Objects.requireNonNull(tryKeyword, "tryKeyword");
        Objects.requireNonNull(block, "block");
        catches = ChildList.copy(catches);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.TRY_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(tryKeyword, block, catches);
    }
}
