package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record CatchClause(SyntaxToken catchKeyword, CatchFilterClause filter, Block block) implements SyntaxNode {

    public CatchClause {
        Objects.requireNonNull(catchKeyword, "catchKeyword");
        Objects.requireNonNull(block, "block");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CATCH_CLAUSE;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(catchKeyword, filter, block);
    }
}
