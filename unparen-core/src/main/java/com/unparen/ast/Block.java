package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record Block(
    SyntaxToken openBraceToken,
    List<StatementSyntax> statements,
    SyntaxToken closeBraceToken
) implements StatementSyntax {

    public Block {
        Objects.requireNonNull(openBraceToken, "openBraceToken");
        statements = ChildList.copy(statements);
        Objects.requireNonNull(closeBraceToken, "closeBraceToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.BLOCK;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openBraceToken, statements, closeBraceToken);
    }
}
