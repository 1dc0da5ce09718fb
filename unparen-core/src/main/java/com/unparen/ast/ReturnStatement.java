package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code return expression;}; the expression is absent for a bare {@code return;}.
 */
public record ReturnStatement(SyntaxToken returnKeyword, ExpressionSyntax expression, SyntaxToken semicolonToken) implements StatementSyntax {

    public ReturnStatement {
        Objects.requireNonNull(returnKeyword, "returnKeyword");
        Objects.requireNonNull(semicolonToken, "semicolonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.RETURN_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(returnKeyword, expression, semicolonToken);
    }
}
