package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code throw expression;}; the expression is absent for a rethrow.
 */
public record ThrowStatement(SyntaxToken throwKeyword, ExpressionSyntax expression, SyntaxToken semicolonToken) implements StatementSyntax {

    public ThrowStatement {
        Objects.requireNonNull(throwKeyword, "throwKeyword");
        Objects.requireNonNull(semicolonToken, "semicolonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.THROW_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(throwKeyword, expression, semicolonToken);
    }
}
