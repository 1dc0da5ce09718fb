package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ExpressionStatement(ExpressionSyntax expression, SyntaxToken semicolonToken) implements StatementSyntax {

    public ExpressionStatement {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(semicolonToken, "semicolonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.EXPRESSION_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(expression, semicolonToken);
    }
}
