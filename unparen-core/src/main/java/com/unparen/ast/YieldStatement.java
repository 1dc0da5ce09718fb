package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code yield return expression;}
 */
public record YieldStatement(
    SyntaxToken yieldKeyword,
    SyntaxToken returnKeyword,
    ExpressionSyntax expression,
    SyntaxToken semicolonToken
) implements StatementSyntax {

    public YieldStatement {
        Objects.requireNonNull(yieldKeyword, "yieldKeyword");
        Objects.requireNonNull(returnKeyword, "returnKeyword");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(semicolonToken, "semicolonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.YIELD_RETURN_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(yieldKeyword, returnKeyword, expression, semicolonToken);
    }
}
