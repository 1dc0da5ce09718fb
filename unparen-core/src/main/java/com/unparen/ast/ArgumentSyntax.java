package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * One argument of an invocation, element access or tuple.
 *
 * @param refKindKeyword {@code ref}, {@code out} or {@code in}; may be null
 */
public record ArgumentSyntax(SyntaxToken refKindKeyword, ExpressionSyntax expression) implements SyntaxNode {

    public ArgumentSyntax {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ARGUMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(refKindKeyword, expression);
    }
}
