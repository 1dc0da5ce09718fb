package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code stackalloc T[n]}, with an optional {@code { ... }} initializer.
 */
public record StackAllocArrayCreationExpression(
    SyntaxToken stackAllocKeyword,
    TypeSyntax type,
    InitializerExpression initializer
) implements ExpressionSyntax {

    public StackAllocArrayCreationExpression {
        Objects.requireNonNull(stackAllocKeyword, "stackAllocKeyword");
        Objects.requireNonNull(type, "type");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.STACK_ALLOC_ARRAY_CREATION_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(stackAllocKeyword, type, initializer);
    }
}
