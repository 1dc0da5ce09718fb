package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code new T(args) { initializer }}; the argument list and the initializer are
 * each optional, but not both absent.
 */
public record ObjectCreationExpression(
    SyntaxToken newKeyword,
    TypeSyntax type,
    ArgumentList argumentList,
    InitializerExpression initializer
) implements ExpressionSyntax {

    public ObjectCreationExpression {
        Objects.requireNonNull(newKeyword, "newKeyword");
        Objects.requireNonNull(type, "type");
        if (argumentList == null && initializer == null) {
            throw new IllegalArgumentException("Object creation needs an argument list or an initializer");
        }
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.OBJECT_CREATION_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(newKeyword, type, argumentList, initializer);
    }
}
