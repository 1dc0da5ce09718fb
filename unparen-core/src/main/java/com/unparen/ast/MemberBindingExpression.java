package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * The {@code .name} that follows {@code ?} in a conditional access.
 */
public record MemberBindingExpression(SyntaxToken dotToken, IdentifierName name) implements ExpressionSyntax {

    public MemberBindingExpression {
        Objects.requireNonNull(dotToken, "dotToken");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.MEMBER_BINDING_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(dotToken, name);
    }
}
