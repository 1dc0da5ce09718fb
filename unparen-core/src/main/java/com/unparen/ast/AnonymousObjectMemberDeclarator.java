package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * One member of an anonymous object; {@code nameEquals} is null for a
 * projection initializer such as {@code new { x.Y }}.
 */
public record AnonymousObjectMemberDeclarator(NameEquals nameEquals, ExpressionSyntax expression) implements SyntaxNode {

    public AnonymousObjectMemberDeclarator {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ANONYMOUS_OBJECT_MEMBER_DECLARATOR;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(nameEquals, expression);
    }
}
