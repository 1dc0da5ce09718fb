package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code T Name => expression;}
 */
public record PropertyDeclaration(
    TypeSyntax type,
    SyntaxToken identifier,
    ArrowExpressionClause expressionBody,
    SyntaxToken semicolonToken
) implements SyntaxNode {

    public PropertyDeclaration {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(expressionBody, "expressionBody");
        Objects.requireNonNull(semicolonToken, "semicolonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.PROPERTY_DECLARATION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(type, identifier, expressionBody, semicolonToken);
    }
}
