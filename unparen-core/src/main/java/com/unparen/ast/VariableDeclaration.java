package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code T a = x, b = y}.
 */
public record VariableDeclaration(
    TypeSyntax type,
    List<VariableDeclarator> variables,
    List<SyntaxToken> separators
) implements SyntaxNode {

    public VariableDeclaration {
        Objects.requireNonNull(type, "type");
        variables = ChildList.nodes(variables, separators, "VariableDeclaration");
        separators = ChildList.separators(separators);
        if (variables.isEmpty()) {
            throw new IllegalArgumentException("VariableDeclaration needs at least one variable");
        }
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.VARIABLE_DECLARATION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(type, ChildList.separated(variables, separators));
    }
}
