package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * A pattern that matches one constant value. The wrapper is transparent when
 * walking from an expression to its enclosing construct.
 */
public record ConstantPattern(ExpressionSyntax expression) implements PatternSyntax {

    public ConstantPattern {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CONSTANT_PATTERN;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(expression);
    }
}
