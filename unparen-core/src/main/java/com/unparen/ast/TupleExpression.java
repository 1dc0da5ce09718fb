package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code (a, b)}. The parentheses belong to the tuple itself.
 */
public record TupleExpression(
    SyntaxToken openParenToken,
    List<ArgumentSyntax> arguments,
    List<SyntaxToken> separators,
    SyntaxToken closeParenToken
) implements ExpressionSyntax {

    public TupleExpression {
        Objects.requireNonNull(openParenToken, "openParenToken");
        arguments = ChildList.nodes(arguments, separators, "TupleExpression");
        separators = ChildList.separators(separators);
        Objects.requireNonNull(closeParenToken, "closeParenToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.TUPLE_EXPRESSION;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openParenToken, ChildList.separated(arguments, separators), closeParenToken);
    }
}
