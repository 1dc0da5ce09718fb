package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record ArgumentList(
    SyntaxToken openParenToken,
    List<ArgumentSyntax> arguments,
    List<SyntaxToken> separators,
    SyntaxToken closeParenToken
) implements SyntaxNode {

    public ArgumentList {
        Objects.requireNonNull(openParenToken, "openParenToken");
        arguments = ChildList.nodes(arguments, separators, "ArgumentList");
        separators = ChildList.separators(separators);
        Objects.requireNonNull(closeParenToken, "closeParenToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ARGUMENT_LIST;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openParenToken, ChildList.separated(arguments, separators), closeParenToken);
    }
}
