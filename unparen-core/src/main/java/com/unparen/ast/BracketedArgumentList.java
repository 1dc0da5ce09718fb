package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record BracketedArgumentList(
    SyntaxToken openBracketToken,
    List<ArgumentSyntax> arguments,
    List<SyntaxToken> separators,
    SyntaxToken closeBracketToken
) implements SyntaxNode {

    public BracketedArgumentList {
        Objects.requireNonNull(openBracketToken, "openBracketToken");
        arguments = ChildList.nodes(arguments, separators, "BracketedArgumentList");
        separators = ChildList.separators(separators);
        Objects.requireNonNull(closeBracketToken, "closeBracketToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.BRACKETED_ARGUMENT_LIST;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(openBracketToken, ChildList.separated(arguments, separators), closeBracketToken);
    }
}
