package com.unparen.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code alias::name}, e.g. {@code global::System}.
 */
public record AliasQualifiedName(
    IdentifierName alias,
    SyntaxToken colonColonToken,
    IdentifierName name
) implements NameSyntax {

    public AliasQualifiedName {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(colonColonToken, "colonColonToken");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ALIAS_QUALIFIED_NAME;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(alias, colonColonToken, name);
    }
}
