package com.unparen.ast;

import java.util.List;
import java.util.Objects;

public record LocalDeclarationStatement(VariableDeclaration declaration, SyntaxToken semicolonToken) implements StatementSyntax {

    public LocalDeclarationStatement {
        Objects.requireNonNull(declaration, "declaration");
        Objects.requireNonNull(semicolonToken, "semicolonToken");
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.LOCAL_DECLARATION_STATEMENT;
    }

    @Override
    public List<SyntaxElement> childNodesAndTokens() {
        return ChildList.of(declaration, semicolonToken);
    }
}
