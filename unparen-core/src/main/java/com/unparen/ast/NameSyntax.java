package com.unparen.ast;

public sealed interface NameSyntax extends TypeSyntax permits
    IdentifierName,
    QualifiedName,
    AliasQualifiedName {
}
