package com.unparen.ast;

public sealed interface PatternSyntax extends SyntaxNode permits
    ConstantPattern,
    DiscardPattern,
    DeclarationPattern,
    VarPattern,
    TypePattern,
    RecursivePattern,
    UnaryPattern,
    RelationalPattern,
    BinaryPattern,
    ParenthesizedPattern {
}
