package com.unparen.ast;

/**
 * Type syntax. Types are expressions because a bare name is ambiguous between
 * the two until binding.
 */
public sealed interface TypeSyntax extends ExpressionSyntax permits
    NameSyntax,
    PredefinedType,
    ArrayType,
    PointerType,
    NullableType {
}
