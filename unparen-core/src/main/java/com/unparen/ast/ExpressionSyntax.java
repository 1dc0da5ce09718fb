package com.unparen.ast;

public sealed interface ExpressionSyntax extends SyntaxNode permits
    TypeSyntax,
    LiteralExpression,
    ThisExpression,
    ParenthesizedExpression,
    TupleExpression,
    MemberAccessExpression,
    ConditionalAccessExpression,
    MemberBindingExpression,
    InvocationExpression,
    ElementAccessExpression,
    PostfixUnaryExpression,
    PrefixUnaryExpression,
    ObjectCreationExpression,
    AnonymousObjectCreationExpression,
    StackAllocArrayCreationExpression,
    CheckedExpression,
    InterpolatedStringExpression,
    CastExpression,
    AwaitExpression,
    RangeExpression,
    SwitchExpression,
    IsPatternExpression,
    BinaryExpression,
    ConditionalExpression,
    AssignmentExpression,
    SimpleLambdaExpression,
    ThrowExpression,
    RefExpression,
    QueryExpression,
    InitializerExpression {
}
