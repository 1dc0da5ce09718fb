package com.unparen.ast;

public sealed interface StatementSyntax extends SyntaxNode permits
    Block,
    ExpressionStatement,
    LocalDeclarationStatement,
    IfStatement,
    WhileStatement,
    DoStatement,
    ForStatement,
    ForEachStatement,
    LockStatement,
    UsingStatement,
    SwitchStatement,
    ReturnStatement,
    YieldStatement,
    ThrowStatement,
    TryStatement {
}
