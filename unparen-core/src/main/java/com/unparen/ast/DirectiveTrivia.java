package com.unparen.ast;

/**
 * A preprocessor directive whose condition is an expression.
 */
public sealed interface DirectiveTrivia extends SyntaxNode permits IfDirectiveTrivia, ElifDirectiveTrivia {

    ExpressionSyntax condition();
}
