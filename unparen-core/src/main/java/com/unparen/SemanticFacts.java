package com.unparen;

import com.unparen.ast.BinaryExpression;
import com.unparen.ast.ExpressionSyntax;

/**
 * Read-only view of a semantic model, as far as reassociation needs one.
 * {@code null} means the model does not know.
 */
public interface SemanticFacts {

    /**
     * The natural type of {@code expression}.
     */
    OperandType typeOf(ExpressionSyntax expression);

    /**
     * The type {@code expression} is converted to where it is used.
     */
    OperandType convertedTypeOf(ExpressionSyntax expression);

    /**
     * Whether {@code expression} binds to a user-defined operator rather than a
     * built-in one.
     */
    boolean isUserDefinedOperator(BinaryExpression expression);

    /**
     * Whether {@code expression} is evaluated with overflow checking.
     */
    boolean isOverflowChecked(BinaryExpression expression);
}
