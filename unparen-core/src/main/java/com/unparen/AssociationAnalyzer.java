package com.unparen;

import com.unparen.ast.AssignmentExpression;
import com.unparen.ast.BinaryExpression;
import com.unparen.ast.ExpressionSyntax;
import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.SyntaxKind;

/**
 * Decides whether unwrapping a parenthesized operand would rebind it to a
 * different operator.
 */
public final class AssociationAnalyzer {

    private AssociationAnalyzer() {
    }

    /**
     * Whether removing the parentheses of {@code node} changes which operands
     * {@code parent} and the inner expression combine.
     *
     * @param node   the parenthesized operand
     * @param parent the expression that directly uses {@code node}
     * @param oracle consulted when an associative chain would be regrouped
     * @return {@code true} if the removal changes association, or cannot be
     *         shown not to
     */
    public static boolean changesAssociation(ParenthesizedExpression node, ExpressionSyntax parent,
                                             AssociativityOracle oracle) {
        ExpressionSyntax expression = node.expression();
        OperatorPrecedence precedence = PrecedenceTable.precedenceOf(expression);
        OperatorPrecedence parentPrecedence = PrecedenceTable.precedenceOf(parent);
        if (precedence == OperatorPrecedence.NONE || parentPrecedence == OperatorPrecedence.NONE) {
            return true;
        }
        if (precedence.bindsTighterThan(parentPrecedence)) {
            return false;
        }
        if (precedence.bindsLooserThan(parentPrecedence)) {
            return true;
        }

        // Equal precedence: only operator chains can regroup
        if (!(expression instanceof BinaryExpression) && !(expression instanceof AssignmentExpression)) {
            return false;
        }

        if (parent instanceof BinaryExpression parentBinary) {
            // a && (b && c) -> a && b && c evaluates a, b, c in the same order with the same
            // short-circuiting; whether the value is the same is up to the oracle.
            if (PrecedenceTable.isAssociative(parentBinary.kind())
                && expression.kind() == parentBinary.kind()
                && parentBinary.right() == node) {
                return !oracle.isSafeToChangeAssociativity((BinaryExpression) expression, parentBinary);
            }
            // ?? is right-associative
            if (parentBinary.kind() == SyntaxKind.COALESCE_EXPRESSION) {
                return parentBinary.left() == node;
            }
            // every other binary operator is left-associative
            return parentBinary.right() == node;
        }

        if (parent instanceof AssignmentExpression parentAssignment) {
            return parentAssignment.left() == node;
        }

        return false;
    }
}
