package com.unparen;

import com.unparen.ast.BinaryExpression;

/**
 * Judges whether regrouping {@code a op (b op c)} as {@code (a op b) op c} keeps
 * the value and side effects of the program. Implementations must answer
 * {@code false} whenever they are unsure.
 */
@FunctionalInterface
public interface AssociativityOracle {

    /**
     * @param inner  the parenthesized right operand, {@code b op c}
     * @param parent the enclosing expression {@code a op (b op c)} of the same kind
     */
    boolean isSafeToChangeAssociativity(BinaryExpression inner, BinaryExpression parent);

    /**
     * An oracle that never approves a regrouping.
     */
    static AssociativityOracle never() {
        return (inner, parent) -> false;
    }
}
