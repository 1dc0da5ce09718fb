package com.unparen;

/**
 * Operator precedence levels, loosest first. Declaration order is the binding
 * order: a later constant binds tighter than an earlier one.
 */
public enum OperatorPrecedence {
    NONE,                           // No precedence applies; forces a refusal
    ASSIGNMENT_AND_LAMBDA,          // x = y, x += y, x => y
    CONDITIONAL,                    // a ? b : c
    NULL_COALESCING,                // a ?? b
    CONDITIONAL_OR,                 // a || b, pattern or
    CONDITIONAL_AND,                // a && b, pattern and
    LOGICAL_OR,                     // a | b
    LOGICAL_XOR,                    // a ^ b
    LOGICAL_AND,                    // a & b
    EQUALITY,                       // a == b, a != b
    RELATIONAL_AND_TYPE_TESTING,    // a < b, a is T, a as T
    SHIFT,                          // a << b, a >> b
    ADDITIVE,                       // a + b, a - b
    MULTIPLICATIVE,                 // a * b, a / b, a % b
    SWITCH,                         // x switch { ... }
    RANGE,                          // a..b
    UNARY,                          // -x, !x, (T)x, await x, pattern not
    PRIMARY;                        // x, x.y, f(x), x++, new T()

    public boolean bindsTighterThan(OperatorPrecedence other) {
        return compareTo(other) > 0;
    }

    public boolean bindsLooserThan(OperatorPrecedence other) {
        return compareTo(other) < 0;
    }
}
