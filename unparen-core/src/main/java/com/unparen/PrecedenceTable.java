package com.unparen;

import com.unparen.ast.SyntaxKind;
import com.unparen.ast.SyntaxNode;

/**
 * Static precedence and associativity facts for expression and pattern kinds.
 */
public final class PrecedenceTable {

    private PrecedenceTable() {
    }

    /**
     * The precedence of an expression of the given kind. Every kind maps to a
     * level; kinds that are not expressions, or that are never operands of a
     * precedence decision, map to {@link OperatorPrecedence#NONE}.
     */
    public static OperatorPrecedence precedenceOf(SyntaxKind kind) {
        return switch (kind) {
            case IDENTIFIER_NAME, QUALIFIED_NAME, ALIAS_QUALIFIED_NAME, PREDEFINED_TYPE, ARRAY_TYPE, POINTER_TYPE,
                 NULLABLE_TYPE,
                 NUMERIC_LITERAL_EXPRESSION, STRING_LITERAL_EXPRESSION, CHARACTER_LITERAL_EXPRESSION,
                 TRUE_LITERAL_EXPRESSION, FALSE_LITERAL_EXPRESSION, NULL_LITERAL_EXPRESSION,
                 DEFAULT_LITERAL_EXPRESSION,
                 THIS_EXPRESSION, PARENTHESIZED_EXPRESSION, TUPLE_EXPRESSION, SIMPLE_MEMBER_ACCESS_EXPRESSION,
                 CONDITIONAL_ACCESS_EXPRESSION, MEMBER_BINDING_EXPRESSION, INVOCATION_EXPRESSION,
                 ELEMENT_ACCESS_EXPRESSION, POST_INCREMENT_EXPRESSION, POST_DECREMENT_EXPRESSION,
                 SUPPRESS_NULLABLE_WARNING_EXPRESSION, OBJECT_CREATION_EXPRESSION,
                 ANONYMOUS_OBJECT_CREATION_EXPRESSION, STACK_ALLOC_ARRAY_CREATION_EXPRESSION, CHECKED_EXPRESSION,
                 UNCHECKED_EXPRESSION, INTERPOLATED_STRING_EXPRESSION -> OperatorPrecedence.PRIMARY;

            case UNARY_PLUS_EXPRESSION, UNARY_MINUS_EXPRESSION, BITWISE_NOT_EXPRESSION, LOGICAL_NOT_EXPRESSION,
                 PRE_INCREMENT_EXPRESSION, PRE_DECREMENT_EXPRESSION, ADDRESS_OF_EXPRESSION,
                 POINTER_INDIRECTION_EXPRESSION, INDEX_EXPRESSION, CAST_EXPRESSION, AWAIT_EXPRESSION ->
                OperatorPrecedence.UNARY;

            case RANGE_EXPRESSION -> OperatorPrecedence.RANGE;
            case SWITCH_EXPRESSION -> OperatorPrecedence.SWITCH;

            case MULTIPLY_EXPRESSION, DIVIDE_EXPRESSION, MODULO_EXPRESSION -> OperatorPrecedence.MULTIPLICATIVE;
            case ADD_EXPRESSION, SUBTRACT_EXPRESSION -> OperatorPrecedence.ADDITIVE;
            case LEFT_SHIFT_EXPRESSION, RIGHT_SHIFT_EXPRESSION -> OperatorPrecedence.SHIFT;
            case LESS_THAN_EXPRESSION, LESS_THAN_OR_EQUAL_EXPRESSION, GREATER_THAN_EXPRESSION,
                 GREATER_THAN_OR_EQUAL_EXPRESSION, IS_EXPRESSION, AS_EXPRESSION, IS_PATTERN_EXPRESSION ->
                OperatorPrecedence.RELATIONAL_AND_TYPE_TESTING;
            case EQUALS_EXPRESSION, NOT_EQUALS_EXPRESSION -> OperatorPrecedence.EQUALITY;
            case BITWISE_AND_EXPRESSION -> OperatorPrecedence.LOGICAL_AND;
            case EXCLUSIVE_OR_EXPRESSION -> OperatorPrecedence.LOGICAL_XOR;
            case BITWISE_OR_EXPRESSION -> OperatorPrecedence.LOGICAL_OR;
            case LOGICAL_AND_EXPRESSION -> OperatorPrecedence.CONDITIONAL_AND;
            case LOGICAL_OR_EXPRESSION -> OperatorPrecedence.CONDITIONAL_OR;
            case COALESCE_EXPRESSION -> OperatorPrecedence.NULL_COALESCING;
            case CONDITIONAL_EXPRESSION -> OperatorPrecedence.CONDITIONAL;

            case SIMPLE_ASSIGNMENT_EXPRESSION, ADD_ASSIGNMENT_EXPRESSION, SUBTRACT_ASSIGNMENT_EXPRESSION,
                 MULTIPLY_ASSIGNMENT_EXPRESSION, DIVIDE_ASSIGNMENT_EXPRESSION, MODULO_ASSIGNMENT_EXPRESSION,
                 AND_ASSIGNMENT_EXPRESSION, EXCLUSIVE_OR_ASSIGNMENT_EXPRESSION, OR_ASSIGNMENT_EXPRESSION,
                 LEFT_SHIFT_ASSIGNMENT_EXPRESSION, RIGHT_SHIFT_ASSIGNMENT_EXPRESSION,
                 COALESCE_ASSIGNMENT_EXPRESSION, SIMPLE_LAMBDA_EXPRESSION -> OperatorPrecedence.ASSIGNMENT_AND_LAMBDA;

            // Expressions that never take part in precedence decisions
            case THROW_EXPRESSION, REF_EXPRESSION, QUERY_EXPRESSION, ARRAY_INITIALIZER_EXPRESSION,
                 OBJECT_INITIALIZER_EXPRESSION, COLLECTION_INITIALIZER_EXPRESSION -> OperatorPrecedence.NONE;

            // Clauses, statements and patterns are not expressions
            case ARGUMENT, ARGUMENT_LIST, BRACKETED_ARGUMENT_LIST, NAME_EQUALS, NAME_COLON,
                 ANONYMOUS_OBJECT_MEMBER_DECLARATOR, INTERPOLATED_STRING_TEXT, INTERPOLATION,
                 INTERPOLATION_FORMAT_CLAUSE, ARROW_EXPRESSION_CLAUSE, PROPERTY_DECLARATION, EQUALS_VALUE_CLAUSE,
                 VARIABLE_DECLARATION, VARIABLE_DECLARATOR, ELSE_CLAUSE, SWITCH_SECTION, CASE_SWITCH_LABEL,
                 CASE_PATTERN_SWITCH_LABEL, DEFAULT_SWITCH_LABEL, WHEN_CLAUSE, SWITCH_EXPRESSION_ARM, CATCH_CLAUSE,
                 CATCH_FILTER_CLAUSE, FROM_CLAUSE, WHERE_CLAUSE, SELECT_CLAUSE, IF_DIRECTIVE_TRIVIA,
                 ELIF_DIRECTIVE_TRIVIA, PROPERTY_PATTERN_CLAUSE, SUBPATTERN,
                 BLOCK, EXPRESSION_STATEMENT, LOCAL_DECLARATION_STATEMENT, IF_STATEMENT, WHILE_STATEMENT,
                 DO_STATEMENT, FOR_STATEMENT, FOR_EACH_STATEMENT, LOCK_STATEMENT, USING_STATEMENT,
                 SWITCH_STATEMENT, RETURN_STATEMENT, YIELD_RETURN_STATEMENT, THROW_STATEMENT, TRY_STATEMENT,
                 CONSTANT_PATTERN, DISCARD_PATTERN, DECLARATION_PATTERN, VAR_PATTERN, TYPE_PATTERN,
                 RECURSIVE_PATTERN, NOT_PATTERN, RELATIONAL_PATTERN, AND_PATTERN, OR_PATTERN,
                 PARENTHESIZED_PATTERN -> OperatorPrecedence.NONE;
        };
    }

    public static OperatorPrecedence precedenceOf(SyntaxNode node) {
        return precedenceOf(node.kind());
    }

    /**
     * The precedence of a pattern of the given kind. Patterns use four tiers:
     * atoms, {@code not} and relational patterns, {@code and}, {@code or}.
     */
    public static OperatorPrecedence patternPrecedenceOf(SyntaxKind kind) {
        return switch (kind) {
            case CONSTANT_PATTERN, DISCARD_PATTERN, DECLARATION_PATTERN, VAR_PATTERN, TYPE_PATTERN,
                 RECURSIVE_PATTERN, PARENTHESIZED_PATTERN -> OperatorPrecedence.PRIMARY;
            case NOT_PATTERN, RELATIONAL_PATTERN -> OperatorPrecedence.UNARY;
            case AND_PATTERN -> OperatorPrecedence.CONDITIONAL_AND;
            case OR_PATTERN -> OperatorPrecedence.CONDITIONAL_OR;
            // Expressions, clauses and statements are not patterns
            case IDENTIFIER_NAME, QUALIFIED_NAME, ALIAS_QUALIFIED_NAME, PREDEFINED_TYPE, ARRAY_TYPE, POINTER_TYPE,
                 NULLABLE_TYPE, NUMERIC_LITERAL_EXPRESSION, STRING_LITERAL_EXPRESSION, CHARACTER_LITERAL_EXPRESSION,
                 TRUE_LITERAL_EXPRESSION, FALSE_LITERAL_EXPRESSION, NULL_LITERAL_EXPRESSION,
                 DEFAULT_LITERAL_EXPRESSION, THIS_EXPRESSION, PARENTHESIZED_EXPRESSION, TUPLE_EXPRESSION,
                 SIMPLE_MEMBER_ACCESS_EXPRESSION, CONDITIONAL_ACCESS_EXPRESSION, MEMBER_BINDING_EXPRESSION,
                 INVOCATION_EXPRESSION, ELEMENT_ACCESS_EXPRESSION, POST_INCREMENT_EXPRESSION,
                 POST_DECREMENT_EXPRESSION, SUPPRESS_NULLABLE_WARNING_EXPRESSION, OBJECT_CREATION_EXPRESSION,
                 ANONYMOUS_OBJECT_CREATION_EXPRESSION, STACK_ALLOC_ARRAY_CREATION_EXPRESSION, CHECKED_EXPRESSION,
                 UNCHECKED_EXPRESSION, INTERPOLATED_STRING_EXPRESSION, UNARY_PLUS_EXPRESSION, UNARY_MINUS_EXPRESSION,
                 BITWISE_NOT_EXPRESSION, LOGICAL_NOT_EXPRESSION, PRE_INCREMENT_EXPRESSION, PRE_DECREMENT_EXPRESSION,
                 ADDRESS_OF_EXPRESSION, POINTER_INDIRECTION_EXPRESSION, INDEX_EXPRESSION, CAST_EXPRESSION,
                 AWAIT_EXPRESSION, RANGE_EXPRESSION, SWITCH_EXPRESSION, MULTIPLY_EXPRESSION, DIVIDE_EXPRESSION,
                 MODULO_EXPRESSION, ADD_EXPRESSION, SUBTRACT_EXPRESSION, LEFT_SHIFT_EXPRESSION,
                 RIGHT_SHIFT_EXPRESSION, LESS_THAN_EXPRESSION, LESS_THAN_OR_EQUAL_EXPRESSION,
                 GREATER_THAN_EXPRESSION, GREATER_THAN_OR_EQUAL_EXPRESSION, IS_EXPRESSION, AS_EXPRESSION,
                 IS_PATTERN_EXPRESSION, EQUALS_EXPRESSION, NOT_EQUALS_EXPRESSION, BITWISE_AND_EXPRESSION,
                 EXCLUSIVE_OR_EXPRESSION, BITWISE_OR_EXPRESSION, LOGICAL_AND_EXPRESSION, LOGICAL_OR_EXPRESSION,
                 COALESCE_EXPRESSION, CONDITIONAL_EXPRESSION, SIMPLE_ASSIGNMENT_EXPRESSION,
                 ADD_ASSIGNMENT_EXPRESSION, SUBTRACT_ASSIGNMENT_EXPRESSION, MULTIPLY_ASSIGNMENT_EXPRESSION,
                 DIVIDE_ASSIGNMENT_EXPRESSION, MODULO_ASSIGNMENT_EXPRESSION, AND_ASSIGNMENT_EXPRESSION,
                 EXCLUSIVE_OR_ASSIGNMENT_EXPRESSION, OR_ASSIGNMENT_EXPRESSION, LEFT_SHIFT_ASSIGNMENT_EXPRESSION,
                 RIGHT_SHIFT_ASSIGNMENT_EXPRESSION, COALESCE_ASSIGNMENT_EXPRESSION, SIMPLE_LAMBDA_EXPRESSION,
                 THROW_EXPRESSION, REF_EXPRESSION, QUERY_EXPRESSION, ARRAY_INITIALIZER_EXPRESSION,
                 OBJECT_INITIALIZER_EXPRESSION, COLLECTION_INITIALIZER_EXPRESSION, ARGUMENT, ARGUMENT_LIST,
                 BRACKETED_ARGUMENT_LIST, NAME_EQUALS, NAME_COLON, ANONYMOUS_OBJECT_MEMBER_DECLARATOR,
                 INTERPOLATED_STRING_TEXT, INTERPOLATION, INTERPOLATION_FORMAT_CLAUSE, ARROW_EXPRESSION_CLAUSE,
                 PROPERTY_DECLARATION, EQUALS_VALUE_CLAUSE, VARIABLE_DECLARATION, VARIABLE_DECLARATOR, ELSE_CLAUSE,
                 SWITCH_SECTION, CASE_SWITCH_LABEL, CASE_PATTERN_SWITCH_LABEL, DEFAULT_SWITCH_LABEL, WHEN_CLAUSE,
                 SWITCH_EXPRESSION_ARM, CATCH_CLAUSE, CATCH_FILTER_CLAUSE, FROM_CLAUSE, WHERE_CLAUSE, SELECT_CLAUSE,
                 IF_DIRECTIVE_TRIVIA, ELIF_DIRECTIVE_TRIVIA, PROPERTY_PATTERN_CLAUSE, SUBPATTERN, BLOCK,
                 EXPRESSION_STATEMENT, LOCAL_DECLARATION_STATEMENT, IF_STATEMENT, WHILE_STATEMENT, DO_STATEMENT,
                 FOR_STATEMENT, FOR_EACH_STATEMENT, LOCK_STATEMENT, USING_STATEMENT, SWITCH_STATEMENT,
                 RETURN_STATEMENT, YIELD_RETURN_STATEMENT, THROW_STATEMENT, TRY_STATEMENT -> OperatorPrecedence.NONE;
        };
    }

    /**
     * Whether {@code a op (b op c)} and {@code (a op b) op c} parse to the same
     * operator chain. This says nothing about whether the two evaluate to the
     * same value; see {@link AssociativityOracle}.
     */
    public static boolean isAssociative(SyntaxKind kind) {
        return switch (kind) {
            case ADD_EXPRESSION, MULTIPLY_EXPRESSION, BITWISE_OR_EXPRESSION, EXCLUSIVE_OR_EXPRESSION,
                 BITWISE_AND_EXPRESSION, LOGICAL_OR_EXPRESSION, LOGICAL_AND_EXPRESSION -> true;
            default -> false;
        };
    }
}
