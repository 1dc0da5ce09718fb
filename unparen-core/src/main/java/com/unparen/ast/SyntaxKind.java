package com.unparen.ast;

import java.util.EnumSet;
import java.util.Set;

/**
 * Every node form the grammar recognizes. Records that model a single form
 * report a fixed kind; records that model a family of forms (binary operators,
 * assignments, literals, ...) carry their kind as a component.
 */
public enum SyntaxKind {
    // Names and types
    IDENTIFIER_NAME,
    QUALIFIED_NAME,
    ALIAS_QUALIFIED_NAME,
    PREDEFINED_TYPE,
    ARRAY_TYPE,
    POINTER_TYPE,
    NULLABLE_TYPE,

    // Literals
    NUMERIC_LITERAL_EXPRESSION,
    STRING_LITERAL_EXPRESSION,
    CHARACTER_LITERAL_EXPRESSION,
    TRUE_LITERAL_EXPRESSION,
    FALSE_LITERAL_EXPRESSION,
    NULL_LITERAL_EXPRESSION,
    DEFAULT_LITERAL_EXPRESSION,

    // Primary expressions
    THIS_EXPRESSION,
    PARENTHESIZED_EXPRESSION,
    TUPLE_EXPRESSION,
    SIMPLE_MEMBER_ACCESS_EXPRESSION,
    CONDITIONAL_ACCESS_EXPRESSION,
    MEMBER_BINDING_EXPRESSION,
    INVOCATION_EXPRESSION,
    ELEMENT_ACCESS_EXPRESSION,
    POST_INCREMENT_EXPRESSION,
    POST_DECREMENT_EXPRESSION,
    SUPPRESS_NULLABLE_WARNING_EXPRESSION,
    OBJECT_CREATION_EXPRESSION,
    ANONYMOUS_OBJECT_CREATION_EXPRESSION,
    STACK_ALLOC_ARRAY_CREATION_EXPRESSION,
    CHECKED_EXPRESSION,
    UNCHECKED_EXPRESSION,
    INTERPOLATED_STRING_EXPRESSION,

    // Unary expressions
    UNARY_PLUS_EXPRESSION,
    UNARY_MINUS_EXPRESSION,
    BITWISE_NOT_EXPRESSION,
    LOGICAL_NOT_EXPRESSION,
    PRE_INCREMENT_EXPRESSION,
    PRE_DECREMENT_EXPRESSION,
    ADDRESS_OF_EXPRESSION,
    POINTER_INDIRECTION_EXPRESSION,
    INDEX_EXPRESSION,
    CAST_EXPRESSION,
    AWAIT_EXPRESSION,

    RANGE_EXPRESSION,
    SWITCH_EXPRESSION,

    // Binary expressions
    MULTIPLY_EXPRESSION,
    DIVIDE_EXPRESSION,
    MODULO_EXPRESSION,
    ADD_EXPRESSION,
    SUBTRACT_EXPRESSION,
    LEFT_SHIFT_EXPRESSION,
    RIGHT_SHIFT_EXPRESSION,
    LESS_THAN_EXPRESSION,
    LESS_THAN_OR_EQUAL_EXPRESSION,
    GREATER_THAN_EXPRESSION,
    GREATER_THAN_OR_EQUAL_EXPRESSION,
    IS_EXPRESSION,
    AS_EXPRESSION,
    IS_PATTERN_EXPRESSION,
    EQUALS_EXPRESSION,
    NOT_EQUALS_EXPRESSION,
    BITWISE_AND_EXPRESSION,
    EXCLUSIVE_OR_EXPRESSION,
    BITWISE_OR_EXPRESSION,
    LOGICAL_AND_EXPRESSION,
    LOGICAL_OR_EXPRESSION,
    COALESCE_EXPRESSION,

    CONDITIONAL_EXPRESSION,

    // Assignments
    SIMPLE_ASSIGNMENT_EXPRESSION,
    ADD_ASSIGNMENT_EXPRESSION,
    SUBTRACT_ASSIGNMENT_EXPRESSION,
    MULTIPLY_ASSIGNMENT_EXPRESSION,
    DIVIDE_ASSIGNMENT_EXPRESSION,
    MODULO_ASSIGNMENT_EXPRESSION,
    AND_ASSIGNMENT_EXPRESSION,
    EXCLUSIVE_OR_ASSIGNMENT_EXPRESSION,
    OR_ASSIGNMENT_EXPRESSION,
    LEFT_SHIFT_ASSIGNMENT_EXPRESSION,
    RIGHT_SHIFT_ASSIGNMENT_EXPRESSION,
    COALESCE_ASSIGNMENT_EXPRESSION,

    SIMPLE_LAMBDA_EXPRESSION,
    THROW_EXPRESSION,
    REF_EXPRESSION,
    QUERY_EXPRESSION,

    ARRAY_INITIALIZER_EXPRESSION,
    OBJECT_INITIALIZER_EXPRESSION,
    COLLECTION_INITIALIZER_EXPRESSION,

    // Clauses and other non-expression nodes
    ARGUMENT,
    ARGUMENT_LIST,
    BRACKETED_ARGUMENT_LIST,
    NAME_EQUALS,
    NAME_COLON,
    ANONYMOUS_OBJECT_MEMBER_DECLARATOR,
    INTERPOLATED_STRING_TEXT,
    INTERPOLATION,
    INTERPOLATION_FORMAT_CLAUSE,
    ARROW_EXPRESSION_CLAUSE,
    PROPERTY_DECLARATION,
    EQUALS_VALUE_CLAUSE,
    VARIABLE_DECLARATION,
    VARIABLE_DECLARATOR,
    ELSE_CLAUSE,
    SWITCH_SECTION,
    CASE_SWITCH_LABEL,
    CASE_PATTERN_SWITCH_LABEL,
    DEFAULT_SWITCH_LABEL,
    WHEN_CLAUSE,
    SWITCH_EXPRESSION_ARM,
    CATCH_CLAUSE,
    CATCH_FILTER_CLAUSE,
    FROM_CLAUSE,
    WHERE_CLAUSE,
    SELECT_CLAUSE,
    IF_DIRECTIVE_TRIVIA,
    ELIF_DIRECTIVE_TRIVIA,
    PROPERTY_PATTERN_CLAUSE,
    SUBPATTERN,

    // Statements
    BLOCK,
    EXPRESSION_STATEMENT,
    LOCAL_DECLARATION_STATEMENT,
    IF_STATEMENT,
    WHILE_STATEMENT,
    DO_STATEMENT,
    FOR_STATEMENT,
    FOR_EACH_STATEMENT,
    LOCK_STATEMENT,
    USING_STATEMENT,
    SWITCH_STATEMENT,
    RETURN_STATEMENT,
    YIELD_RETURN_STATEMENT,
    THROW_STATEMENT,
    TRY_STATEMENT,

    // Patterns
    CONSTANT_PATTERN,
    DISCARD_PATTERN,
    DECLARATION_PATTERN,
    VAR_PATTERN,
    TYPE_PATTERN,
    RECURSIVE_PATTERN,
    NOT_PATTERN,
    RELATIONAL_PATTERN,
    AND_PATTERN,
    OR_PATTERN,
    PARENTHESIZED_PATTERN;

    private static final Set<SyntaxKind> LITERALS = EnumSet.of(
        NUMERIC_LITERAL_EXPRESSION, STRING_LITERAL_EXPRESSION, CHARACTER_LITERAL_EXPRESSION,
        TRUE_LITERAL_EXPRESSION, FALSE_LITERAL_EXPRESSION, NULL_LITERAL_EXPRESSION,
        DEFAULT_LITERAL_EXPRESSION);

    private static final Set<SyntaxKind> BINARY_EXPRESSIONS = EnumSet.of(
        MULTIPLY_EXPRESSION, DIVIDE_EXPRESSION, MODULO_EXPRESSION, ADD_EXPRESSION,
        SUBTRACT_EXPRESSION, LEFT_SHIFT_EXPRESSION, RIGHT_SHIFT_EXPRESSION,
        LESS_THAN_EXPRESSION, LESS_THAN_OR_EQUAL_EXPRESSION, GREATER_THAN_EXPRESSION,
        GREATER_THAN_OR_EQUAL_EXPRESSION, IS_EXPRESSION, AS_EXPRESSION, EQUALS_EXPRESSION,
        NOT_EQUALS_EXPRESSION, BITWISE_AND_EXPRESSION, EXCLUSIVE_OR_EXPRESSION,
        BITWISE_OR_EXPRESSION, LOGICAL_AND_EXPRESSION, LOGICAL_OR_EXPRESSION,
        COALESCE_EXPRESSION);

    private static final Set<SyntaxKind> ASSIGNMENTS = EnumSet.of(
        SIMPLE_ASSIGNMENT_EXPRESSION, ADD_ASSIGNMENT_EXPRESSION, SUBTRACT_ASSIGNMENT_EXPRESSION,
        MULTIPLY_ASSIGNMENT_EXPRESSION, DIVIDE_ASSIGNMENT_EXPRESSION, MODULO_ASSIGNMENT_EXPRESSION,
        AND_ASSIGNMENT_EXPRESSION, EXCLUSIVE_OR_ASSIGNMENT_EXPRESSION, OR_ASSIGNMENT_EXPRESSION,
        LEFT_SHIFT_ASSIGNMENT_EXPRESSION, RIGHT_SHIFT_ASSIGNMENT_EXPRESSION,
        COALESCE_ASSIGNMENT_EXPRESSION);

    private static final Set<SyntaxKind> PREFIX_UNARY_EXPRESSIONS = EnumSet.of(
        UNARY_PLUS_EXPRESSION, UNARY_MINUS_EXPRESSION, BITWISE_NOT_EXPRESSION,
        LOGICAL_NOT_EXPRESSION, PRE_INCREMENT_EXPRESSION, PRE_DECREMENT_EXPRESSION,
        ADDRESS_OF_EXPRESSION, POINTER_INDIRECTION_EXPRESSION, INDEX_EXPRESSION);

    private static final Set<SyntaxKind> POSTFIX_UNARY_EXPRESSIONS = EnumSet.of(
        POST_INCREMENT_EXPRESSION, POST_DECREMENT_EXPRESSION, SUPPRESS_NULLABLE_WARNING_EXPRESSION);

    private static final Set<SyntaxKind> INITIALIZERS = EnumSet.of(
        ARRAY_INITIALIZER_EXPRESSION, OBJECT_INITIALIZER_EXPRESSION, COLLECTION_INITIALIZER_EXPRESSION);

    public boolean isLiteral() {
        return LITERALS.contains(this);
    }

    public boolean isBinaryExpression() {
        return BINARY_EXPRESSIONS.contains(this);
    }

    public boolean isAssignment() {
        return ASSIGNMENTS.contains(this);
    }

    public boolean isPrefixUnaryExpression() {
        return PREFIX_UNARY_EXPRESSIONS.contains(this);
    }

    public boolean isPostfixUnaryExpression() {
        return POSTFIX_UNARY_EXPRESSIONS.contains(this);
    }

    public boolean isInitializer() {
        return INITIALIZERS.contains(this);
    }

    public boolean isChecked() {
        return this == CHECKED_EXPRESSION || this == UNCHECKED_EXPRESSION;
    }

    public boolean isBinaryPattern() {
        return this == AND_PATTERN || this == OR_PATTERN;
    }
}
