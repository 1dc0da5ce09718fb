package com.unparen;

import com.unparen.ast.BinaryExpression;
import com.unparen.ast.ExpressionSyntax;
import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.SyntaxKind;
import com.unparen.ast.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import static com.unparen.ast.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class SemanticAssociativityOracleTest {

    private static final OperandType INT = new OperandType("System.Int32", OperandType.Category.INTEGRAL);
    private static final OperandType LONG = new OperandType("System.Int64", OperandType.Category.INTEGRAL);
    private static final OperandType DOUBLE = new OperandType("System.Double", OperandType.Category.FLOATING_POINT);
    private static final OperandType DECIMAL = new OperandType("System.Decimal", OperandType.Category.DECIMAL);
    private static final OperandType BOOL = new OperandType("System.Boolean", OperandType.Category.BOOLEAN);
    private static final OperandType STRING = new OperandType("System.String", OperandType.Category.STRING);
    private static final OperandType DYNAMIC = new OperandType("dynamic", OperandType.Category.DYNAMIC);

    /**
     * Semantic facts keyed by node identity. The converted type defaults to the
     * natural type.
     */
    private static final class FakeFacts implements SemanticFacts {
        final Map<ExpressionSyntax, OperandType> types = new IdentityHashMap<>();
        final Map<ExpressionSyntax, OperandType> convertedTypes = new IdentityHashMap<>();
        final Set<BinaryExpression> userDefined = Collections.newSetFromMap(new IdentityHashMap<>());
        final Set<BinaryExpression> checked = Collections.newSetFromMap(new IdentityHashMap<>());

        @Override
        public OperandType typeOf(ExpressionSyntax expression) {
            return types.get(expression);
        }

        @Override
        public OperandType convertedTypeOf(ExpressionSyntax expression) {
            return convertedTypes.getOrDefault(expression, types.get(expression));
        }

        @Override
        public boolean isUserDefinedOperator(BinaryExpression expression) {
            return userDefined.contains(expression);
        }

        @Override
        public boolean isOverflowChecked(BinaryExpression expression) {
            return checked.contains(expression);
        }
    }

    private FakeFacts facts;
    private SemanticAssociativityOracle oracle;

    private BinaryExpression inner;
    private ParenthesizedExpression node;
    private BinaryExpression parent;

    @BeforeEach
    void setUp() {
        facts = new FakeFacts();
        oracle = new SemanticAssociativityOracle(facts);
    }

    /**
     * Builds {@code a op (b op c)} and types every operand and both operators.
     */
    private void chain(SyntaxKind kind, OperandType type) {
        ExpressionSyntax a = identifier("a");
        ExpressionSyntax b = identifier("b");
        ExpressionSyntax c = identifier("c");
        inner = binary(kind, b, c);
        node = parenthesized(inner);
        parent = binary(kind, a, node);
        for (ExpressionSyntax expression : new ExpressionSyntax[]{a, b, c, inner, node, parent}) {
            facts.types.put(expression, type);
        }
    }

    private boolean safe() {
        return oracle.isSafeToChangeAssociativity(inner, parent);
    }

    @Test
    void testConditionalLogicRegroups() {
        chain(SyntaxKind.LOGICAL_AND_EXPRESSION, BOOL);
        assertTrue(safe());
        chain(SyntaxKind.LOGICAL_OR_EXPRESSION, BOOL);
        assertTrue(safe());
    }

    @Test
    void testUncheckedIntegralArithmeticRegroups() {
        chain(SyntaxKind.ADD_EXPRESSION, INT);
        assertTrue(safe());
        chain(SyntaxKind.MULTIPLY_EXPRESSION, LONG);
        assertTrue(safe());
    }

    @Test
    void testCheckedArithmeticIsRefused() {
        chain(SyntaxKind.ADD_EXPRESSION, INT);
        facts.checked.add(inner);
        assertFalse(safe());

        chain(SyntaxKind.MULTIPLY_EXPRESSION, INT);
        facts.checked.add(parent);
        assertFalse(safe());
    }

    @Test
    void testFloatingPointAndDecimalAreRefused() {
        chain(SyntaxKind.ADD_EXPRESSION, DOUBLE);
        assertFalse(safe());
        chain(SyntaxKind.MULTIPLY_EXPRESSION, DECIMAL);
        assertFalse(safe());
    }

    @Test
    void testStringConcatenationRegroups() {
        chain(SyntaxKind.ADD_EXPRESSION, STRING);
        assertTrue(safe());
        chain(SyntaxKind.MULTIPLY_EXPRESSION, STRING);
        assertFalse(safe());
    }

    @Test
    void testBitwiseOperators() {
        chain(SyntaxKind.BITWISE_AND_EXPRESSION, INT);
        assertTrue(safe());
        chain(SyntaxKind.BITWISE_OR_EXPRESSION, BOOL);
        assertTrue(safe());
        chain(SyntaxKind.EXCLUSIVE_OR_EXPRESSION, LONG);
        assertTrue(safe());
        chain(SyntaxKind.BITWISE_AND_EXPRESSION, STRING);
        assertFalse(safe());
    }

    @Test
    void testUserDefinedOperatorIsRefused() {
        chain(SyntaxKind.ADD_EXPRESSION, INT);
        facts.userDefined.add(parent);
        assertFalse(safe());
    }

    @Test
    void testUnknownOrDynamicTypeIsRefused() {
        chain(SyntaxKind.ADD_EXPRESSION, DYNAMIC);
        assertFalse(safe());

        chain(SyntaxKind.ADD_EXPRESSION, INT);
        facts.types.remove(inner);
        assertFalse(safe());
    }

    @Test
    void testMixedOperandTypesAreRefused() {
        // int + (long + long) widens part of the chain
        chain(SyntaxKind.ADD_EXPRESSION, LONG);
        facts.types.put(parent.left(), INT);
        assertFalse(safe());

        chain(SyntaxKind.ADD_EXPRESSION, INT);
        facts.types.put(inner.right(), LONG);
        assertFalse(safe());
    }

    @Test
    void testConvertedInnerIsRefused() {
        chain(SyntaxKind.ADD_EXPRESSION, INT);
        facts.convertedTypes.put(inner, LONG);
        assertFalse(safe());
    }

    @Test
    void testDrivesTheRemovalDecision() {
        chain(SyntaxKind.ADD_EXPRESSION, INT);
        SyntaxTree tree = SyntaxTree.of(returnStatement(parent));
        assertTrue(ParenthesizedExpressions.canRemoveParentheses(tree, node, oracle));

        facts.checked.add(inner);
        assertFalse(ParenthesizedExpressions.canRemoveParentheses(tree, node, oracle));
        assertFalse(ParenthesizedExpressions.canRemoveParentheses(tree, node));
    }
}
