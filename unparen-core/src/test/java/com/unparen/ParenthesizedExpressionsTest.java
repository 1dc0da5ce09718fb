package com.unparen;

import com.unparen.ast.ExpressionSyntax;
import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.SyntaxKind;
import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxTree;
import com.unparen.ast.TokenKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static com.unparen.ast.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class ParenthesizedExpressionsTest {

    private static boolean removable(SyntaxNode root, ParenthesizedExpression node) {
        return ParenthesizedExpressions.canRemoveParentheses(SyntaxTree.of(root), node);
    }

    private static boolean removable(SyntaxNode root, ParenthesizedExpression node, AssociativityOracle oracle) {
        return ParenthesizedExpressions.canRemoveParentheses(SyntaxTree.of(root), node, oracle);
    }

    static Stream<Supplier<ExpressionSyntax>> innerExpressions() {
        return Stream.of(
            () -> identifier("x"),
            () -> numericLiteral("1"),
            () -> binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), identifier("b")),
            () -> binary(SyntaxKind.LESS_THAN_EXPRESSION, identifier("a"), identifier("b")),
            () -> conditional(identifier("c"), identifier("a"), identifier("b")),
            () -> assign(identifier("a"), identifier("b")),
            () -> lambda("x", identifier("x")),
            () -> conditionalAccess(identifier("a"), memberBinding("b")),
            () -> prefixUnary(SyntaxKind.PRE_INCREMENT_EXPRESSION, identifier("i")),
            () -> cast(identifier("T"), identifier("v")));
    }

    // ========================================================================
    // Nesting
    // ========================================================================

    @ParameterizedTest
    @MethodSource("innerExpressions")
    void testOuterOfDoubleParenthesesIsAlwaysRemovable(Supplier<ExpressionSyntax> inner) {
        ParenthesizedExpression outer = parenthesized(parenthesized(inner.get()));
        SyntaxNode root = binary(SyntaxKind.MULTIPLY_EXPRESSION, identifier("k"), outer);
        assertTrue(removable(root, outer), "((E)) -> (E) must always be allowed");
    }

    @ParameterizedTest
    @MethodSource("innerExpressions")
    void testInnerOfDoubleParenthesesIsAlwaysRemovable(Supplier<ExpressionSyntax> inner) {
        ParenthesizedExpression nested = parenthesized(inner.get());
        SyntaxNode root = binary(SyntaxKind.MULTIPLY_EXPRESSION, identifier("k"), parenthesized(nested));
        assertTrue(removable(root, nested));
    }

    // ========================================================================
    // Precedence
    // ========================================================================

    private static final Set<SyntaxKind> TYPE_TESTS = EnumSet.of(SyntaxKind.IS_EXPRESSION, SyntaxKind.AS_EXPRESSION);

    static Stream<Arguments> binaryKindPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (SyntaxKind parent : SyntaxKind.values()) {
            if (!parent.isBinaryExpression() || TYPE_TESTS.contains(parent)) {
                continue;
            }
            for (SyntaxKind inner : SyntaxKind.values()) {
                if (inner.isBinaryExpression() && !TYPE_TESTS.contains(inner)) {
                    pairs.add(Arguments.of(parent, inner));
                }
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest
    @MethodSource("binaryKindPairs")
    void testRightOperandFollowsPrecedence(SyntaxKind parentKind, SyntaxKind innerKind) {
        ParenthesizedExpression node = parenthesized(binary(innerKind, identifier("b"), identifier("c")));
        SyntaxNode root = binary(parentKind, identifier("a"), node);

        OperatorPrecedence inner = PrecedenceTable.precedenceOf(innerKind);
        OperatorPrecedence parent = PrecedenceTable.precedenceOf(parentKind);
        boolean rightAssociative = parentKind == SyntaxKind.COALESCE_EXPRESSION && inner == parent;
        if (inner.bindsTighterThan(parent) || rightAssociative) {
            assertTrue(removable(root, node), parentKind + " over " + innerKind);
        } else {
            // looser binds differently; equal regroups and the default oracle refuses
            assertFalse(removable(root, node), parentKind + " over " + innerKind);
        }
    }

    @Test
    void testLeftOperandOfSameLeftAssociativeOperatorIsRemovable() {
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.SUBTRACT_EXPRESSION, identifier("a"), identifier("b")));
        SyntaxNode root = binary(SyntaxKind.SUBTRACT_EXPRESSION, node, identifier("c"));
        assertTrue(removable(root, node), "(a - b) - c");
    }

    @Test
    void testNullCoalescingAssociatesToTheRight() {
        ParenthesizedExpression right = parenthesized(binary(SyntaxKind.COALESCE_EXPRESSION, identifier("b"), identifier("c")));
        assertTrue(removable(binary(SyntaxKind.COALESCE_EXPRESSION, identifier("a"), right), right), "a ?? (b ?? c)");

        ParenthesizedExpression left = parenthesized(binary(SyntaxKind.COALESCE_EXPRESSION, identifier("a"), identifier("b")));
        assertFalse(removable(binary(SyntaxKind.COALESCE_EXPRESSION, left, identifier("c")), left), "(a ?? b) ?? c");
    }

    @Test
    void testAssignmentOnLeftOfAssignmentIsKept() {
        ParenthesizedExpression node = parenthesized(assign(identifier("a"), identifier("b")));
        assertFalse(removable(assign(node, identifier("c")), node), "(a = b) = c");
    }

    @Test
    void testAssignmentOnRightOfAssignmentIsRemovable() {
        ParenthesizedExpression node = parenthesized(assign(identifier("b"), identifier("c")));
        assertTrue(removable(assign(identifier("a"), node), node), "a = (b = c)");
    }

    // ========================================================================
    // Associativity and the oracle
    // ========================================================================

    @Test
    void testAssociativeRegroupingFollowsOracle() {
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.ADD_EXPRESSION, identifier("b"), identifier("c")));
        SyntaxNode root = binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), node);

        assertTrue(removable(root, node, (inner, parent) -> true), "oracle approves a + (b + c)");
        assertFalse(removable(root, node, (inner, parent) -> false), "oracle refuses a + (b + c)");
        assertFalse(removable(root, node), "default oracle refuses");
    }

    @Test
    void testOracleReceivesInnerAndParent() {
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.LOGICAL_AND_EXPRESSION, identifier("b"), identifier("c")));
        SyntaxNode root = binary(SyntaxKind.LOGICAL_AND_EXPRESSION, identifier("a"), node);

        List<SyntaxNode> seen = new ArrayList<>();
        removable(root, node, (inner, parent) -> {
            seen.add(inner);
            seen.add(parent);
            return true;
        });
        assertEquals(2, seen.size());
        assertSame(node.expression(), seen.get(0));
        assertSame(root, seen.get(1));
    }

    @Test
    void testOracleIsNotConsultedForNonAssociativeOperators() {
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.SUBTRACT_EXPRESSION, identifier("b"), identifier("c")));
        SyntaxNode root = binary(SyntaxKind.SUBTRACT_EXPRESSION, identifier("a"), node);
        assertFalse(removable(root, node, (inner, parent) -> fail("oracle consulted")), "a - (b - c)");
    }

    // ========================================================================
    // Literals, this and names
    // ========================================================================

    static Stream<Supplier<ExpressionSyntax>> atoms() {
        return Stream.of(
            () -> numericLiteral("42"),
            () -> stringLiteral("s"),
            () -> characterLiteral('c'),
            () -> trueLiteral(),
            () -> falseLiteral(),
            () -> nullLiteral(),
            () -> defaultLiteral(),
            () -> thisExpression(),
            () -> identifier("x"),
            () -> dottedName("a.b"),
            () -> dottedName("a.b.c.d"),
            () -> qualifiedName("System.Collections.Generic"));
    }

    @ParameterizedTest
    @MethodSource("atoms")
    void testAtomIsRemovableAsOperand(Supplier<ExpressionSyntax> atom) {
        ParenthesizedExpression node = parenthesized(atom.get());
        SyntaxNode root = binary(SyntaxKind.MULTIPLY_EXPRESSION, identifier("a"), node);
        assertTrue(removable(root, node));
    }

    @ParameterizedTest
    @MethodSource("atoms")
    void testAtomIsRemovableAsArgument(Supplier<ExpressionSyntax> atom) {
        ParenthesizedExpression node = parenthesized(atom.get());
        assertTrue(removable(invocation(identifier("F"), node, identifier("y")), node));
    }

    @ParameterizedTest
    @MethodSource("atoms")
    void testAtomIsRemovableAsMemberAccessTarget(Supplier<ExpressionSyntax> atom) {
        ParenthesizedExpression node = parenthesized(atom.get());
        assertTrue(removable(invocation(memberAccess(node, "ToString")), node));
    }

    @ParameterizedTest
    @MethodSource("atoms")
    void testAtomIsRemovableInInterpolation(Supplier<ExpressionSyntax> atom) {
        ParenthesizedExpression node = parenthesized(atom.get());
        assertTrue(removable(interpolatedString(interpolatedText("v="), interpolation(node)), node));
    }

    // ========================================================================
    // Comma-list ambiguity
    // ========================================================================

    @Test
    void testNameBeforeGenericLookingComparisonIsKept() {
        // F((a) < b, c > (d))
        ParenthesizedExpression node = parenthesized(identifier("a"));
        SyntaxNode root = invocation(identifier("F"),
            binary(SyntaxKind.LESS_THAN_EXPRESSION, node, identifier("b")),
            binary(SyntaxKind.GREATER_THAN_EXPRESSION, identifier("c"), parenthesized(identifier("d"))));
        assertFalse(removable(root, node));
    }

    @Test
    void testNameOnRightOfLessThanIsKept() {
        // F(a < (b), c > (d))
        ParenthesizedExpression node = parenthesized(identifier("b"));
        SyntaxNode root = invocation(identifier("F"),
            binary(SyntaxKind.LESS_THAN_EXPRESSION, identifier("a"), node),
            binary(SyntaxKind.GREATER_THAN_EXPRESSION, identifier("c"), parenthesized(identifier("d"))));
        assertFalse(removable(root, node));
    }

    @Test
    void testNameBeforeGreaterThanWithPlainOperandIsRemovable() {
        // F(a < b, (c) > d)
        ParenthesizedExpression node = parenthesized(identifier("c"));
        SyntaxNode root = invocation(identifier("F"),
            binary(SyntaxKind.LESS_THAN_EXPRESSION, identifier("a"), identifier("b")),
            binary(SyntaxKind.GREATER_THAN_EXPRESSION, node, identifier("d")));
        assertTrue(removable(root, node));
    }

    @Test
    void testNameBeforeGreaterThanWithParenthesizedOperandIsKept() {
        // F(a < b, (c) > (d))
        ParenthesizedExpression node = parenthesized(identifier("c"));
        SyntaxNode root = invocation(identifier("F"),
            binary(SyntaxKind.LESS_THAN_EXPRESSION, identifier("a"), identifier("b")),
            binary(SyntaxKind.GREATER_THAN_EXPRESSION, node, parenthesized(identifier("d"))));
        assertFalse(removable(root, node));
    }

    @Test
    void testParenthesizedComparisonInsideInitializerIsKept() {
        // { (a < b), c > (d) }
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.LESS_THAN_EXPRESSION, identifier("a"), identifier("b")));
        SyntaxNode root = initializer(SyntaxKind.ARRAY_INITIALIZER_EXPRESSION, node,
            binary(SyntaxKind.GREATER_THAN_EXPRESSION, identifier("c"), parenthesized(identifier("d"))));
        assertFalse(removable(root, node));
    }

    @Test
    void testComparisonWithoutNeighbourIsRemovable() {
        // F((a < b))
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.LESS_THAN_EXPRESSION, identifier("a"), identifier("b")));
        assertTrue(removable(invocation(identifier("F"), node), node));
    }

    // ========================================================================
    // Cast ambiguity
    // ========================================================================

    @Test
    void testUnaryMinusUnderNameCastIsKept() {
        // (x)(-y)
        ParenthesizedExpression node = parenthesized(prefixUnary(SyntaxKind.UNARY_MINUS_EXPRESSION, identifier("y")));
        assertFalse(removable(cast(identifier("x"), node), node));
    }

    @Test
    void testUnaryMinusUnderPredefinedTypeCastIsRemovable() {
        // (int)(-y)
        ParenthesizedExpression node = parenthesized(prefixUnary(SyntaxKind.UNARY_MINUS_EXPRESSION, identifier("y")));
        assertTrue(removable(cast(predefinedType("int"), node), node));
    }

    @Test
    void testUnaryMinusUnderAliasQualifiedCastIsRemovable() {
        // (global::X)(-y)
        ParenthesizedExpression node = parenthesized(prefixUnary(SyntaxKind.UNARY_MINUS_EXPRESSION, identifier("y")));
        assertTrue(removable(cast(aliasQualifiedName("global", "X"), node), node));

        // (global::X.Y)(-y)
        ParenthesizedExpression dotted = parenthesized(prefixUnary(SyntaxKind.UNARY_MINUS_EXPRESSION, identifier("y")));
        assertTrue(removable(cast(qualifiedName(aliasQualifiedName("global", "X"), "Y"), dotted), dotted));
    }

    @Test
    void testPreIncrementUnderCastIsKept() {
        // (T)(++x)
        ParenthesizedExpression node = parenthesized(prefixUnary(SyntaxKind.PRE_INCREMENT_EXPRESSION, identifier("x")));
        assertFalse(removable(cast(predefinedType("int"), node), node));
    }

    @Test
    void testThisUnderCastIsRemovable() {
        ParenthesizedExpression node = parenthesized(thisExpression());
        assertTrue(removable(cast(identifier("C"), node), node));
    }

    // ========================================================================
    // Interpolation ambiguity
    // ========================================================================

    @Test
    void testConditionalInInterpolationIsKept() {
        // $"{(a ? b : c)}"
        ParenthesizedExpression node = parenthesized(conditional(identifier("a"), identifier("b"), identifier("c")));
        assertFalse(removable(interpolatedString(interpolation(node)), node));
    }

    @Test
    void testAliasQualifiedNameInInterpolationIsKept() {
        // $"{(global::X)}"
        ParenthesizedExpression node = parenthesized(aliasQualifiedName("global", "X"));
        assertFalse(removable(interpolatedString(interpolation(node)), node));
    }

    @Test
    void testAssignedConditionalInInterpolationIsKept() {
        // $"{x = (a ? b : c)}"
        ParenthesizedExpression node = parenthesized(conditional(identifier("a"), identifier("b"), identifier("c")));
        SyntaxNode root = interpolatedString(interpolation(assign(identifier("x"), node)));
        assertFalse(removable(root, node));
    }

    @Test
    void testColonBehindAnotherParenthesisIsRemovable() {
        // $"{(f((a ? b : c)))}"
        ParenthesizedExpression node = parenthesized(
            invocation(identifier("f"), parenthesized(conditional(identifier("a"), identifier("b"), identifier("c")))));
        assertTrue(removable(interpolatedString(interpolation(node)), node));
    }

    @Test
    void testInterpolationWithFormatClauseStillAllowsPlainOperand() {
        // $"{(a + b):N2}"
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), identifier("b")));
        assertTrue(removable(interpolatedString(interpolation(node, "N2")), node));
    }

    // ========================================================================
    // Structural checks
    // ========================================================================

    @Test
    void testMissingCloseParenthesisIsAlwaysKept() {
        ParenthesizedExpression node = new ParenthesizedExpression(
            token(TokenKind.OPEN_PAREN), parenthesized(identifier("x")), missingToken(TokenKind.CLOSE_PAREN));
        assertFalse(removable(expressionStatement(node), node));
    }

    @Test
    void testMissingOpenParenthesisIsAlwaysKept() {
        ParenthesizedExpression node = new ParenthesizedExpression(
            missingToken(TokenKind.OPEN_PAREN), numericLiteral("3"), token(TokenKind.CLOSE_PAREN));
        assertFalse(removable(localDeclaration(identifier("var"), "x", node), node));
    }

    @Test
    void testStackAllocIsAlwaysKept() {
        ParenthesizedExpression node = parenthesized(stackAlloc(arrayType(predefinedType("byte"))));
        assertFalse(removable(localDeclaration(identifier("var"), "span", node), node));
    }

    @Test
    void testFusingOperatorsAreKept() {
        ParenthesizedExpression plus = parenthesized(prefixUnary(SyntaxKind.UNARY_PLUS_EXPRESSION, identifier("b")));
        assertFalse(removable(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), plus), plus), "a + (+b)");

        ParenthesizedExpression minus = parenthesized(prefixUnary(SyntaxKind.PRE_DECREMENT_EXPRESSION, identifier("b")));
        assertFalse(removable(binary(SyntaxKind.SUBTRACT_EXPRESSION, identifier("a"), minus), minus), "a - (--b)");

        ParenthesizedExpression negated = parenthesized(prefixUnary(SyntaxKind.UNARY_MINUS_EXPRESSION, identifier("b")));
        assertTrue(removable(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), negated), negated), "a + (-b)");
    }

    // ========================================================================
    // Contexts
    // ========================================================================

    static Stream<Arguments> statementSlots() {
        return Stream.of(
            Arguments.of("if", (SlotBuilder) e -> ifStatement(e, block())),
            Arguments.of("while", (SlotBuilder) e -> whileStatement(e, block())),
            Arguments.of("do", (SlotBuilder) e -> doStatement(block(), e)),
            Arguments.of("for", (SlotBuilder) e -> forStatement(e, List.of(), block())),
            Arguments.of("foreach", (SlotBuilder) e -> forEachStatement(identifier("var"), "item", e, block())),
            Arguments.of("lock", (SlotBuilder) e -> lockStatement(e, block())),
            Arguments.of("using", (SlotBuilder) e -> usingStatement(e, block())),
            Arguments.of("switch", (SlotBuilder) e -> switchStatement(e, switchSection(defaultLabel()))),
            Arguments.of("return", (SlotBuilder) e -> returnStatement(e)),
            Arguments.of("yield return", (SlotBuilder) e -> yieldReturn(e)),
            Arguments.of("throw", (SlotBuilder) e -> throwStatement(e)),
            Arguments.of("expression statement", (SlotBuilder) e -> expressionStatement(e)),
            Arguments.of("declaration", (SlotBuilder) e -> localDeclaration(identifier("var"), "v", e)),
            Arguments.of("catch filter", (SlotBuilder) e -> tryStatement(block(), catchClause(e, block()))),
            Arguments.of("expression body", (SlotBuilder) e -> property(predefinedType("int"), "P", e)),
            Arguments.of("checked", (SlotBuilder) e -> checked(SyntaxKind.CHECKED_EXPRESSION, e)),
            Arguments.of("case label", (SlotBuilder) e -> switchStatement(identifier("s"), switchSection(caseLabel(e)))),
            Arguments.of("when clause", (SlotBuilder) e -> switchStatement(identifier("s"),
                switchSection(casePatternLabel(discardPattern(), e)))),
            Arguments.of("case pattern", (SlotBuilder) e -> switchStatement(identifier("s"),
                switchSection(casePatternLabel(constantPattern(e), null)))),
            Arguments.of("#if", (SlotBuilder) e -> ifDirective(e)),
            Arguments.of("#elif", (SlotBuilder) e -> elifDirective(e)),
            Arguments.of("switch arm", (SlotBuilder) e -> switchExpression(identifier("s"), switchArm(discardPattern(), e))),
            Arguments.of("where", (SlotBuilder) e -> query(fromClause("x", identifier("xs")), List.of(whereClause(e)),
                selectClause(identifier("x")))),
            Arguments.of("lambda body", (SlotBuilder) e -> lambda("x", e)),
            Arguments.of("conditional arm", (SlotBuilder) e -> conditional(identifier("c"), e, identifier("d"))),
            Arguments.of("assignment value", (SlotBuilder) e -> assign(identifier("v"), e)));
    }

    @FunctionalInterface
    interface SlotBuilder {
        SyntaxNode wrap(ExpressionSyntax expression);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("statementSlots")
    void testLowPrecedenceExpressionInSlotIsRemovable(String slot, SlotBuilder builder) {
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.LOGICAL_OR_EXPRESSION, identifier("a"), identifier("b")));
        assertTrue(removable(builder.wrap(node), node), slot);
    }

    @Test
    void testConditionalInIfConditionIsRemovable() {
        ParenthesizedExpression node = parenthesized(conditional(identifier("a"), identifier("b"), identifier("c")));
        assertTrue(removable(ifStatement(node, block()), node));
    }

    @Test
    void testThrowExpressionIsRemovable() {
        // x ?? (throw e)
        ParenthesizedExpression node = parenthesized(throwExpression(identifier("e")));
        assertTrue(removable(binary(SyntaxKind.COALESCE_EXPRESSION, identifier("x"), node), node));
    }

    @Test
    void testTupleIsRemovable() {
        ParenthesizedExpression node = parenthesized(tuple(identifier("a"), identifier("b")));
        assertTrue(removable(invocation(memberAccess(node, "ToString")), node));
    }

    @Test
    void testInterpolatedStringIsRemovable() {
        ParenthesizedExpression node = parenthesized(interpolatedString(interpolatedText("x")));
        assertTrue(removable(invocation(memberAccess(node, "Trim")), node));
    }

    @Test
    void testAssignmentInInitializerIsKept() {
        ParenthesizedExpression assignment = parenthesized(assign(identifier("a"), identifier("b")));
        assertFalse(removable(initializer(SyntaxKind.COLLECTION_INITIALIZER_EXPRESSION, assignment), assignment));

        ParenthesizedExpression sum = parenthesized(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), identifier("b")));
        assertTrue(removable(initializer(SyntaxKind.COLLECTION_INITIALIZER_EXPRESSION, sum), sum));
    }

    @Test
    void testAssignmentInAnonymousMemberNeedsName() {
        ParenthesizedExpression unnamed = parenthesized(assign(identifier("a"), identifier("b")));
        assertFalse(removable(anonymousObject(anonymousMember(null, unnamed)), unnamed), "new { (a = b) }");

        ParenthesizedExpression named = parenthesized(assign(identifier("a"), identifier("b")));
        assertTrue(removable(anonymousObject(anonymousMember("X", named)), named), "new { X = (a = b) }");
    }

    @Test
    void testConditionalOnLeftOfAssignmentIsKept() {
        // (c ? ref a : ref b) = v
        ParenthesizedExpression node = parenthesized(
            conditional(identifier("c"), ref(identifier("a")), ref(identifier("b"))));
        assertFalse(removable(assign(node, identifier("v")), node));
    }

    @Test
    void testConditionalAccessIsKept() {
        // (a?.b).c
        ParenthesizedExpression node = parenthesized(conditionalAccess(identifier("a"), memberBinding("b")));
        assertFalse(removable(memberAccess(node, "c"), node));
    }

    @Test
    void testIsPatternUsesExpressionAsParent() {
        // x is (a + b)
        ParenthesizedExpression sum = parenthesized(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), identifier("b")));
        assertTrue(removable(isPattern(identifier("x"), constantPattern(sum)), sum));

        // x is (a == b)
        ParenthesizedExpression equality = parenthesized(binary(SyntaxKind.EQUALS_EXPRESSION, identifier("a"), identifier("b")));
        assertFalse(removable(isPattern(identifier("x"), constantPattern(equality)), equality));
    }

    @Test
    void testNoEnclosingExpressionIsKept() {
        // from x in xs select (a + b)
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), identifier("b")));
        SyntaxNode root = query(fromClause("x", identifier("xs")), List.of(), selectClause(node));
        assertFalse(removable(root, node));
    }

    @Test
    void testUnrankedInnerExpressionIsKept() {
        // a + (ref b)
        ParenthesizedExpression node = parenthesized(ref(identifier("b")));
        assertFalse(removable(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), node), node));
    }

    // ========================================================================
    // Deep trees
    // ========================================================================

    private static final int DEEP_CHAIN_LENGTH = 20_000;

    @Test
    void testDeepLeftChainAroundParenthesizedOperand() {
        // return (s0) + s1 + ... + sN;
        ParenthesizedExpression node = parenthesized(identifier("s0"));
        ExpressionSyntax chain = node;
        for (int i = 1; i <= DEEP_CHAIN_LENGTH; i++) {
            chain = binary(SyntaxKind.ADD_EXPRESSION, chain, identifier("s" + i));
        }
        assertTrue(removable(returnStatement(chain), node));
    }

    @Test
    void testDeepChainInsideParentheses() {
        // return (s0 + s1 + ... + sN);
        ExpressionSyntax chain = identifier("s0");
        for (int i = 1; i <= DEEP_CHAIN_LENGTH; i++) {
            chain = binary(SyntaxKind.ADD_EXPRESSION, chain, identifier("s" + i));
        }
        ParenthesizedExpression node = parenthesized(chain);
        assertTrue(removable(returnStatement(node), node));
    }

    @Test
    void testDeepChainWithGroupedTail() {
        // return s0 - s1 - ... - (a - b);
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.SUBTRACT_EXPRESSION, identifier("a"), identifier("b")));
        ExpressionSyntax chain = identifier("s0");
        for (int i = 1; i < DEEP_CHAIN_LENGTH; i++) {
            chain = binary(SyntaxKind.SUBTRACT_EXPRESSION, chain, identifier("s" + i));
        }
        chain = binary(SyntaxKind.SUBTRACT_EXPRESSION, chain, node);
        assertFalse(removable(returnStatement(chain), node));
    }

    @Test
    void testNodeOutsideTreeIsRejected() {
        ParenthesizedExpression node = parenthesized(identifier("x"));
        SyntaxTree tree = SyntaxTree.of(expressionStatement(identifier("y")));
        assertThrows(IllegalArgumentException.class,
            () -> ParenthesizedExpressions.canRemoveParentheses(tree, node, AssociativityOracle.never()));
    }
}
