package com.unparen;

import com.unparen.ast.ExpressionSyntax;
import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.SyntaxKind;
import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxTree;
import com.unparen.ast.TypeSyntax;
import org.junit.jupiter.api.Test;

import static com.unparen.ast.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class AmbiguityDetectorsTest {

    private static ExpressionSyntax lessThan(ExpressionSyntax left, ExpressionSyntax right) {
        return binary(SyntaxKind.LESS_THAN_EXPRESSION, left, right);
    }

    private static ExpressionSyntax greaterThan(ExpressionSyntax left, ExpressionSyntax right) {
        return binary(SyntaxKind.GREATER_THAN_EXPRESSION, left, right);
    }

    private static SyntaxTree call(ExpressionSyntax... arguments) {
        return SyntaxTree.of(expressionStatement(invocation(identifier("F"), arguments)));
    }

    // ------------------------------------------------------------------
    // Casts
    // ------------------------------------------------------------------

    private static boolean castAmbiguity(TypeSyntax type, SyntaxKind unaryKind) {
        ParenthesizedExpression node = parenthesized(prefixUnary(unaryKind, identifier("y")));
        SyntaxTree tree = SyntaxTree.of(returnStatement(cast(type, node)));
        return AmbiguityDetectors.mayIntroduceCastAmbiguity(tree, node);
    }

    @Test
    void testCastToNameIsAmbiguous() {
        assertTrue(castAmbiguity(identifier("x"), SyntaxKind.UNARY_MINUS_EXPRESSION));
        assertTrue(castAmbiguity(identifier("x"), SyntaxKind.UNARY_PLUS_EXPRESSION));
        assertTrue(castAmbiguity(qualifiedName("A.B"), SyntaxKind.POINTER_INDIRECTION_EXPRESSION));
        assertTrue(castAmbiguity(identifier("x"), SyntaxKind.ADDRESS_OF_EXPRESSION));
    }

    @Test
    void testCastToTypeKeywordIsNotAmbiguous() {
        assertFalse(castAmbiguity(predefinedType("int"), SyntaxKind.UNARY_MINUS_EXPRESSION));
        assertFalse(castAmbiguity(arrayType(identifier("T")), SyntaxKind.UNARY_MINUS_EXPRESSION));
        assertFalse(castAmbiguity(pointerType(predefinedType("int")), SyntaxKind.POINTER_INDIRECTION_EXPRESSION));
        assertFalse(castAmbiguity(nullableType(predefinedType("int")), SyntaxKind.UNARY_MINUS_EXPRESSION));
        assertFalse(castAmbiguity(aliasQualifiedName("global", "X"), SyntaxKind.UNARY_MINUS_EXPRESSION));
        assertFalse(castAmbiguity(qualifiedName(aliasQualifiedName("global", "X"), "Y"), SyntaxKind.UNARY_MINUS_EXPRESSION));
    }

    @Test
    void testOtherUnaryOperandsAreNotAmbiguous() {
        assertFalse(castAmbiguity(identifier("x"), SyntaxKind.LOGICAL_NOT_EXPRESSION));
        assertFalse(castAmbiguity(identifier("x"), SyntaxKind.BITWISE_NOT_EXPRESSION));
    }

    // ------------------------------------------------------------------
    // Comma lists
    // ------------------------------------------------------------------

    @Test
    void testNameCompareBeforeGenericLookingSibling() {
        // F(a < (b), c > (d))
        ParenthesizedExpression node = parenthesized(identifier("b"));
        SyntaxTree tree = call(lessThan(identifier("a"), node), greaterThan(identifier("c"), parenthesized(identifier("d"))));
        assertTrue(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(tree, node));
    }

    @Test
    void testNameCompareOnTheLeft() {
        // F((a) < b, c > (d))
        ParenthesizedExpression node = parenthesized(identifier("a"));
        SyntaxTree tree = call(lessThan(node, identifier("b")), greaterThan(identifier("c"), parenthesized(identifier("d"))));
        assertTrue(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(tree, node));
    }

    @Test
    void testGreaterThanAfterGenericLookingSibling() {
        // F(a < b, (c) > (d))
        ParenthesizedExpression node = parenthesized(identifier("c"));
        SyntaxTree tree = call(lessThan(identifier("a"), identifier("b")), greaterThan(node, parenthesized(identifier("d"))));
        assertTrue(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(tree, node));
    }

    @Test
    void testWholeComparisonParenthesized() {
        // F((a < b), c > (d))
        ParenthesizedExpression first = parenthesized(lessThan(identifier("a"), identifier("b")));
        SyntaxTree tree = call(first, greaterThan(identifier("c"), parenthesized(identifier("d"))));
        assertTrue(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(tree, first));

        // F(a < b, (c > (d)))
        ParenthesizedExpression second = parenthesized(greaterThan(identifier("c"), parenthesized(identifier("d"))));
        SyntaxTree other = call(lessThan(identifier("a"), identifier("b")), second);
        assertTrue(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(other, second));
    }

    @Test
    void testInitializerListIsInspected() {
        // new[] { (a < b), c > (d) }
        ParenthesizedExpression node = parenthesized(lessThan(identifier("a"), identifier("b")));
        SyntaxNode root = initializer(SyntaxKind.ARRAY_INITIALIZER_EXPRESSION, node,
            greaterThan(identifier("c"), parenthesized(identifier("d"))));
        assertTrue(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(SyntaxTree.of(root), node));
    }

    @Test
    void testUnrelatedListsAreNotAmbiguous() {
        // F(a < (b), c)
        ParenthesizedExpression node = parenthesized(identifier("b"));
        assertFalse(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(call(lessThan(identifier("a"), node), identifier("c")),
            node));

        // F(a < (b), c > d)
        ParenthesizedExpression plain = parenthesized(identifier("b"));
        assertFalse(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(
            call(lessThan(identifier("a"), plain), greaterThan(identifier("c"), identifier("d"))), plain));

        // F(a < (1), c > (d))
        ParenthesizedExpression literal = parenthesized(numericLiteral("1"));
        assertFalse(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(
            call(lessThan(identifier("a"), literal), greaterThan(identifier("c"), parenthesized(identifier("d")))), literal));

        // x = a < (b)
        ParenthesizedExpression assigned = parenthesized(identifier("b"));
        SyntaxTree tree = SyntaxTree.of(expressionStatement(assign(identifier("x"), lessThan(identifier("a"), assigned))));
        assertFalse(AmbiguityDetectors.mayIntroduceCommaListAmbiguity(tree, assigned));
    }

    // ------------------------------------------------------------------
    // Interpolations
    // ------------------------------------------------------------------

    private static ParenthesizedExpression conditionalInParentheses() {
        return parenthesized(conditional(identifier("a"), identifier("b"), identifier("c")));
    }

    @Test
    void testColonInsideHoleIsAmbiguous() {
        ParenthesizedExpression node = conditionalInParentheses();
        SyntaxTree tree = SyntaxTree.of(interpolatedString(interpolation(node)));
        assertTrue(AmbiguityDetectors.mayIntroduceInterpolationAmbiguity(tree, node));

        ParenthesizedExpression nested = conditionalInParentheses();
        SyntaxTree call = SyntaxTree.of(interpolatedString(interpolation(invocation(identifier("f"), nested))));
        assertTrue(AmbiguityDetectors.mayIntroduceInterpolationAmbiguity(call, nested));

        ParenthesizedExpression alias = parenthesized(aliasQualifiedName("global", "X"));
        SyntaxTree aliased = SyntaxTree.of(interpolatedString(interpolation(memberAccess(alias, "Y"))));
        assertTrue(AmbiguityDetectors.mayIntroduceInterpolationAmbiguity(aliased, alias));
    }

    @Test
    void testOuterParenthesesProtectTheHole() {
        ParenthesizedExpression inner = conditionalInParentheses();
        SyntaxTree tree = SyntaxTree.of(interpolatedString(interpolation(parenthesized(inner))));
        assertFalse(AmbiguityDetectors.mayIntroduceInterpolationAmbiguity(tree, inner));
    }

    @Test
    void testColonsInsideNestedParenthesesAreIgnored() {
        // $"{(f((a ? b : c)))}"
        ParenthesizedExpression node = parenthesized(invocation(identifier("f"), conditionalInParentheses()));
        SyntaxTree tree = SyntaxTree.of(interpolatedString(interpolation(node)));
        assertFalse(AmbiguityDetectors.mayIntroduceInterpolationAmbiguity(tree, node));
    }

    @Test
    void testNoColonOrNoHole() {
        ParenthesizedExpression sum = parenthesized(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), identifier("b")));
        assertFalse(AmbiguityDetectors.mayIntroduceInterpolationAmbiguity(
            SyntaxTree.of(interpolatedString(interpolation(sum))), sum));

        ParenthesizedExpression outside = conditionalInParentheses();
        assertFalse(AmbiguityDetectors.mayIntroduceInterpolationAmbiguity(
            SyntaxTree.of(returnStatement(outside)), outside));
    }

    @Test
    void testSimpleOrDottedName() {
        assertTrue(AmbiguityDetectors.isSimpleOrDottedName(identifier("x")));
        assertTrue(AmbiguityDetectors.isSimpleOrDottedName(qualifiedName("A.B")));
        assertTrue(AmbiguityDetectors.isSimpleOrDottedName(memberAccess(identifier("a"), "b")));
        assertFalse(AmbiguityDetectors.isSimpleOrDottedName(numericLiteral("1")));
        assertFalse(AmbiguityDetectors.isSimpleOrDottedName(aliasQualifiedName("global", "X")));
        assertFalse(AmbiguityDetectors.isSimpleOrDottedName(invocation(identifier("f"))));
    }
}
