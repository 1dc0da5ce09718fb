package com.unparen;

import com.unparen.ast.AliasQualifiedName;
import com.unparen.ast.ArgumentList;
import com.unparen.ast.ArgumentSyntax;
import com.unparen.ast.ArrayType;
import com.unparen.ast.BinaryExpression;
import com.unparen.ast.CastExpression;
import com.unparen.ast.ExpressionSyntax;
import com.unparen.ast.InitializerExpression;
import com.unparen.ast.Interpolation;
import com.unparen.ast.NameSyntax;
import com.unparen.ast.NullableType;
import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.PointerType;
import com.unparen.ast.PredefinedType;
import com.unparen.ast.QualifiedName;
import com.unparen.ast.SyntaxElement;
import com.unparen.ast.SyntaxKind;
import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxToken;
import com.unparen.ast.SyntaxTree;
import com.unparen.ast.TokenKind;
import com.unparen.ast.TypeSyntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Lexical and grammatical ambiguities that precedence alone does not see.
 * Each detector returns {@code true} when removing the parentheses could make
 * the surrounding text parse differently.
 */
public final class AmbiguityDetectors {

    private AmbiguityDetectors() {
    }

    public static boolean mayIntroduceAmbiguity(SyntaxTree tree, ParenthesizedExpression node) {
        return mayIntroduceCastAmbiguity(tree, node)
            || mayIntroduceCommaListAmbiguity(tree, node)
            || mayIntroduceInterpolationAmbiguity(tree, node);
    }

    // ========================================================================
    // Cast ambiguity
    // ========================================================================

    /**
     * {@code (x)(-y)} is a cast only because of the parentheses around
     * {@code -y}; without them {@code (x)-y} is a subtraction. The same holds
     * for unary {@code +}, {@code *} and {@code &}. A cast whose type cannot be
     * read as an expression is never ambiguous.
     */
    public static boolean mayIntroduceCastAmbiguity(SyntaxTree tree, ParenthesizedExpression node) {
        if (!(tree.parent(node) instanceof CastExpression cast)) {
            return false;
        }
        if (isUnambiguousType(cast.type())) {
            return false;
        }
        return node.expression().isKind(
            SyntaxKind.UNARY_MINUS_EXPRESSION,
            SyntaxKind.UNARY_PLUS_EXPRESSION,
            SyntaxKind.POINTER_INDIRECTION_EXPRESSION,
            SyntaxKind.ADDRESS_OF_EXPRESSION);
    }

    private static boolean isUnambiguousType(TypeSyntax type) {
        if (type instanceof PredefinedType || type instanceof ArrayType
            || type instanceof PointerType || type instanceof NullableType) {
            return true;
        }
        return type instanceof NameSyntax name && startsWithAlias(name);
    }

    // global::X, global::X.Y
    private static boolean startsWithAlias(NameSyntax name) {
        if (name instanceof AliasQualifiedName) {
            return true;
        }
        if (name instanceof QualifiedName qualified) {
            return startsWithAlias(qualified.left());
        }
        return false;
    }

    // ========================================================================
    // Comma-list ambiguity
    // ========================================================================

    /**
     * Inside an argument or initializer list, {@code a < b, c > (d)} reads as
     * a generic name {@code a<b, c>} applied to {@code (d)} once enough
     * parentheses are gone. Only the adjacent list element is inspected.
     */
    public static boolean mayIntroduceCommaListAmbiguity(SyntaxTree tree, ParenthesizedExpression node) {
        ExpressionSyntax expression = node.expression();
        if (isSimpleOrDottedName(expression)) {
            // F((x) < x, x > (1 + 2)), F(x < (x), x > (1 + 2)), F(x < x, (x) > (1 + 2))
            if (!(tree.parent(node) instanceof BinaryExpression binary)
                || !binary.isKind(SyntaxKind.LESS_THAN_EXPRESSION, SyntaxKind.GREATER_THAN_EXPRESSION)) {
                return false;
            }
            SyntaxNode listSlot = tree.parent(binary);
            if (!(listSlot instanceof ArgumentSyntax) && !(listSlot instanceof InitializerExpression)) {
                return false;
            }
            if (binary.kind() == SyntaxKind.LESS_THAN_EXPRESSION) {
                boolean nameComparison = (binary.left() == node && isSimpleOrDottedName(binary.right()))
                    || (binary.right() == node && isSimpleOrDottedName(binary.left()));
                return nameComparison && isNextExpressionPotentiallyAmbiguous(tree, binary);
            }
            return binary.left() == node
                && binary.right().isKind(SyntaxKind.PARENTHESIZED_EXPRESSION, SyntaxKind.CAST_EXPRESSION)
                && isPreviousExpressionPotentiallyAmbiguous(tree, binary);
        }
        if (expression.kind() == SyntaxKind.LESS_THAN_EXPRESSION) {
            // F((x < x), x > (1 + 2))
            return isNextExpressionPotentiallyAmbiguous(tree, node);
        }
        if (expression.kind() == SyntaxKind.GREATER_THAN_EXPRESSION) {
            // F(x < x, (x > (1 + 2)))
            return isPreviousExpressionPotentiallyAmbiguous(tree, node);
        }
        return false;
    }

    private static boolean isPreviousExpressionPotentiallyAmbiguous(SyntaxTree tree, ExpressionSyntax node) {
        ExpressionSyntax previous = siblingInList(tree, node, -1);
        if (!(previous instanceof BinaryExpression lessThan) || lessThan.kind() != SyntaxKind.LESS_THAN_EXPRESSION) {
            return false;
        }
        return (isSimpleOrDottedName(lessThan.left()) || lessThan.left() instanceof CastExpression)
            && isSimpleOrDottedName(lessThan.right());
    }

    private static boolean isNextExpressionPotentiallyAmbiguous(SyntaxTree tree, ExpressionSyntax node) {
        ExpressionSyntax next = siblingInList(tree, node, 1);
        if (!(next instanceof BinaryExpression greaterThan) || greaterThan.kind() != SyntaxKind.GREATER_THAN_EXPRESSION) {
            return false;
        }
        return isSimpleOrDottedName(greaterThan.left())
            && greaterThan.right().isKind(SyntaxKind.PARENTHESIZED_EXPRESSION, SyntaxKind.CAST_EXPRESSION);
    }

    /**
     * The expression {@code offset} places away from {@code node} in its
     * argument list or initializer, or {@code null}.
     */
    private static ExpressionSyntax siblingInList(SyntaxTree tree, ExpressionSyntax node, int offset) {
        SyntaxNode parent = tree.parent(node);
        if (parent instanceof ArgumentSyntax argument) {
            if (tree.parent(argument) instanceof ArgumentList list) {
                ArgumentSyntax sibling = elementAt(list.arguments(), indexOf(list.arguments(), argument) + offset);
                return sibling == null ? null : sibling.expression();
            }
        } else if (parent instanceof InitializerExpression initializer) {
            return elementAt(initializer.expressions(), indexOf(initializer.expressions(), node) + offset);
        }
        return null;
    }

    private static <T> T elementAt(List<T> list, int index) {
        return index >= 0 && index < list.size() ? list.get(index) : null;
    }

    private static int indexOf(List<? extends SyntaxElement> list, SyntaxElement element) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == element) {
                return i;
            }
        }
        return -1;
    }

    // ========================================================================
    // Interpolation ambiguity
    // ========================================================================

    /**
     * Inside {@code $"{...}"} the first bare {@code :} starts the format clause,
     * so {@code $"{(a ? b : c)}"} must keep its parentheses. A parenthesized
     * expression between the node and the hole already protects it.
     */
    public static boolean mayIntroduceInterpolationAmbiguity(SyntaxTree tree, ParenthesizedExpression node) {
        SyntaxNode parent = tree.parent(node);
        if (parent == null) {
            return false;
        }
        boolean insideHole = false;
        for (SyntaxNode ancestor : tree.ancestorsAndSelf(parent)) {
            if (ancestor instanceof ParenthesizedExpression) {
                return false;
            }
            if (ancestor instanceof Interpolation) {
                insideHole = true;
                break;
            }
        }
        if (!insideHole) {
            return false;
        }

        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(node.expression());
        while (!stack.isEmpty()) {
            for (SyntaxElement child : stack.pop().childNodesAndTokens()) {
                if (child instanceof SyntaxToken token) {
                    if (token.kind() == TokenKind.COLON || token.kind() == TokenKind.COLON_COLON) {
                        return true;
                    }
                } else if (!(child instanceof ParenthesizedExpression)) {
                    // colons inside nested parentheses are already unambiguous
                    stack.push((SyntaxNode) child);
                }
            }
        }
        return false;
    }

    /**
     * {@code x}, {@code A.B} as a qualified name, or {@code a.b} as member access.
     */
    public static boolean isSimpleOrDottedName(ExpressionSyntax expression) {
        return expression.isKind(
            SyntaxKind.IDENTIFIER_NAME,
            SyntaxKind.QUALIFIED_NAME,
            SyntaxKind.SIMPLE_MEMBER_ACCESS_EXPRESSION);
    }
}
