package com.unparen;

import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.StackAllocArrayCreationExpression;
import com.unparen.ast.SyntaxToken;
import com.unparen.ast.SyntaxTree;

/**
 * Shape and token checks that refuse a removal before any context is looked at.
 */
public final class StructuralSafetyFilter {

    // Last character before '(' followed by first character of the inner expression
    private static final String[] FUSING_PAIRS = {
        "++",   // a + (+b)  ->  a ++b
        "--",   // a - (-b)  ->  a --b
        "&&",   // a & (&b)  ->  a &&b
        "/*",   // a / (*p)  ->  a /*p, a comment
    };

    private StructuralSafetyFilter() {
    }

    public static boolean isStructurallySafe(SyntaxTree tree, ParenthesizedExpression node) {
        return !node.hasMissingDelimiter() && !wrapsStackAlloc(node) && !wouldFuseTokens(tree, node);
    }

    /**
     * {@code (stackalloc T[n])} keeps its parentheses in every context.
     */
    public static boolean wrapsStackAlloc(ParenthesizedExpression node) {
        return node.expression() instanceof StackAllocArrayCreationExpression;
    }

    /**
     * Whether the token before the open parenthesis and the first token of the
     * inner expression would lex as a single different token once adjacent.
     */
    public static boolean wouldFuseTokens(SyntaxTree tree, ParenthesizedExpression node) {
        SyntaxToken before = tree.previousToken(node.openParenToken());
        SyntaxToken first = tree.firstToken(node.expression());
        if (before == null || first == null || before.text().isEmpty() || first.text().isEmpty()) {
            return false;
        }
        char previousChar = before.text().charAt(before.text().length() - 1);
        char nextChar = first.text().charAt(0);
        for (String pair : FUSING_PAIRS) {
            if (pair.charAt(0) == previousChar && pair.charAt(1) == nextChar) {
                return true;
            }
        }
        return false;
    }
}
