package com.unparen;

import com.unparen.ast.ExpressionSyntax;
import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides whether the parentheses around an expression are redundant.
 *
 * <p>The answer is {@code true} only when removing the parentheses provably
 * leaves both the parse and the runtime behavior of the program unchanged. Any
 * case the rules cannot prove safe answers {@code false}.</p>
 *
 * <pre>{@code
 * SyntaxTree tree = SyntaxTree.of(statement);
 * boolean redundant = ParenthesizedExpressions.canRemoveParentheses(tree, node, AssociativityOracle.never());
 * }</pre>
 */
public final class ParenthesizedExpressions {

    private static final Logger logger = LoggerFactory.getLogger(ParenthesizedExpressions.class);

    private ParenthesizedExpressions() {
    }

    /**
     * @param tree   the tree containing {@code node}
     * @param node   the parenthesized expression to test
     * @param oracle consulted before regrouping an associative operator chain
     * @return whether the parentheses can be removed
     * @throws IllegalArgumentException if {@code node} is not part of {@code tree}
     */
    public static boolean canRemoveParentheses(SyntaxTree tree, ParenthesizedExpression node,
                                               AssociativityOracle oracle) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(oracle, "oracle");
        if (!tree.contains(node)) {
            throw new IllegalArgumentException("Parenthesized expression is not part of the tree");
        }

        // int x = (3;
        if (node.hasMissingDelimiter()) {
            logger.debug("Keeping parentheses: missing delimiter");
            return false;
        }
        if (StructuralSafetyFilter.wrapsStackAlloc(node)) {
            logger.debug("Keeping parentheses around stackalloc");
            return false;
        }
        if (StructuralSafetyFilter.wouldFuseTokens(tree, node)) {
            logger.debug("Keeping parentheses: removal would fuse adjacent tokens");
            return false;
        }

        if (ContextClassifier.classifyEnclosingConstruct(tree, node) == RemovalContext.ALWAYS_REMOVABLE) {
            return true;
        }

        if (AmbiguityDetectors.mayIntroduceAmbiguity(tree, node)) {
            logger.debug("Keeping parentheses around {}: removal would be ambiguous", node.expression().kind());
            return false;
        }

        switch (ContextClassifier.classifyExpressionContext(tree, node)) {
            case ALWAYS_REMOVABLE:
                return true;
            case ALWAYS_UNSAFE:
                logger.debug("Keeping parentheses around {}: unsafe in this position", node.expression().kind());
                return false;
            default:
                break;
        }

        SyntaxNode parent = tree.logicalParent(node);
        if (!(parent instanceof ExpressionSyntax parentExpression)) {
            logger.debug("Keeping parentheses around {}: no enclosing expression", node.expression().kind());
            return false;
        }
        if (AssociationAnalyzer.changesAssociation(node, parentExpression, oracle)) {
            logger.debug("Keeping parentheses around {}: removal would change association with {}",
                node.expression().kind(), parentExpression.kind());
            return false;
        }
        return true;
    }

    /**
     * Same as {@link #canRemoveParentheses(SyntaxTree, ParenthesizedExpression, AssociativityOracle)}
     * with an oracle that never approves regrouping.
     */
    public static boolean canRemoveParentheses(SyntaxTree tree, ParenthesizedExpression node) {
        return canRemoveParentheses(tree, node, AssociativityOracle.never());
    }
}
