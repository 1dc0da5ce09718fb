package com.unparen;

import com.unparen.ast.CasePatternSwitchLabel;
import com.unparen.ast.IsPatternExpression;
import com.unparen.ast.ParenthesizedPattern;
import com.unparen.ast.PatternSyntax;
import com.unparen.ast.Subpattern;
import com.unparen.ast.SwitchExpressionArm;
import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides whether the parentheses around a pattern are redundant. Patterns have
 * no side effects and no cast, comma or interpolation ambiguities, so only
 * precedence matters.
 */
public final class ParenthesizedPatterns {

    private static final Logger logger = LoggerFactory.getLogger(ParenthesizedPatterns.class);

    private ParenthesizedPatterns() {
    }

    public static boolean canRemoveParentheses(SyntaxTree tree, ParenthesizedPattern node) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(node, "node");
        if (!tree.contains(node)) {
            throw new IllegalArgumentException("Parenthesized pattern is not part of the tree");
        }

        if (node.hasMissingDelimiter()) {
            logger.debug("Keeping pattern parentheses: missing delimiter");
            return false;
        }

        PatternSyntax pattern = node.pattern();
        if (pattern instanceof ParenthesizedPattern) {
            return true;
        }

        // (not x) or (not y) -> not x or not y
        OperatorPrecedence precedence = PrecedenceTable.patternPrecedenceOf(pattern.kind());
        if (precedence == OperatorPrecedence.PRIMARY || precedence == OperatorPrecedence.UNARY) {
            return true;
        }

        SyntaxNode parent = tree.parent(node);
        if (parent instanceof ParenthesizedPattern
            || parent instanceof IsPatternExpression
            || parent instanceof SwitchExpressionArm
            || parent instanceof Subpattern
            || parent instanceof CasePatternSwitchLabel) {
            return true;
        }

        if (!(parent instanceof PatternSyntax parentPattern)) {
            logger.debug("Keeping pattern parentheses around {}: no enclosing pattern", pattern.kind());
            return false;
        }
        if (changesAssociation(precedence, PrecedenceTable.patternPrecedenceOf(parentPattern.kind()))) {
            logger.debug("Keeping pattern parentheses around {} under {}", pattern.kind(), parentPattern.kind());
            return false;
        }
        return true;
    }

    private static boolean changesAssociation(OperatorPrecedence precedence, OperatorPrecedence parentPrecedence) {
        if (precedence == OperatorPrecedence.NONE || parentPrecedence == OperatorPrecedence.NONE) {
            return true;
        }
        return precedence.bindsLooserThan(parentPrecedence);
    }
}
