package com.unparen;

import com.unparen.ast.BinaryExpression;
import com.unparen.ast.ExpressionSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * An {@link AssociativityOracle} backed by {@link SemanticFacts}.
 *
 * <p>Regrouping is approved only for built-in operators whose operands all share
 * one known type for which the operator is associative: {@code &&} and
 * {@code ||}; unchecked integral {@code +} and {@code *}; string {@code +};
 * integral or boolean {@code &}, {@code |} and {@code ^}. Floating-point and
 * decimal arithmetic round differently when regrouped and are always refused.</p>
 */
public final class SemanticAssociativityOracle implements AssociativityOracle {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAssociativityOracle.class);

    private final SemanticFacts facts;

    public SemanticAssociativityOracle(SemanticFacts facts) {
        this.facts = Objects.requireNonNull(facts, "facts");
    }

    @Override
    public boolean isSafeToChangeAssociativity(BinaryExpression inner, BinaryExpression parent) {
        if (facts.isUserDefinedOperator(inner) || facts.isUserDefinedOperator(parent)) {
            logger.debug("Refusing to regroup {}: user-defined operator", inner.kind());
            return false;
        }

        OperandType type = facts.typeOf(inner);
        if (type == null || type.category() == OperandType.Category.DYNAMIC) {
            logger.debug("Refusing to regroup {}: operand type is unknown or dynamic", inner.kind());
            return false;
        }
        if (!type.equals(facts.convertedTypeOf(inner))) {
            logger.debug("Refusing to regroup {}: {} is converted where it is used", inner.kind(), type.name());
            return false;
        }
        if (!hasType(parent.left(), type) || !hasType(inner.left(), type) || !hasType(inner.right(), type)) {
            logger.debug("Refusing to regroup {}: operands are not all {}", inner.kind(), type.name());
            return false;
        }

        boolean safe = switch (inner.kind()) {
            case LOGICAL_AND_EXPRESSION, LOGICAL_OR_EXPRESSION -> true;
            case ADD_EXPRESSION -> type.category() == OperandType.Category.STRING || isUncheckedIntegral(inner, parent, type);
            case MULTIPLY_EXPRESSION -> isUncheckedIntegral(inner, parent, type);
            case BITWISE_AND_EXPRESSION, BITWISE_OR_EXPRESSION, EXCLUSIVE_OR_EXPRESSION ->
                type.category() == OperandType.Category.INTEGRAL || type.category() == OperandType.Category.BOOLEAN;
            default -> false;
        };
        if (!safe) {
            logger.debug("Refusing to regroup {} over {}", inner.kind(), type.name());
        }
        return safe;
    }

    private boolean hasType(ExpressionSyntax expression, OperandType type) {
        return type.equals(facts.typeOf(expression));
    }

    // Wrapping arithmetic is associative; overflow checks may trip in one grouping only
    private boolean isUncheckedIntegral(BinaryExpression inner, BinaryExpression parent, OperandType type) {
        return type.category() == OperandType.Category.INTEGRAL
            && !facts.isOverflowChecked(inner)
            && !facts.isOverflowChecked(parent);
    }
}
