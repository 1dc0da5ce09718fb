package com.unparen;

import com.unparen.ast.AnonymousObjectMemberDeclarator;
import com.unparen.ast.ArgumentSyntax;
import com.unparen.ast.ArrowExpressionClause;
import com.unparen.ast.AssignmentExpression;
import com.unparen.ast.CasePatternSwitchLabel;
import com.unparen.ast.CaseSwitchLabel;
import com.unparen.ast.CastExpression;
import com.unparen.ast.CatchFilterClause;
import com.unparen.ast.CheckedExpression;
import com.unparen.ast.ConditionalAccessExpression;
import com.unparen.ast.ConditionalExpression;
import com.unparen.ast.ConstantPattern;
import com.unparen.ast.DirectiveTrivia;
import com.unparen.ast.DoStatement;
import com.unparen.ast.EqualsValueClause;
import com.unparen.ast.ExpressionStatement;
import com.unparen.ast.ExpressionSyntax;
import com.unparen.ast.ForEachStatement;
import com.unparen.ast.ForStatement;
import com.unparen.ast.IfStatement;
import com.unparen.ast.InitializerExpression;
import com.unparen.ast.InterpolatedStringExpression;
import com.unparen.ast.Interpolation;
import com.unparen.ast.LiteralExpression;
import com.unparen.ast.LockStatement;
import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.QueryClause;
import com.unparen.ast.ReturnStatement;
import com.unparen.ast.SimpleLambdaExpression;
import com.unparen.ast.SwitchExpressionArm;
import com.unparen.ast.SwitchStatement;
import com.unparen.ast.SyntaxKind;
import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxTree;
import com.unparen.ast.ThisExpression;
import com.unparen.ast.ThrowExpression;
import com.unparen.ast.ThrowStatement;
import com.unparen.ast.TupleExpression;
import com.unparen.ast.UsingStatement;
import com.unparen.ast.WhenClause;
import com.unparen.ast.WhileStatement;
import com.unparen.ast.YieldStatement;

/**
 * Classifies the surroundings of a parenthesized expression.
 *
 * <p>Classification happens in two passes around the ambiguity detectors.
 * {@link #classifyEnclosingConstruct} covers slots where no lexical ambiguity is
 * possible; {@link #classifyExpressionContext} covers the rest and must only run
 * once {@link AmbiguityDetectors} has cleared the node.</p>
 */
public final class ContextClassifier {

    private ContextClassifier() {
    }

    /**
     * Statement slots, nesting and wrapper constructs that accept any expression
     * as-is. Returns {@link RemovalContext#ALWAYS_REMOVABLE} or
     * {@link RemovalContext#INDETERMINATE}, never unsafe.
     */
    public static RemovalContext classifyEnclosingConstruct(SyntaxTree tree, ParenthesizedExpression node) {
        ExpressionSyntax expression = node.expression();
        SyntaxNode parent = tree.parent(node);

        // ((x)) -> (x)
        if (expression instanceof ParenthesizedExpression
            || tree.logicalParent(node) instanceof ParenthesizedExpression) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        // (throw e) -> throw e, including x ?? (throw e)
        if (expression instanceof ThrowExpression) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        if (parent instanceof ExpressionStatement
            || parent instanceof ArrowExpressionClause
            || parent instanceof CheckedExpression) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        // ((a, b)) keeps the tuple's own parentheses
        if (expression instanceof TupleExpression) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        return isStatementSlot(parent, node) ? RemovalContext.ALWAYS_REMOVABLE : RemovalContext.INDETERMINATE;
    }

    private static boolean isStatementSlot(SyntaxNode parent, ParenthesizedExpression node) {
        if (parent instanceof EqualsValueClause clause) {
            return clause.value() == node;
        }
        if (parent instanceof IfStatement statement) {
            return statement.condition() == node;
        }
        if (parent instanceof ReturnStatement statement) {
            return statement.expression() == node;
        }
        if (parent instanceof YieldStatement statement) {
            return statement.expression() == node;
        }
        if (parent instanceof ThrowStatement statement) {
            return statement.expression() == node;
        }
        if (parent instanceof SwitchStatement statement) {
            return statement.expression() == node;
        }
        if (parent instanceof WhileStatement statement) {
            return statement.condition() == node;
        }
        if (parent instanceof DoStatement statement) {
            return statement.condition() == node;
        }
        if (parent instanceof ForStatement statement) {
            return statement.condition() == node;
        }
        if (parent instanceof ForEachStatement statement) {
            return statement.expression() == node;
        }
        if (parent instanceof LockStatement statement) {
            return statement.expression() == node;
        }
        if (parent instanceof UsingStatement statement) {
            return statement.expression() == node;
        }
        if (parent instanceof CatchFilterClause filter) {
            return filter.filterExpression() == node;
        }
        return false;
    }

    /**
     * Expression-level shapes, checked after the ambiguity detectors.
     */
    public static RemovalContext classifyExpressionContext(SyntaxTree tree, ParenthesizedExpression node) {
        ExpressionSyntax expression = node.expression();
        SyntaxNode parent = tree.parent(node);

        // (C)(this) -> (C)this
        if (parent instanceof CastExpression && expression instanceof ThisExpression) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        // f((x)) -> f(x)
        if (parent instanceof ArgumentSyntax argument && argument.expression() == node) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        // $"{(x)}" -> $"{x}"
        if (parent instanceof Interpolation) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        // ($"{x}") -> $"{x}"
        if (expression instanceof InterpolatedStringExpression) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        // { (x) } -> { x }; an assignment there would become a member initializer
        if (parent instanceof InitializerExpression) {
            return isAssignment(expression) ? RemovalContext.ALWAYS_UNSAFE : RemovalContext.ALWAYS_REMOVABLE;
        }

        // new { (x) } -> new { x }; an unnamed assignment would name the member
        if (parent instanceof AnonymousObjectMemberDeclarator declarator) {
            return declarator.nameEquals() == null && isAssignment(expression)
                ? RemovalContext.ALWAYS_UNSAFE
                : RemovalContext.ALWAYS_REMOVABLE;
        }

        // where (x > 1) -> where x > 1
        if (parent instanceof QueryClause) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        if (AmbiguityDetectors.isSimpleOrDottedName(expression)
            || expression instanceof LiteralExpression
            || expression instanceof ThisExpression) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        // case (x): / case (x) when y:
        if (parent instanceof CaseSwitchLabel
            || (parent instanceof ConstantPattern && tree.parent(parent) instanceof CasePatternSwitchLabel)) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        if (parent instanceof WhenClause || parent instanceof DirectiveTrivia) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        if (parent instanceof SwitchExpressionArm arm && arm.expression() == node) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        // (T)(++x) would read as ((T)++)x
        if (tree.logicalParent(node) instanceof CastExpression
            && expression.isKind(SyntaxKind.PRE_INCREMENT_EXPRESSION, SyntaxKind.PRE_DECREMENT_EXPRESSION)) {
            return RemovalContext.ALWAYS_UNSAFE;
        }

        // (c ? ref a : ref b) = v
        if (expression instanceof ConditionalExpression && isLeftOfAssignment(parent, node)) {
            return RemovalContext.ALWAYS_UNSAFE;
        }

        // (x?.y).z would only run .z when x is not null
        if (expression instanceof ConditionalAccessExpression) {
            return RemovalContext.ALWAYS_UNSAFE;
        }

        if (parent instanceof AssignmentExpression assignment && assignment.right() == node) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }
        if (parent instanceof ConditionalExpression conditional
            && (conditional.whenTrue() == node || conditional.whenFalse() == node)) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }
        if (parent instanceof SimpleLambdaExpression lambda && lambda.body() == node) {
            return RemovalContext.ALWAYS_REMOVABLE;
        }

        return RemovalContext.INDETERMINATE;
    }

    private static boolean isAssignment(ExpressionSyntax expression) {
        return expression.kind().isAssignment();
    }

    private static boolean isLeftOfAssignment(SyntaxNode parent, ParenthesizedExpression node) {
        return parent instanceof AssignmentExpression assignment && assignment.left() == node;
    }
}
