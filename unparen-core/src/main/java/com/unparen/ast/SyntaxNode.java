package com.unparen.ast;

import java.util.List;

/**
 * Base interface for all syntax tree nodes.
 *
 * <p>Nodes are immutable records and hold no reference to their parent; build a
 * {@link SyntaxTree} to navigate upwards or between tokens.</p>
 */
public sealed interface SyntaxNode extends SyntaxElement permits
    ExpressionSyntax,
    StatementSyntax,
    PatternSyntax,
    SwitchLabel,
    QueryClause,
    DirectiveTrivia,
    InterpolatedStringContent,
    ParenthesizedNode,
    ArgumentSyntax,
    ArgumentList,
    BracketedArgumentList,
    NameEquals,
    NameColon,
    AnonymousObjectMemberDeclarator,
    InterpolationFormatClause,
    ArrowExpressionClause,
    PropertyDeclaration,
    EqualsValueClause,
    VariableDeclaration,
    VariableDeclarator,
    ElseClause,
    SwitchSection,
    WhenClause,
    SwitchExpressionArm,
    CatchClause,
    CatchFilterClause,
    SelectClause,
    PropertyPatternClause,
    Subpattern {

    SyntaxKind kind();

    /**
     * The children of this node in document order. Absent optional slots are
     * skipped, separated lists are interleaved with their separators.
     */
    List<SyntaxElement> childNodesAndTokens();

    default boolean isKind(SyntaxKind... kinds) {
        SyntaxKind own = kind();
        for (SyntaxKind k : kinds) {
            if (k == own) {
                return true;
            }
        }
        return false;
    }
}
