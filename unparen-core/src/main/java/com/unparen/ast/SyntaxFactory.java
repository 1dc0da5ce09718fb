package com.unparen.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static helpers for building syntax nodes with their standard token text.
 * Operator tokens are derived from the node kind and separated lists get their
 * commas generated. Every call returns fresh token instances, so results can be
 * combined into one {@link SyntaxTree} freely.
 */
public final class SyntaxFactory {

    private SyntaxFactory() {
    }

    // ---------------------------------------------------------------------
    // Tokens
    // ---------------------------------------------------------------------

    public static SyntaxToken token(TokenKind kind) {
        return SyntaxToken.of(kind);
    }

    public static SyntaxToken missingToken(TokenKind kind) {
        return SyntaxToken.missing(kind);
    }

    public static SyntaxToken identifierToken(String text) {
        return SyntaxToken.of(TokenKind.IDENTIFIER, text);
    }

    /**
     * The operator token for a unary, binary or assignment expression kind.
     */
    public static SyntaxToken operatorToken(SyntaxKind kind) {
        TokenKind tokenKind = switch (kind) {
            case UNARY_PLUS_EXPRESSION, ADD_EXPRESSION -> TokenKind.PLUS;
            case UNARY_MINUS_EXPRESSION, SUBTRACT_EXPRESSION -> TokenKind.MINUS;
            case BITWISE_NOT_EXPRESSION -> TokenKind.TILDE;
            case LOGICAL_NOT_EXPRESSION, SUPPRESS_NULLABLE_WARNING_EXPRESSION -> TokenKind.EXCLAMATION;
            case PRE_INCREMENT_EXPRESSION, POST_INCREMENT_EXPRESSION -> TokenKind.PLUS_PLUS;
            case PRE_DECREMENT_EXPRESSION, POST_DECREMENT_EXPRESSION -> TokenKind.MINUS_MINUS;
            case ADDRESS_OF_EXPRESSION, BITWISE_AND_EXPRESSION -> TokenKind.AMPERSAND;
            case POINTER_INDIRECTION_EXPRESSION, MULTIPLY_EXPRESSION -> TokenKind.ASTERISK;
            case INDEX_EXPRESSION, EXCLUSIVE_OR_EXPRESSION -> TokenKind.CARET;
            case DIVIDE_EXPRESSION -> TokenKind.SLASH;
            case MODULO_EXPRESSION -> TokenKind.PERCENT;
            case LEFT_SHIFT_EXPRESSION -> TokenKind.LESS_THAN_LESS_THAN;
            case RIGHT_SHIFT_EXPRESSION -> TokenKind.GREATER_THAN_GREATER_THAN;
            case LESS_THAN_EXPRESSION -> TokenKind.LESS_THAN;
            case LESS_THAN_OR_EQUAL_EXPRESSION -> TokenKind.LESS_THAN_EQUALS;
            case GREATER_THAN_EXPRESSION -> TokenKind.GREATER_THAN;
            case GREATER_THAN_OR_EQUAL_EXPRESSION -> TokenKind.GREATER_THAN_EQUALS;
            case IS_EXPRESSION -> TokenKind.IS_KEYWORD;
            case AS_EXPRESSION -> TokenKind.AS_KEYWORD;
            case EQUALS_EXPRESSION -> TokenKind.EQUALS_EQUALS;
            case NOT_EQUALS_EXPRESSION -> TokenKind.EXCLAMATION_EQUALS;
            case BITWISE_OR_EXPRESSION -> TokenKind.BAR;
            case LOGICAL_AND_EXPRESSION -> TokenKind.AMPERSAND_AMPERSAND;
            case LOGICAL_OR_EXPRESSION -> TokenKind.BAR_BAR;
            case COALESCE_EXPRESSION -> TokenKind.QUESTION_QUESTION;
            case SIMPLE_ASSIGNMENT_EXPRESSION -> TokenKind.EQUALS;
            case ADD_ASSIGNMENT_EXPRESSION -> TokenKind.PLUS_EQUALS;
            case SUBTRACT_ASSIGNMENT_EXPRESSION -> TokenKind.MINUS_EQUALS;
            case MULTIPLY_ASSIGNMENT_EXPRESSION -> TokenKind.ASTERISK_EQUALS;
            case DIVIDE_ASSIGNMENT_EXPRESSION -> TokenKind.SLASH_EQUALS;
            case MODULO_ASSIGNMENT_EXPRESSION -> TokenKind.PERCENT_EQUALS;
            case AND_ASSIGNMENT_EXPRESSION -> TokenKind.AMPERSAND_EQUALS;
            case EXCLUSIVE_OR_ASSIGNMENT_EXPRESSION -> TokenKind.CARET_EQUALS;
            case OR_ASSIGNMENT_EXPRESSION -> TokenKind.BAR_EQUALS;
            case LEFT_SHIFT_ASSIGNMENT_EXPRESSION -> TokenKind.LESS_THAN_LESS_THAN_EQUALS;
            case RIGHT_SHIFT_ASSIGNMENT_EXPRESSION -> TokenKind.GREATER_THAN_GREATER_THAN_EQUALS;
            case COALESCE_ASSIGNMENT_EXPRESSION -> TokenKind.QUESTION_QUESTION_EQUALS;
            case AND_PATTERN -> TokenKind.AND_KEYWORD;
            case OR_PATTERN -> TokenKind.OR_KEYWORD;
            default -> throw new IllegalArgumentException("No operator token for " + kind);
        };
        return SyntaxToken.of(tokenKind);
    }

    private static List<SyntaxToken> commas(int count) {
        List<SyntaxToken> commas = new ArrayList<>();
        for (int i = 1; i < count; i++) {
            commas.add(token(TokenKind.COMMA));
        }
        return commas;
    }

    // ---------------------------------------------------------------------
    // Names and types
    // ---------------------------------------------------------------------

    public static IdentifierName identifier(String name) {
        return new IdentifierName(identifierToken(name));
    }

    /**
     * {@code A.B.C} as a left-nested {@link QualifiedName}, or a plain
     * {@link IdentifierName} when there is no dot.
     */
    public static NameSyntax qualifiedName(String dottedName) {
        String[] parts = dottedName.split("\\.");
        NameSyntax name = identifier(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            name = new QualifiedName(name, token(TokenKind.DOT), identifier(parts[i]));
        }
        return name;
    }

    public static QualifiedName qualifiedName(NameSyntax left, String right) {
        return new QualifiedName(left, token(TokenKind.DOT), identifier(right));
    }

    public static AliasQualifiedName aliasQualifiedName(String alias, String name) {
        return new AliasQualifiedName(identifier(alias), token(TokenKind.COLON_COLON), identifier(name));
    }

    public static PredefinedType predefinedType(String keyword) {
        return new PredefinedType(SyntaxToken.of(TokenKind.PREDEFINED_TYPE_KEYWORD, keyword));
    }

    public static ArrayType arrayType(TypeSyntax elementType) {
        return new ArrayType(elementType, token(TokenKind.OPEN_BRACKET), token(TokenKind.CLOSE_BRACKET));
    }

    public static PointerType pointerType(TypeSyntax elementType) {
        return new PointerType(elementType, token(TokenKind.ASTERISK));
    }

    public static NullableType nullableType(TypeSyntax elementType) {
        return new NullableType(elementType, token(TokenKind.QUESTION));
    }

    // ---------------------------------------------------------------------
    // Primary expressions
    // ---------------------------------------------------------------------

    public static LiteralExpression numericLiteral(String text) {
        return new LiteralExpression(SyntaxKind.NUMERIC_LITERAL_EXPRESSION, SyntaxToken.of(TokenKind.NUMERIC_LITERAL, text));
    }

    public static LiteralExpression stringLiteral(String text) {
        return new LiteralExpression(SyntaxKind.STRING_LITERAL_EXPRESSION,
            SyntaxToken.of(TokenKind.STRING_LITERAL, "\"" + text + "\""));
    }

    public static LiteralExpression characterLiteral(char value) {
        return new LiteralExpression(SyntaxKind.CHARACTER_LITERAL_EXPRESSION,
            SyntaxToken.of(TokenKind.CHARACTER_LITERAL, "'" + value + "'"));
    }

    public static LiteralExpression trueLiteral() {
        return new LiteralExpression(SyntaxKind.TRUE_LITERAL_EXPRESSION, token(TokenKind.TRUE_KEYWORD));
    }

    public static LiteralExpression falseLiteral() {
        return new LiteralExpression(SyntaxKind.FALSE_LITERAL_EXPRESSION, token(TokenKind.FALSE_KEYWORD));
    }

    public static LiteralExpression nullLiteral() {
        return new LiteralExpression(SyntaxKind.NULL_LITERAL_EXPRESSION, token(TokenKind.NULL_KEYWORD));
    }

    public static LiteralExpression defaultLiteral() {
        return new LiteralExpression(SyntaxKind.DEFAULT_LITERAL_EXPRESSION, token(TokenKind.DEFAULT_KEYWORD));
    }

    public static ThisExpression thisExpression() {
        return new ThisExpression(token(TokenKind.THIS_KEYWORD));
    }

    public static ParenthesizedExpression parenthesized(ExpressionSyntax expression) {
        return new ParenthesizedExpression(token(TokenKind.OPEN_PAREN), expression, token(TokenKind.CLOSE_PAREN));
    }

    public static TupleExpression tuple(ExpressionSyntax... elements) {
        List<ArgumentSyntax> arguments = arguments(elements);
        return new TupleExpression(token(TokenKind.OPEN_PAREN), arguments, commas(arguments.size()),
            token(TokenKind.CLOSE_PAREN));
    }

    public static MemberAccessExpression memberAccess(ExpressionSyntax expression, String name) {
        return new MemberAccessExpression(expression, token(TokenKind.DOT), identifier(name));
    }

    /**
     * {@code a.b.c} as a chain of member accesses over an identifier.
     */
    public static ExpressionSyntax dottedName(String dottedName) {
        String[] parts = dottedName.split("\\.");
        ExpressionSyntax expression = identifier(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            expression = memberAccess(expression, parts[i]);
        }
        return expression;
    }

    public static ConditionalAccessExpression conditionalAccess(ExpressionSyntax expression, ExpressionSyntax whenNotNull) {
        return new ConditionalAccessExpression(expression, token(TokenKind.QUESTION), whenNotNull);
    }

    public static MemberBindingExpression memberBinding(String name) {
        return new MemberBindingExpression(token(TokenKind.DOT), identifier(name));
    }

    public static ArgumentSyntax argument(ExpressionSyntax expression) {
        return new ArgumentSyntax(null, expression);
    }

    public static ArgumentSyntax refArgument(TokenKind refKind, ExpressionSyntax expression) {
        return new ArgumentSyntax(token(refKind), expression);
    }

    private static List<ArgumentSyntax> arguments(ExpressionSyntax... expressions) {
        List<ArgumentSyntax> arguments = new ArrayList<>();
        for (ExpressionSyntax expression : expressions) {
            arguments.add(argument(expression));
        }
        return arguments;
    }

    public static ArgumentList argumentList(ArgumentSyntax... arguments) {
        return new ArgumentList(token(TokenKind.OPEN_PAREN), Arrays.asList(arguments), commas(arguments.length),
            token(TokenKind.CLOSE_PAREN));
    }

    public static InvocationExpression invocation(ExpressionSyntax expression, ExpressionSyntax... arguments) {
        return new InvocationExpression(expression,
            argumentList(arguments(arguments).toArray(new ArgumentSyntax[0])));
    }

    public static InvocationExpression invocation(ExpressionSyntax expression, ArgumentList argumentList) {
        return new InvocationExpression(expression, argumentList);
    }

    public static ElementAccessExpression elementAccess(ExpressionSyntax expression, ExpressionSyntax... indexes) {
        List<ArgumentSyntax> arguments = arguments(indexes);
        return new ElementAccessExpression(expression, new BracketedArgumentList(token(TokenKind.OPEN_BRACKET),
            arguments, commas(arguments.size()), token(TokenKind.CLOSE_BRACKET)));
    }

    public static PrefixUnaryExpression prefixUnary(SyntaxKind kind, ExpressionSyntax operand) {
        return new PrefixUnaryExpression(kind, operatorToken(kind), operand);
    }

    public static PostfixUnaryExpression postfixUnary(SyntaxKind kind, ExpressionSyntax operand) {
        return new PostfixUnaryExpression(kind, operand, operatorToken(kind));
    }

    public static ObjectCreationExpression objectCreation(TypeSyntax type, ExpressionSyntax... arguments) {
        return new ObjectCreationExpression(token(TokenKind.NEW_KEYWORD), type,
            argumentList(arguments(arguments).toArray(new ArgumentSyntax[0])), null);
    }

    public static ObjectCreationExpression objectCreationWithInitializer(TypeSyntax type, InitializerExpression initializer) {
        return new ObjectCreationExpression(token(TokenKind.NEW_KEYWORD), type, null, initializer);
    }

    public static AnonymousObjectCreationExpression anonymousObject(AnonymousObjectMemberDeclarator... members) {
        return new AnonymousObjectCreationExpression(token(TokenKind.NEW_KEYWORD), token(TokenKind.OPEN_BRACE),
            Arrays.asList(members), commas(members.length), token(TokenKind.CLOSE_BRACE));
    }

    /**
     * A member of an anonymous object; pass a {@code null} name for a projection.
     */
    public static AnonymousObjectMemberDeclarator anonymousMember(String name, ExpressionSyntax expression) {
        NameEquals nameEquals = name == null ? null : new NameEquals(identifier(name), token(TokenKind.EQUALS));
        return new AnonymousObjectMemberDeclarator(nameEquals, expression);
    }

    public static StackAllocArrayCreationExpression stackAlloc(TypeSyntax type) {
        return new StackAllocArrayCreationExpression(token(TokenKind.STACKALLOC_KEYWORD), type, null);
    }

    public static CheckedExpression checked(SyntaxKind kind, ExpressionSyntax expression) {
        TokenKind keyword = kind == SyntaxKind.UNCHECKED_EXPRESSION ? TokenKind.UNCHECKED_KEYWORD : TokenKind.CHECKED_KEYWORD;
        return new CheckedExpression(kind, token(keyword), token(TokenKind.OPEN_PAREN), expression,
            token(TokenKind.CLOSE_PAREN));
    }

    public static InterpolatedStringExpression interpolatedString(InterpolatedStringContent... contents) {
        return new InterpolatedStringExpression(SyntaxToken.of(TokenKind.INTERPOLATED_STRING_START, "$\""),
            Arrays.asList(contents), SyntaxToken.of(TokenKind.INTERPOLATED_STRING_END, "\""));
    }

    public static InterpolatedStringText interpolatedText(String text) {
        return new InterpolatedStringText(SyntaxToken.of(TokenKind.INTERPOLATED_STRING_TEXT, text));
    }

    public static Interpolation interpolation(ExpressionSyntax expression) {
        return new Interpolation(token(TokenKind.OPEN_BRACE), expression, null, token(TokenKind.CLOSE_BRACE));
    }

    public static Interpolation interpolation(ExpressionSyntax expression, String format) {
        InterpolationFormatClause formatClause = new InterpolationFormatClause(token(TokenKind.COLON),
            SyntaxToken.of(TokenKind.INTERPOLATED_STRING_TEXT, format));
        return new Interpolation(token(TokenKind.OPEN_BRACE), expression, formatClause, token(TokenKind.CLOSE_BRACE));
    }

    // ---------------------------------------------------------------------
    // Operators
    // ---------------------------------------------------------------------

    public static CastExpression cast(TypeSyntax type, ExpressionSyntax expression) {
        return new CastExpression(token(TokenKind.OPEN_PAREN), type, token(TokenKind.CLOSE_PAREN), expression);
    }

    public static AwaitExpression await(ExpressionSyntax expression) {
        return new AwaitExpression(token(TokenKind.AWAIT_KEYWORD), expression);
    }

    public static RangeExpression range(ExpressionSyntax left, ExpressionSyntax right) {
        return new RangeExpression(left, token(TokenKind.DOT_DOT), right);
    }

    public static SwitchExpression switchExpression(ExpressionSyntax governing, SwitchExpressionArm... arms) {
        return new SwitchExpression(governing, token(TokenKind.SWITCH_KEYWORD), token(TokenKind.OPEN_BRACE),
            Arrays.asList(arms), commas(arms.length), token(TokenKind.CLOSE_BRACE));
    }

    public static SwitchExpressionArm switchArm(PatternSyntax pattern, ExpressionSyntax expression) {
        return new SwitchExpressionArm(pattern, null, token(TokenKind.EQUALS_GREATER_THAN), expression);
    }

    public static IsPatternExpression isPattern(ExpressionSyntax expression, PatternSyntax pattern) {
        return new IsPatternExpression(expression, token(TokenKind.IS_KEYWORD), pattern);
    }

    public static BinaryExpression binary(SyntaxKind kind, ExpressionSyntax left, ExpressionSyntax right) {
        return new BinaryExpression(kind, left, operatorToken(kind), right);
    }

    public static ConditionalExpression conditional(ExpressionSyntax condition, ExpressionSyntax whenTrue,
                                                    ExpressionSyntax whenFalse) {
        return new ConditionalExpression(condition, token(TokenKind.QUESTION), whenTrue, token(TokenKind.COLON),
            whenFalse);
    }

    public static AssignmentExpression assignment(SyntaxKind kind, ExpressionSyntax left, ExpressionSyntax right) {
        return new AssignmentExpression(kind, left, operatorToken(kind), right);
    }

    public static AssignmentExpression assign(ExpressionSyntax left, ExpressionSyntax right) {
        return assignment(SyntaxKind.SIMPLE_ASSIGNMENT_EXPRESSION, left, right);
    }

    public static SimpleLambdaExpression lambda(String parameter, SyntaxNode body) {
        return new SimpleLambdaExpression(identifierToken(parameter), token(TokenKind.EQUALS_GREATER_THAN), body);
    }

    public static ThrowExpression throwExpression(ExpressionSyntax expression) {
        return new ThrowExpression(token(TokenKind.THROW_KEYWORD), expression);
    }

    public static RefExpression ref(ExpressionSyntax expression) {
        return new RefExpression(token(TokenKind.REF_KEYWORD), expression);
    }

    public static QueryExpression query(FromClause from, List<QueryClause> clauses, SelectClause select) {
        return new QueryExpression(from, clauses, select);
    }

    public static FromClause fromClause(String identifier, ExpressionSyntax source) {
        return new FromClause(token(TokenKind.FROM_KEYWORD), identifierToken(identifier), token(TokenKind.IN_KEYWORD),
            source);
    }

    public static WhereClause whereClause(ExpressionSyntax condition) {
        return new WhereClause(token(TokenKind.WHERE_KEYWORD), condition);
    }

    public static SelectClause selectClause(ExpressionSyntax expression) {
        return new SelectClause(token(TokenKind.SELECT_KEYWORD), expression);
    }

    public static InitializerExpression initializer(SyntaxKind kind, ExpressionSyntax... expressions) {
        return new InitializerExpression(kind, token(TokenKind.OPEN_BRACE), Arrays.asList(expressions),
            commas(expressions.length), token(TokenKind.CLOSE_BRACE));
    }

    // ---------------------------------------------------------------------
    // Declarations and statements
    // ---------------------------------------------------------------------

    public static ArrowExpressionClause arrowClause(ExpressionSyntax expression) {
        return new ArrowExpressionClause(token(TokenKind.EQUALS_GREATER_THAN), expression);
    }

    public static PropertyDeclaration property(TypeSyntax type, String name, ExpressionSyntax body) {
        return new PropertyDeclaration(type, identifierToken(name), arrowClause(body), token(TokenKind.SEMICOLON));
    }

    public static EqualsValueClause equalsValue(ExpressionSyntax value) {
        return new EqualsValueClause(token(TokenKind.EQUALS), value);
    }

    public static VariableDeclaration variableDeclaration(TypeSyntax type, String name, ExpressionSyntax value) {
        VariableDeclarator declarator = new VariableDeclarator(identifierToken(name),
            value == null ? null : equalsValue(value));
        return new VariableDeclaration(type, List.of(declarator), List.of());
    }

    public static LocalDeclarationStatement localDeclaration(TypeSyntax type, String name, ExpressionSyntax value) {
        return new LocalDeclarationStatement(variableDeclaration(type, name, value), token(TokenKind.SEMICOLON));
    }

    public static Block block(StatementSyntax... statements) {
        return new Block(token(TokenKind.OPEN_BRACE), Arrays.asList(statements), token(TokenKind.CLOSE_BRACE));
    }

    public static ExpressionStatement expressionStatement(ExpressionSyntax expression) {
        return new ExpressionStatement(expression, token(TokenKind.SEMICOLON));
    }

    public static IfStatement ifStatement(ExpressionSyntax condition, StatementSyntax statement) {
        return new IfStatement(token(TokenKind.IF_KEYWORD), token(TokenKind.OPEN_PAREN), condition,
            token(TokenKind.CLOSE_PAREN), statement, null);
    }

    public static IfStatement ifStatement(ExpressionSyntax condition, StatementSyntax statement,
                                          StatementSyntax elseStatement) {
        return new IfStatement(token(TokenKind.IF_KEYWORD), token(TokenKind.OPEN_PAREN), condition,
            token(TokenKind.CLOSE_PAREN), statement, new ElseClause(token(TokenKind.ELSE_KEYWORD), elseStatement));
    }

    public static WhileStatement whileStatement(ExpressionSyntax condition, StatementSyntax statement) {
        return new WhileStatement(token(TokenKind.WHILE_KEYWORD), token(TokenKind.OPEN_PAREN), condition,
            token(TokenKind.CLOSE_PAREN), statement);
    }

    public static DoStatement doStatement(StatementSyntax statement, ExpressionSyntax condition) {
        return new DoStatement(token(TokenKind.DO_KEYWORD), statement, token(TokenKind.WHILE_KEYWORD),
            token(TokenKind.OPEN_PAREN), condition, token(TokenKind.CLOSE_PAREN), token(TokenKind.SEMICOLON));
    }

    /**
     * {@code for (; condition; incrementors) statement}.
     */
    public static ForStatement forStatement(ExpressionSyntax condition, List<ExpressionSyntax> incrementors,
                                            StatementSyntax statement) {
        return new ForStatement(token(TokenKind.FOR_KEYWORD), token(TokenKind.OPEN_PAREN), null, List.of(), List.of(),
            token(TokenKind.SEMICOLON), condition, token(TokenKind.SEMICOLON), incrementors,
            commas(incrementors.size()), token(TokenKind.CLOSE_PAREN), statement);
    }

    public static ForEachStatement forEachStatement(TypeSyntax type, String identifier, ExpressionSyntax expression,
                                                    StatementSyntax statement) {
        return new ForEachStatement(token(TokenKind.FOREACH_KEYWORD), token(TokenKind.OPEN_PAREN), type,
            identifierToken(identifier), token(TokenKind.IN_KEYWORD), expression, token(TokenKind.CLOSE_PAREN),
            statement);
    }

    public static LockStatement lockStatement(ExpressionSyntax expression, StatementSyntax statement) {
        return new LockStatement(token(TokenKind.LOCK_KEYWORD), token(TokenKind.OPEN_PAREN), expression,
            token(TokenKind.CLOSE_PAREN), statement);
    }

    public static UsingStatement usingStatement(ExpressionSyntax expression, StatementSyntax statement) {
        return new UsingStatement(token(TokenKind.USING_KEYWORD), token(TokenKind.OPEN_PAREN), expression,
            token(TokenKind.CLOSE_PAREN), statement);
    }

    public static SwitchStatement switchStatement(ExpressionSyntax expression, SwitchSection... sections) {
        return new SwitchStatement(token(TokenKind.SWITCH_KEYWORD), token(TokenKind.OPEN_PAREN), expression,
            token(TokenKind.CLOSE_PAREN), token(TokenKind.OPEN_BRACE), Arrays.asList(sections),
            token(TokenKind.CLOSE_BRACE));
    }

    public static SwitchSection switchSection(SwitchLabel label, StatementSyntax... statements) {
        return new SwitchSection(List.of(label), Arrays.asList(statements));
    }

    public static CaseSwitchLabel caseLabel(ExpressionSyntax value) {
        return new CaseSwitchLabel(token(TokenKind.CASE_KEYWORD), value, token(TokenKind.COLON));
    }

    public static CasePatternSwitchLabel casePatternLabel(PatternSyntax pattern, ExpressionSyntax whenCondition) {
        WhenClause whenClause = whenCondition == null ? null : whenClause(whenCondition);
        return new CasePatternSwitchLabel(token(TokenKind.CASE_KEYWORD), pattern, whenClause, token(TokenKind.COLON));
    }

    public static DefaultSwitchLabel defaultLabel() {
        return new DefaultSwitchLabel(token(TokenKind.DEFAULT_KEYWORD), token(TokenKind.COLON));
    }

    public static WhenClause whenClause(ExpressionSyntax condition) {
        return new WhenClause(token(TokenKind.WHEN_KEYWORD), condition);
    }

    public static ReturnStatement returnStatement(ExpressionSyntax expression) {
        return new ReturnStatement(token(TokenKind.RETURN_KEYWORD), expression, token(TokenKind.SEMICOLON));
    }

    public static YieldStatement yieldReturn(ExpressionSyntax expression) {
        return new YieldStatement(token(TokenKind.YIELD_KEYWORD), token(TokenKind.RETURN_KEYWORD), expression,
            token(TokenKind.SEMICOLON));
    }

    public static ThrowStatement throwStatement(ExpressionSyntax expression) {
        return new ThrowStatement(token(TokenKind.THROW_KEYWORD), expression, token(TokenKind.SEMICOLON));
    }

    public static TryStatement tryStatement(Block block, CatchClause... catches) {
        return new TryStatement(token(TokenKind.TRY_KEYWORD), block, Arrays.asList(catches));
    }

    public static CatchClause catchClause(ExpressionSyntax filter, Block block) {
        CatchFilterClause filterClause = filter == null ? null : new CatchFilterClause(token(TokenKind.WHEN_KEYWORD),
            token(TokenKind.OPEN_PAREN), filter, token(TokenKind.CLOSE_PAREN));
        return new CatchClause(token(TokenKind.CATCH_KEYWORD), filterClause, block);
    }

    public static IfDirectiveTrivia ifDirective(ExpressionSyntax condition) {
        return new IfDirectiveTrivia(token(TokenKind.HASH), token(TokenKind.IF_KEYWORD), condition,
            token(TokenKind.END_OF_DIRECTIVE));
    }

    public static ElifDirectiveTrivia elifDirective(ExpressionSyntax condition) {
        return new ElifDirectiveTrivia(token(TokenKind.HASH), token(TokenKind.ELIF_KEYWORD), condition,
            token(TokenKind.END_OF_DIRECTIVE));
    }

    // ---------------------------------------------------------------------
    // Patterns
    // ---------------------------------------------------------------------

    public static ConstantPattern constantPattern(ExpressionSyntax expression) {
        return new ConstantPattern(expression);
    }

    public static DiscardPattern discardPattern() {
        return new DiscardPattern(token(TokenKind.UNDERSCORE));
    }

    public static DeclarationPattern declarationPattern(TypeSyntax type, String designation) {
        return new DeclarationPattern(type, identifierToken(designation));
    }

    public static VarPattern varPattern(String designation) {
        return new VarPattern(token(TokenKind.VAR_KEYWORD), identifierToken(designation));
    }

    public static TypePattern typePattern(TypeSyntax type) {
        return new TypePattern(type);
    }

    public static RecursivePattern recursivePattern(TypeSyntax type, Subpattern... subpatterns) {
        PropertyPatternClause clause = new PropertyPatternClause(token(TokenKind.OPEN_BRACE), Arrays.asList(subpatterns),
            commas(subpatterns.length), token(TokenKind.CLOSE_BRACE));
        return new RecursivePattern(type, clause, null);
    }

    public static Subpattern subpattern(String name, PatternSyntax pattern) {
        NameColon nameColon = name == null ? null : new NameColon(identifier(name), token(TokenKind.COLON));
        return new Subpattern(nameColon, pattern);
    }

    public static UnaryPattern notPattern(PatternSyntax pattern) {
        return new UnaryPattern(token(TokenKind.NOT_KEYWORD), pattern);
    }

    public static RelationalPattern relationalPattern(TokenKind operator, ExpressionSyntax expression) {
        return new RelationalPattern(token(operator), expression);
    }

    public static BinaryPattern binaryPattern(SyntaxKind kind, PatternSyntax left, PatternSyntax right) {
        return new BinaryPattern(kind, left, operatorToken(kind), right);
    }

    public static ParenthesizedPattern parenthesizedPattern(PatternSyntax pattern) {
        return new ParenthesizedPattern(token(TokenKind.OPEN_PAREN), pattern, token(TokenKind.CLOSE_PAREN));
    }
}
