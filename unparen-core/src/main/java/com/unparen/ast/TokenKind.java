package com.unparen.ast;

/**
 * Lexical token kinds. Kinds with a fixed spelling carry it as {@link #text()};
 * identifiers, literals and string fragments have {@code null} text and take
 * theirs from the source.
 */
public enum TokenKind {
    // Variable-text tokens
    IDENTIFIER(null),
    NUMERIC_LITERAL(null),
    STRING_LITERAL(null),
    CHARACTER_LITERAL(null),
    INTERPOLATED_STRING_START(null),
    INTERPOLATED_STRING_END(null),
    INTERPOLATED_STRING_TEXT(null),
    PREDEFINED_TYPE_KEYWORD(null),
    END_OF_DIRECTIVE(""),

    // Keywords
    THIS_KEYWORD("this"),
    TRUE_KEYWORD("true"),
    FALSE_KEYWORD("false"),
    NULL_KEYWORD("null"),
    DEFAULT_KEYWORD("default"),
    IF_KEYWORD("if"),
    ELIF_KEYWORD("elif"),
    ELSE_KEYWORD("else"),
    WHILE_KEYWORD("while"),
    DO_KEYWORD("do"),
    FOR_KEYWORD("for"),
    FOREACH_KEYWORD("foreach"),
    IN_KEYWORD("in"),
    LOCK_KEYWORD("lock"),
    USING_KEYWORD("using"),
    SWITCH_KEYWORD("switch"),
    CASE_KEYWORD("case"),
    RETURN_KEYWORD("return"),
    YIELD_KEYWORD("yield"),
    THROW_KEYWORD("throw"),
    TRY_KEYWORD("try"),
    CATCH_KEYWORD("catch"),
    WHEN_KEYWORD("when"),
    NEW_KEYWORD("new"),
    STACKALLOC_KEYWORD("stackalloc"),
    CHECKED_KEYWORD("checked"),
    UNCHECKED_KEYWORD("unchecked"),
    IS_KEYWORD("is"),
    AS_KEYWORD("as"),
    NOT_KEYWORD("not"),
    AND_KEYWORD("and"),
    OR_KEYWORD("or"),
    VAR_KEYWORD("var"),
    REF_KEYWORD("ref"),
    OUT_KEYWORD("out"),
    AWAIT_KEYWORD("await"),
    FROM_KEYWORD("from"),
    WHERE_KEYWORD("where"),
    SELECT_KEYWORD("select"),

    // Punctuation
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    OPEN_BRACE("{"),
    CLOSE_BRACE("}"),
    OPEN_BRACKET("["),
    CLOSE_BRACKET("]"),
    COMMA(","),
    DOT("."),
    SEMICOLON(";"),
    COLON(":"),
    COLON_COLON("::"),
    QUESTION("?"),
    EQUALS_GREATER_THAN("=>"),
    DOT_DOT(".."),
    HASH("#"),
    UNDERSCORE("_"),

    // Operators
    PLUS("+"),
    MINUS("-"),
    ASTERISK("*"),
    SLASH("/"),
    PERCENT("%"),
    AMPERSAND("&"),
    BAR("|"),
    CARET("^"),
    TILDE("~"),
    EXCLAMATION("!"),
    PLUS_PLUS("++"),
    MINUS_MINUS("--"),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_EQUALS("<="),
    GREATER_THAN_EQUALS(">="),
    EQUALS_EQUALS("=="),
    EXCLAMATION_EQUALS("!="),
    LESS_THAN_LESS_THAN("<<"),
    GREATER_THAN_GREATER_THAN(">>"),
    AMPERSAND_AMPERSAND("&&"),
    BAR_BAR("||"),
    QUESTION_QUESTION("??"),
    EQUALS("="),
    PLUS_EQUALS("+="),
    MINUS_EQUALS("-="),
    ASTERISK_EQUALS("*="),
    SLASH_EQUALS("/="),
    PERCENT_EQUALS("%="),
    AMPERSAND_EQUALS("&="),
    BAR_EQUALS("|="),
    CARET_EQUALS("^="),
    LESS_THAN_LESS_THAN_EQUALS("<<="),
    GREATER_THAN_GREATER_THAN_EQUALS(">>="),
    QUESTION_QUESTION_EQUALS("??=");

    private final String text;

    TokenKind(String text) {
        this.text = text;
    }

    /**
     * The fixed spelling of this token kind, or {@code null} when the text varies.
     */
    public String text() {
        return text;
    }

    public boolean hasFixedText() {
        return text != null;
    }
}
