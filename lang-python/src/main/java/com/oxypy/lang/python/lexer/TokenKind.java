package com.oxypy.lang.python.lexer;

/**
 * Lexical category of a {@link Token}.
 */
public enum TokenKind {
    // arithmetic
    PLUS,
    MINUS,
    STAR,
    /** Two stars in a row, the power operator. */
    STAR_STAR,
    SLASH,

    /** Identifier; the spelling is in {@link Token#text()}. */
    NAME,

    // keywords
    IF,
    ELSE,

    // layout, never produced until indentation is tracked
    INDENT,
    DEDENT;

    public boolean isOperator() {
        return switch (this) {
            case PLUS, MINUS, STAR, STAR_STAR, SLASH -> true;
            default -> false;
        };
    }

    public boolean isKeyword() {
        return this == IF || this == ELSE;
    }
}
