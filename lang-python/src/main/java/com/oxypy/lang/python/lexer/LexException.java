package com.oxypy.lang.python.lexer;

/**
 * Thrown when scanning stops at an unrecognized character.
 */
public class LexException extends Exception {

    private final LexError error;

    public LexException(LexError error) {
        super(error.getMessage());
        this.error = error;
    }

    public LexError getError() {
        return error;
    }
}
