package com.oxypy.api.editor;

/**
 * A range of text to style. Offsets are 0-based character offsets into the highlighted text.
 */
public record TokenSpan(int start, int length, TokenType type) {

    public TokenSpan {
        if (start < 0) {
            throw new IllegalArgumentException("start < 0: " + start);
        }
        if (length < 0) {
            throw new IllegalArgumentException("length < 0: " + length);
        }
    }

    public int end() {
        return start + length;
    }

    public enum TokenType {
        KEYWORD, IDENTIFIER, OPERATOR, ERROR
    }
}
