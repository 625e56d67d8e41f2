package com.oxypy.lang.python.lexer;

import java.util.Objects;

/**
 * A lexed token with its position in the source.
 *
 * @param start  location of the first character
 * @param end    location of the last character (inclusive)
 * @param kind   lexical category
 * @param text   the exact source text of the token
 * @param offset 0-based UTF-16 offset of the first character in the source
 */
public record Token(Location start, Location end, TokenKind kind, String text, int offset) {

    public Token {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (start.line() != end.line() || start.column() > end.column()) {
            throw new IllegalArgumentException("Invalid token span " + start + "-" + end);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset < 0: " + offset);
        }
    }

    public boolean isType(TokenKind other) {
        return kind == other;
    }

    /**
     * @return the number of UTF-16 chars the token covers in the source
     */
    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        String label = kind == TokenKind.NAME ? kind + "(" + text + ")" : kind.toString();
        return label + "@" + start + "-" + end;
    }
}
