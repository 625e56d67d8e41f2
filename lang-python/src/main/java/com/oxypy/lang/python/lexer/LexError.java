package com.oxypy.lang.python.lexer;

import java.util.Objects;

/**
 * Why a scan failed: the lexer met a character it does not recognize.
 *
 * @param character the offending code point
 * @param start     location of the character
 * @param end       location of the character (same as {@code start})
 * @param offset    0-based UTF-16 offset of the character in the source
 */
public record LexError(int character, Location start, Location end, int offset) {

    public LexError {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    /**
     * @return how many UTF-16 chars the offending character occupies
     */
    public int charCount() {
        return Character.charCount(character);
    }

    public String getMessage() {
        return "unexpected character '" + describe(character) + "' at " + start;
    }

    private static String describe(int codePoint) {
        return switch (codePoint) {
            case '\t' -> "\\t";
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            default -> Character.isISOControl(codePoint) || !Character.isDefined(codePoint)
                    ? String.format("\\u%04X", codePoint)
                    : new String(Character.toChars(codePoint));
        };
    }

    @Override
    public String toString() {
        return "LexError{" + getMessage() + "}";
    }
}
