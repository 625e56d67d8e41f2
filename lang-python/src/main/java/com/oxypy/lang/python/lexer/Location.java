package com.oxypy.lang.python.lexer;

/**
 * A single character position in the scanned text.
 *
 * @param line   1-based line number
 * @param column 1-based column, counted in code points
 */
public record Location(int line, int column) {

    public Location {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1: " + line);
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1: " + column);
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
