package com.oxypy.api.diagnostics;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A single diagnostic (error/warning/info) produced for a specific text snapshot.
 *
 * Offsets are 0-based character offsets into the provided text, as a half-open range [startOffset, endOffset).
 * Line and column are 1-based and point at the first character of the range.
 */
public final class Diagnostic {

    private final DiagnosticSeverity severity;
    private final int startOffset;
    private final int endOffset;
    private final int line;
    private final int column;
    private final String message;

    // Optional metadata
    private final String code;
    private final String source;

    public Diagnostic(
            @NotNull DiagnosticSeverity severity,
            int startOffset,
            int endOffset,
            int line,
            int column,
            @Nullable String message,
            @Nullable String code,
            @Nullable String source
    ) {
        this.severity = Objects.requireNonNull(severity, "severity");
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid range [" + startOffset + ", " + endOffset + ")");
        }
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.line = line;
        this.column = column;
        this.message = message != null ? message : "";
        this.code = code;
        this.source = source;
    }

    @NotNull
    public DiagnosticSeverity getSeverity() {
        return severity;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @NotNull
    public String getMessage() {
        return message;
    }

    /**
     * Optional diagnostic code, if the underlying engine provides one.
     */
    @Nullable
    public String getCode() {
        return code;
    }

    /**
     * Optional source id (e.g. "oxy-lexer").
     */
    @Nullable
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return severity + " " + line + ":" + column + " [" + startOffset + ", " + endOffset + ") " + message;
    }
}
