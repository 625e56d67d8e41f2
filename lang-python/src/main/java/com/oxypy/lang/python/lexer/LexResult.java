package com.oxypy.lang.python.lexer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a whole scan: either every token of the input or the first error.
 */
public final class LexResult {

    public enum Status {
        SUCCESS,
        FAILED
    }

    private final Status status;
    private final List<Token> tokens;
    private final LexError error;

    private LexResult(Status status, List<Token> tokens, LexError error) {
        this.status = status;
        this.tokens = tokens;
        this.error = error;
    }

    public static LexResult success(@NotNull List<Token> tokens) {
        return new LexResult(Status.SUCCESS, List.copyOf(tokens), null);
    }

    public static LexResult failed(@NotNull LexError error) {
        return new LexResult(Status.FAILED, List.of(), Objects.requireNonNull(error, "error"));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * @throws IllegalStateException if the scan failed
     */
    @NotNull
    public List<Token> getTokens() {
        if (status == Status.FAILED) {
            throw new IllegalStateException("Scan failed: " + error.getMessage());
        }
        return tokens;
    }

    @NotNull
    public List<Token> getTokensOrThrow() throws LexException {
        if (status == Status.FAILED) {
            throw new LexException(error);
        }
        return tokens;
    }

    /**
     * @return the error, or {@code null} on success
     */
    @Nullable
    public LexError getError() {
        return error;
    }
}
