package com.oxypy.lang.python.lexer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-pass scanner for the Python-like source language.
 *
 * <p>The lexer walks the text left to right, one code point at a time, and produces
 * {@link Token}s on demand through {@link #nextToken()}. It recognizes:
 * <ul>
 *     <li>the operators {@code + - * ** /}; a single character of lookahead separates {@code *} from {@code **}</li>
 *     <li>identifiers: greedy runs of alphabetic characters, turned into keywords through {@link Keywords}</li>
 *     <li>spaces, which are skipped</li>
 * </ul>
 * Anything else (digits, underscores, tabs, line breaks, punctuation) fails the scan with a {@link LexError}.
 * Line breaks are not tracked, so every location reports line 1.
 *
 * <p>Once the end of input is reached {@link #nextToken()} keeps returning {@code null}. Once it has failed
 * it keeps throwing the same error; a new lexer must be created to scan new input.
 *
 * <p>Instances are not thread-safe. The static entry points create a fresh lexer per call.
 */
public final class PythonLexer {

    private static final Logger LOG = Logger.getLogger(PythonLexer.class.getName());

    private static final int EOF = -1;

    private enum State {
        SCANNING,
        DONE,
        FAILED
    }

    private final String text;

    /** UTF-16 index of the current character. */
    private int position;
    private int line = 1;
    private int column = 1;

    private State state = State.SCANNING;
    private LexError error;

    public PythonLexer(@NotNull String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * Scans the whole text.
     *
     * @return every token of {@code text}, in source order
     * @throws LexException at the first unrecognized character; no tokens are returned in that case
     */
    @NotNull
    public static List<Token> lex(@NotNull String text) throws LexException {
        return new PythonLexer(text).tokenize();
    }

    /**
     * Same as {@link #lex(String)} but reports the failure in the result instead of throwing.
     */
    @NotNull
    public static LexResult tryLex(@NotNull String text) {
        try {
            return LexResult.success(lex(text));
        } catch (LexException e) {
            return LexResult.failed(e.getError());
        }
    }

    /**
     * Drains the remaining input.
     */
    @NotNull
    public List<Token> tokenize() throws LexException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        while ((token = nextToken()) != null) {
            tokens.add(token);
        }
        return List.copyOf(tokens);
    }

    /**
     * @return the next token, or {@code null} when the input is exhausted
     * @throws LexException if the next character is not recognized
     */
    @Nullable
    public Token nextToken() throws LexException {
        while (state == State.SCANNING) {
            if (position >= text.length()) {
                state = State.DONE;
                break;
            }

            int c = text.codePointAt(position);
            switch (c) {
                case '+' -> {
                    return emit(TokenKind.PLUS, 1);
                }
                case '-' -> {
                    return emit(TokenKind.MINUS, 1);
                }
                case '/' -> {
                    return emit(TokenKind.SLASH, 1);
                }
                case '*' -> {
                    return peek() == '*' ? emit(TokenKind.STAR_STAR, 2) : emit(TokenKind.STAR, 1);
                }
                case ' ' -> {
                    position++;
                    column++;
                }
                default -> {
                    if (Character.isAlphabetic(c)) {
                        return identifier();
                    }
                    throw fail(c);
                }
            }
        }

        if (state == State.FAILED) {
            throw new LexException(error);
        }
        return null;
    }

    private Token identifier() {
        String run = consumeWhile(Character::isAlphabetic);
        return emit(Keywords.lookup(run), run.codePointCount(0, run.length()));
    }

    /**
     * Collects the code points starting at the cursor for as long as {@code predicate} holds.
     * Does not move the cursor: the first non-matching character is still current afterwards.
     */
    private String consumeWhile(IntPredicate predicate) {
        int end = position;
        while (end < text.length()) {
            int cp = text.codePointAt(end);
            if (!predicate.test(cp)) {
                break;
            }
            end += Character.charCount(cp);
        }
        return text.substring(position, end);
    }

    /**
     * @return the code point after the current one, or {@link #EOF}
     */
    private int peek() {
        int next = position + Character.charCount(text.codePointAt(position));
        return next < text.length() ? text.codePointAt(next) : EOF;
    }

    /**
     * Creates a token covering {@code span} code points from the cursor and moves past them.
     */
    private Token emit(TokenKind kind, int span) {
        int begin = position;
        int endIndex = text.offsetByCodePoints(position, span);

        Location start = new Location(line, column);
        column += span;
        Location end = new Location(line, column - 1);

        position = endIndex;
        return new Token(start, end, kind, text.substring(begin, endIndex), begin);
    }

    private LexException fail(int c) {
        Location at = new Location(line, column);
        error = new LexError(c, at, at, position);
        state = State.FAILED;

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("lex result=fail offset=" + position + " location=" + at + " reason=" + error.getMessage());
        }
        return new LexException(error);
    }
}
