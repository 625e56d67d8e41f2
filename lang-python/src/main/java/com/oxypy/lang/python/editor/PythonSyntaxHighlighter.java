package com.oxypy.lang.python.editor;

import com.oxypy.api.editor.SyntaxHighlighter;
import com.oxypy.api.editor.TokenSpan;
import com.oxypy.lang.python.lexer.LexError;
import com.oxypy.lang.python.lexer.LexResult;
import com.oxypy.lang.python.lexer.PythonLexer;
import com.oxypy.lang.python.lexer.Token;
import com.oxypy.lang.python.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Lexer-backed highlighter.
 *
 * When the text does not lex, the only span produced is an {@link TokenSpan.TokenType#ERROR} span over the
 * offending character.
 */
public class PythonSyntaxHighlighter implements SyntaxHighlighter {

    private final Executor executor;

    /**
     * Highlights on the calling thread.
     */
    public PythonSyntaxHighlighter() {
        this(Runnable::run);
    }

    public PythonSyntaxHighlighter(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<List<TokenSpan>> highlight(String content) {
        Objects.requireNonNull(content, "content");
        return CompletableFuture.supplyAsync(() -> computeSpans(content), executor);
    }

    static List<TokenSpan> computeSpans(String content) {
        LexResult result = PythonLexer.tryLex(content);
        if (!result.isSuccess()) {
            LexError error = result.getError();
            return List.of(new TokenSpan(error.offset(), error.charCount(), TokenSpan.TokenType.ERROR));
        }

        List<Token> tokens = result.getTokens();
        List<TokenSpan> spans = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            TokenSpan.TokenType type = toSpanType(token.kind());
            if (type != null) {
                spans.add(new TokenSpan(token.offset(), token.length(), type));
            }
        }
        return spans;
    }

    private static TokenSpan.TokenType toSpanType(TokenKind kind) {
        if (kind.isKeyword()) return TokenSpan.TokenType.KEYWORD;
        if (kind.isOperator()) return TokenSpan.TokenType.OPERATOR;
        if (kind == TokenKind.NAME) return TokenSpan.TokenType.IDENTIFIER;
        // layout tokens have no text to style
        return null;
    }
}
