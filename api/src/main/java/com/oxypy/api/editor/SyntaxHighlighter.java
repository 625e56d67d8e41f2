package com.oxypy.api.editor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Represents the generic capability to highlight code.
 */
public interface SyntaxHighlighter {
    /**
     * @param content The current text in the editor.
     * @return A future containing the token spans (start, length, type), ordered by start offset.
     */
    CompletableFuture<List<TokenSpan>> highlight(String content);
}
