package com.oxypy.api.language;

import com.oxypy.api.diagnostics.DiagnosticsProvider;
import com.oxypy.api.editor.SyntaxHighlighter;
import com.oxypy.api.vfs.FileObject;

/**
 * Factory interface for language services.
 */
public interface LanguageSupport {

    /**
     * @return a short, stable id for the language (e.g. "python")
     */
    String getId();

    /**
     * @return true if this support handles the given file (e.g. extension "py")
     */
    boolean canHandle(FileObject file);

    /**
     * Creates a highlighter specific to this file context.
     */
    SyntaxHighlighter createHighlighter(FileObject file);

    /**
     * Creates a diagnostics provider specific to this file context.
     *
     * Returning {@code null} means diagnostics are not supported for this language.
     */
    default DiagnosticsProvider createDiagnosticsProvider(FileObject file) {
        return null;
    }
}
