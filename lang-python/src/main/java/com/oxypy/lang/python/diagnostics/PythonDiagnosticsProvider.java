package com.oxypy.lang.python.diagnostics;

import com.oxypy.api.diagnostics.Diagnostic;
import com.oxypy.api.diagnostics.DiagnosticSeverity;
import com.oxypy.api.diagnostics.DiagnosticsProvider;
import com.oxypy.api.vfs.FileObject;
import com.oxypy.lang.python.lexer.LexError;
import com.oxypy.lang.python.lexer.LexResult;
import com.oxypy.lang.python.lexer.PythonLexer;

import java.util.List;
import java.util.Objects;

/**
 * Reports lexical errors. The lexer stops at the first error, so there is at most one diagnostic.
 */
public final class PythonDiagnosticsProvider implements DiagnosticsProvider {

    public static final String SOURCE = "oxy-lexer";
    public static final String CODE_UNEXPECTED_CHARACTER = "unexpected-character";

    @Override
    public List<Diagnostic> getDiagnostics(FileObject file, String text) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(text, "text");

        LexResult result = PythonLexer.tryLex(text);
        if (result.isSuccess()) {
            return List.of();
        }

        LexError error = result.getError();
        int start = error.offset();
        return List.of(new Diagnostic(
                DiagnosticSeverity.ERROR,
                start,
                start + error.charCount(),
                error.start().line(),
                error.start().column(),
                error.getMessage(),
                CODE_UNEXPECTED_CHARACTER,
                SOURCE
        ));
    }
}
