package com.oxypy.core.diagnostics;

import com.oxypy.api.diagnostics.Diagnostic;
import com.oxypy.api.diagnostics.DiagnosticsProvider;
import com.oxypy.api.diagnostics.ErrorHighlightingService;
import com.oxypy.api.language.LanguageSupport;
import com.oxypy.api.vfs.FileObject;
import com.oxypy.core.language.LanguageRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Core implementation of {@link ErrorHighlightingService}.
 *
 * Delegates to a language-specific {@link DiagnosticsProvider} via {@link LanguageSupport}.
 */
public final class ErrorHighlightingServiceImpl implements ErrorHighlightingService {

    private final LanguageRegistry languages;

    public ErrorHighlightingServiceImpl(LanguageRegistry languages) {
        this.languages = Objects.requireNonNull(languages, "languages");
    }

    @Override
    public List<Diagnostic> getDiagnostics(FileObject file, String text) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(text, "text");

        LanguageSupport support = languages.require(file);
        DiagnosticsProvider provider = support.createDiagnosticsProvider(file);
        if (provider == null) {
            return List.of();
        }

        return List.copyOf(provider.getDiagnostics(file, text));
    }
}
