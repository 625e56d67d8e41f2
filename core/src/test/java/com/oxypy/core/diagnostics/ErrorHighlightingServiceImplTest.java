package com.oxypy.core.diagnostics;

import com.oxypy.api.diagnostics.Diagnostic;
import com.oxypy.api.diagnostics.DiagnosticSeverity;
import com.oxypy.api.diagnostics.DiagnosticsProvider;
import com.oxypy.api.editor.SyntaxHighlighter;
import com.oxypy.api.language.LanguageSupport;
import com.oxypy.api.vfs.FileObject;
import com.oxypy.core.language.LanguageRegistry;
import com.oxypy.core.vfs.InMemoryFileObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorHighlightingServiceImplTest {

    @Test
    void delegatesToLanguageProvider() throws Exception {
        LanguageRegistry registry = new LanguageRegistry();
        registry.register(new FakeSupport("fake", (file, text) -> text.contains("!")
                ? List.of(new Diagnostic(DiagnosticSeverity.WARNING, text.indexOf('!'), text.indexOf('!') + 1, 1, text.indexOf('!') + 1, "bang", null, "fake"))
                : List.of()));
        ErrorHighlightingServiceImpl service = new ErrorHighlightingServiceImpl(registry);
        FileObject file = new InMemoryFileObject("/a.fake", "");

        assertTrue(service.getDiagnostics(file, "quiet").isEmpty());

        List<Diagnostic> diags = service.getDiagnosticsAsync(file, "hey!").get(5, TimeUnit.SECONDS);
        assertEquals(1, diags.size());
        assertEquals(3, diags.get(0).getStartOffset());
        assertEquals("bang", diags.get(0).getMessage());
    }

    @Test
    void languageWithoutProviderHasNoDiagnostics() {
        LanguageRegistry registry = new LanguageRegistry();
        registry.register(new FakeSupport("fake", null));
        ErrorHighlightingServiceImpl service = new ErrorHighlightingServiceImpl(registry);

        assertTrue(service.getDiagnostics(new InMemoryFileObject("/b.fake", ""), "text").isEmpty());
    }

    @Test
    void rejectsNullArguments() {
        ErrorHighlightingServiceImpl service = new ErrorHighlightingServiceImpl(new LanguageRegistry());
        FileObject file = new InMemoryFileObject("/c.fake", "");

        assertThrows(NullPointerException.class, () -> service.getDiagnostics(null, "x"));
        assertThrows(NullPointerException.class, () -> service.getDiagnostics(file, null));
    }

    @Test
    void diagnosticRejectsInvertedRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new Diagnostic(DiagnosticSeverity.ERROR, 4, 2, 1, 5, "bad", null, null));
    }

    private static final class FakeSupport implements LanguageSupport {

        private final String id;
        private final DiagnosticsProvider provider;

        FakeSupport(String id, DiagnosticsProvider provider) {
            this.id = id;
            this.provider = provider;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean canHandle(FileObject file) {
            return id.equals(file.getExtension());
        }

        @Override
        public SyntaxHighlighter createHighlighter(FileObject file) {
            return content -> CompletableFuture.completedFuture(List.of());
        }

        @Override
        public DiagnosticsProvider createDiagnosticsProvider(FileObject file) {
            return provider;
        }
    }
}
