package com.oxypy.core.language;

import com.oxypy.api.editor.SyntaxHighlighter;
import com.oxypy.api.language.LanguageSupport;
import com.oxypy.api.vfs.FileObject;
import com.oxypy.core.vfs.InMemoryFileObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class LanguageRegistryTest {

    private LanguageRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new LanguageRegistry();
    }

    @Test
    void findsFirstSupportThatHandlesFile() {
        ExtensionSupport first = new ExtensionSupport("first", "py");
        ExtensionSupport second = new ExtensionSupport("second", "py");
        registry.register(first);
        registry.register(second);

        assertSame(first, registry.find(file("main.py")));
        assertNull(registry.find(file("main.txt")));
    }

    @Test
    void reRegisteringKeepsPosition() {
        registry.register(new ExtensionSupport("a", "py"));
        registry.register(new ExtensionSupport("b", "py"));
        ExtensionSupport replacement = new ExtensionSupport("a", "py");
        registry.register(replacement);

        assertEquals(List.of("a", "b"), registry.getAll().stream().map(LanguageSupport::getId).toList());
        assertSame(replacement, registry.find(file("x.py")));
    }

    @Test
    void requireFailsForUnknownFiles() {
        registry.register(new ExtensionSupport("python", "py"));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> registry.require(file("README")));
        assertTrue(e.getMessage().contains("README"));
    }

    @Test
    void skipsSupportsThatThrow() {
        LanguageSupport broken = new ExtensionSupport("broken", "py") {
            @Override
            public boolean canHandle(FileObject file) {
                throw new IllegalStateException("boom");
            }
        };
        ExtensionSupport working = new ExtensionSupport("working", "py");
        registry.register(broken);
        registry.register(working);

        assertSame(working, registry.find(file("a.py")));
    }

    @Test
    void unregisterAndBlankIds() {
        registry.register(new ExtensionSupport("python", "py"));
        registry.unregister(" python ");

        assertNull(registry.getById("python"));
        assertNull(registry.getById(" "));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new ExtensionSupport(" ", "py")));
    }

    private static FileObject file(String name) {
        return new InMemoryFileObject("/src/" + name, "");
    }

    private static class ExtensionSupport implements LanguageSupport {

        private final String id;
        private final String extension;

        ExtensionSupport(String id, String extension) {
            this.id = id;
            this.extension = extension;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean canHandle(FileObject file) {
            return extension.equals(file.getExtension());
        }

        @Override
        public SyntaxHighlighter createHighlighter(FileObject file) {
            return content -> CompletableFuture.completedFuture(List.of());
        }
    }
}
