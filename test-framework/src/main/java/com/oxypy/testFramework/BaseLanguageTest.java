package com.oxypy.testFramework;

import com.oxypy.api.diagnostics.ErrorHighlightingService;
import com.oxypy.api.language.LanguageSupport;
import com.oxypy.core.diagnostics.ErrorHighlightingServiceImpl;
import com.oxypy.core.language.LanguageRegistry;
import com.oxypy.core.vfs.InMemoryFileObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/**
 * Base class for language integration tests.
 * <p>
 * - Configures test logging.
 * - Creates a fresh {@link LanguageRegistry} and {@link ErrorHighlightingService} before every test.
 * - Provides helpers for creating in-memory files.
 */
public abstract class BaseLanguageTest {

    protected LanguageRegistry languages;
    protected ErrorHighlightingService errorHighlighting;

    @BeforeEach
    public final void baseSetUp() throws Exception {
        TestLogging.configureOnce();

        languages = new LanguageRegistry();
        errorHighlighting = new ErrorHighlightingServiceImpl(languages);
        for (LanguageSupport support : createLanguageSupports()) {
            languages.register(support);
        }

        beforeEach();
    }

    @AfterEach
    public final void baseTearDown() {
        afterEach();
    }

    /**
     * Languages registered before each test.
     */
    protected abstract Iterable<LanguageSupport> createLanguageSupports();

    protected void beforeEach() throws Exception {
    }

    protected void afterEach() {
    }

    protected InMemoryFileObject file(String path, String content) {
        return new InMemoryFileObject("/test/" + path, content);
    }
}
