package com.oxypy.api.diagnostics;

import com.oxypy.api.vfs.FileObject;

import java.util.List;

/**
 * Language-specific diagnostics provider for a particular file.
 *
 * Implementations should treat the passed text as the source of truth (it may be unsaved).
 */
public interface DiagnosticsProvider {

    /**
     * Computes diagnostics for the given file and text snapshot.
     *
     * Problems found in the text are reported as diagnostics, never thrown.
     */
    List<Diagnostic> getDiagnostics(FileObject file, String text);
}
