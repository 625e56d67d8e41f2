package com.oxypy.api.diagnostics;

import com.oxypy.api.vfs.FileObject;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Facade over language diagnostics providers.
 *
 * This is used for "error highlighting": producing errors/warnings/info with precise ranges.
 * This is NOT syntax highlighting.
 */
public interface ErrorHighlightingService {

    List<Diagnostic> getDiagnostics(FileObject file, String text);

    default CompletableFuture<List<Diagnostic>> getDiagnosticsAsync(FileObject file, String text, Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> getDiagnostics(file, text), executor);
    }

    default CompletableFuture<List<Diagnostic>> getDiagnosticsAsync(FileObject file, String text) {
        return CompletableFuture.supplyAsync(() -> getDiagnostics(file, text), ForkJoinPool.commonPool());
    }
}
