package com.oxypy.api.diagnostics;

/**
 * Severity of a diagnostic produced by a language analysis engine.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO
}
