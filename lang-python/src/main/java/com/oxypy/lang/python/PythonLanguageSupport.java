package com.oxypy.lang.python;

import com.oxypy.api.diagnostics.DiagnosticsProvider;
import com.oxypy.api.editor.SyntaxHighlighter;
import com.oxypy.api.language.LanguageSupport;
import com.oxypy.api.vfs.FileObject;
import com.oxypy.lang.python.diagnostics.PythonDiagnosticsProvider;
import com.oxypy.lang.python.editor.PythonSyntaxHighlighter;

public class PythonLanguageSupport implements LanguageSupport {

    public static final String ID = "python";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public boolean canHandle(FileObject file) {
        return "py".equals(file.getExtension());
    }

    @Override
    public SyntaxHighlighter createHighlighter(FileObject file) {
        return new PythonSyntaxHighlighter();
    }

    @Override
    public DiagnosticsProvider createDiagnosticsProvider(FileObject file) {
        return new PythonDiagnosticsProvider();
    }
}
