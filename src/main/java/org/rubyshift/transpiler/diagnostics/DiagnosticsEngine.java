package org.rubyshift.transpiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.rubyshift.transpiler.api.SourceLocation;

/**
 * Diagnostics of one transpilation, in reporting order.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportError(String message, String fileName, int lineNumber) {
        report(Diagnostic.Type.ERROR, message, fileName, lineNumber);
    }

    /**
     * Reports an error at {@code location}, which may be {@code null} for unlocated nodes.
     */
    public void reportError(String message, SourceLocation location) {
        if (location == null) {
            report(Diagnostic.Type.ERROR, message, null, 0);
        } else {
            report(Diagnostic.Type.ERROR, message, location.fileName(), location.line());
        }
    }

    public void reportWarning(String message, String fileName, int lineNumber) {
        report(Diagnostic.Type.WARNING, message, fileName, lineNumber);
    }

    private void report(Diagnostic.Type type, String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(type, message, fileName, lineNumber));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return One formatted diagnostic per line, the message of {@code CompilationException}.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
