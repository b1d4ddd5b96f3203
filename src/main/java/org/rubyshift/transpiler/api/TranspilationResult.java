package org.rubyshift.transpiler.api;

import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;

import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.diagnostics.Diagnostic;

/**
 * Outcome of a successful transpilation.
 *
 * @param tree        The transformed tree, or {@code null} when everything was removed.
 * @param output      The printed form of {@code tree}.
 * @param timestamps  Modification times of the main file and every inlined file, keyed by canonical path.
 * @param diagnostics Non-fatal diagnostics reported along the way.
 */
public record TranspilationResult(
        Node tree,
        String output,
        Map<String, FileTime> timestamps,
        List<Diagnostic> diagnostics
) {
    public TranspilationResult {
        timestamps = Map.copyOf(timestamps);
        diagnostics = List.copyOf(diagnostics);
    }
}
