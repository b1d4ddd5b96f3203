package org.rubyshift.transpiler.diagnostics;

/**
 * A single diagnostic message (error, warning, info) produced while transpiling.
 *
 * @param type       The severity.
 * @param message    The message.
 * @param fileName   The file the message refers to, or {@code null}.
 * @param lineNumber The line the message refers to, {@code 0} if unknown.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * Severity of a diagnostic.
     */
    public enum Type {
        /** Prevents a result from being produced. */
        ERROR,
        /** Reported, but the result is still produced. */
        WARNING,
        /** Informational. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName != null ? fileName : "<input>", lineNumber, message);
    }
}
