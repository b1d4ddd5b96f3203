package org.rubyshift.transpiler.api;

/**
 * Thrown when one or more fatal errors occur while transpiling a source tree.
 * <p>
 * Part of the public API; internal failures such as unresolved requires or parse errors are
 * recorded as diagnostics and surface through this exception.
 */
public class CompilationException extends Exception {

    /**
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
    }

    /**
     * @param message The detail message.
     * @param cause   The underlying failure.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @param message  The detail message.
     * @param location Where the failure happened.
     */
    public CompilationException(String message, SourceLocation location) {
        super(String.format("%s at %s", message, location), null);
    }
}
