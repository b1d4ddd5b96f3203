package org.rubyshift.transpiler.api;

/**
 * Position of a node or comment in its source file.
 *
 * @param fileName The logical name of the file, or {@code null} when the source has no file.
 * @param line     The 1-based line number.
 * @param column   The 1-based column number.
 */
public record SourceLocation(String fileName, int line, int column) {

    @Override
    public String toString() {
        return (fileName != null ? fileName : "<unknown>") + ":" + line + ":" + column;
    }
}
