package org.rubyshift.transpiler.annotation;

import org.rubyshift.transpiler.api.SourceLocation;

/**
 * A (file, line) pair. The file may be {@code null} for sources that were not read from disk.
 */
public record LineKey(String fileName, int line) {

    public static LineKey of(SourceLocation location) {
        return new LineKey(location.fileName(), location.line());
    }

    public LineKey withoutFile() {
        return new LineKey(null, line);
    }
}
