package org.rubyshift.transpiler.annotation;

import org.rubyshift.transpiler.api.SourceLocation;

/**
 * A raw source comment.
 *
 * @param text     The comment text including the leading {@code #}.
 * @param location Where the comment starts.
 * @param ownLine  Whether the comment is the only thing on its line.
 */
public record Comment(String text, SourceLocation location, boolean ownLine) {

    public int line() {
        return location != null ? location.line() : 0;
    }

    public String fileName() {
        return location != null ? location.fileName() : null;
    }
}
