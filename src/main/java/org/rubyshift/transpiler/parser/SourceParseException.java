package org.rubyshift.transpiler.parser;

import org.rubyshift.transpiler.api.SourceLocation;

/**
 * Thrown when a source cannot be parsed.
 */
public class SourceParseException extends RuntimeException {

    private final SourceLocation location;

    public SourceParseException(String message, SourceLocation location) {
        super(message + " at " + location);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
