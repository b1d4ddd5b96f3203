package org.rubyshift.transpiler.filter.features.require;

import org.rubyshift.transpiler.api.SourceLocation;

/**
 * Thrown when a required file cannot be found. Aborts the transpilation.
 */
public class UnresolvedRequireException extends RuntimeException {

    private final String reference;
    private final SourceLocation location;

    public UnresolvedRequireException(String reference, SourceLocation location) {
        super("Cannot resolve required file '" + reference + "'");
        this.reference = reference;
        this.location = location;
    }

    public String getReference() {
        return reference;
    }

    /**
     * @return The location of the require statement, may be {@code null}.
     */
    public SourceLocation getLocation() {
        return location;
    }
}
