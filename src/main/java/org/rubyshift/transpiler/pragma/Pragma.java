package org.rubyshift.transpiler.pragma;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-line directives recognised in {@code # Pragma: <name>} comments.
 */
public enum Pragma {
    /** {@code ||} becomes the nullish operator. */
    NULLISH("??", "nullish"),
    /** {@code ||} stays a logical or. */
    LOGICAL("||", "logical"),
    /** Force function syntax instead of arrow functions. */
    NOES2015("noes2015", "function"),
    /** Guard splats against {@code null}. */
    GUARD("guard"),
    ARRAY("array"),
    HASH("hash"),
    STRING("string"),
    /** {@code proc.call(x)} becomes a direct invocation. */
    METHOD("method"),
    /** {@code self} becomes {@code this}. */
    SELF("self"),
    /** {@code .class} becomes {@code .constructor}. */
    PROTO("proto"),
    /** Iterate hashes through their entries. */
    ENTRIES("entries"),
    /** Drop the statement. */
    SKIP("skip");

    private static final Map<String, Pragma> BY_NAME;

    static {
        Map<String, Pragma> names = new HashMap<>();
        for (Pragma pragma : values()) {
            for (String name : pragma.names) {
                names.put(name, pragma);
            }
        }
        BY_NAME = Collections.unmodifiableMap(names);
    }

    private final String[] names;

    Pragma(String... names) {
        this.names = names;
    }

    /**
     * Looks up a pragma by the exact name written in the comment.
     *
     * @param name The name, e.g. {@code "??"} or {@code "array"}.
     * @return The pragma, or empty for unknown names.
     */
    public static Optional<Pragma> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
