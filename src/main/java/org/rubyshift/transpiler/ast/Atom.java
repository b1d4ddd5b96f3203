package org.rubyshift.transpiler.ast;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A symbolic scalar such as {@code :require} or {@code :<<}.
 *
 * @param name The symbol name without the leading colon.
 */
public record Atom(String name) implements Comparable<Atom> {

    private static final Pattern PLAIN = Pattern.compile("[^\\s()\\[\\]\"#,]+");

    public Atom {
        Objects.requireNonNull(name, "name");
    }

    /**
     * Shorthand constructor.
     */
    public static Atom of(String name) {
        return new Atom(name);
    }

    @Override
    public int compareTo(Atom other) {
        return name.compareTo(other.name);
    }

    /**
     * @return The s-expression form, quoted when the name contains delimiters.
     */
    @Override
    public String toString() {
        if (PLAIN.matcher(name).matches()) {
            return ":" + name;
        }
        return ":" + Nodes.quote(name);
    }
}
