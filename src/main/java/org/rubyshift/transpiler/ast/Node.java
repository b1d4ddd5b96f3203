package org.rubyshift.transpiler.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.rubyshift.transpiler.api.SourceLocation;

/**
 * An immutable syntax-tree node: a tag, an ordered list of children and an optional source
 * location.
 * <p>
 * Children are other nodes, scalars ({@link String}, {@link Long}, {@link Double},
 * {@link Boolean}, {@link Atom}), {@code null}, or lists of such values. Integral numbers are
 * normalized to {@link Long}. Two nodes are equal when their tags and children are equal; the
 * location is metadata and does not take part in equality.
 */
public final class Node {

    private final String tag;
    private final List<Object> children;
    private final SourceLocation location;

    public Node(String tag, List<?> children, SourceLocation location) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.children = copyChildren(children);
        this.location = location;
    }

    /**
     * Creates a node without location.
     */
    public static Node of(String tag, Object... children) {
        return new Node(tag, children == null ? List.of() : Arrays.asList(children), null);
    }

    /**
     * Creates a node without location from a list of children.
     */
    public static Node of(String tag, List<?> children) {
        return new Node(tag, children, null);
    }

    public String tag() {
        return tag;
    }

    public boolean is(String candidate) {
        return tag.equals(candidate);
    }

    public List<Object> children() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public Object child(int index) {
        return children.get(index);
    }

    /**
     * @return The child at {@code index} if it is a node, otherwise {@code null}.
     */
    public Node childNode(int index) {
        if (index < 0 || index >= children.size()) {
            return null;
        }
        Object child = children.get(index);
        return child instanceof Node n ? n : null;
    }

    public SourceLocation location() {
        return location;
    }

    public boolean hasLocation() {
        return location != null;
    }

    /**
     * Returns a copy with a new tag and/or new children, keeping the location.
     *
     * @param newTag      The new tag, or {@code null} to keep the current one.
     * @param newChildren The new children, or {@code null} to keep the current ones.
     * @return The updated node.
     */
    public Node updated(String newTag, List<?> newChildren) {
        return new Node(newTag != null ? newTag : tag, newChildren != null ? newChildren : children, location);
    }

    public Node withChildren(List<?> newChildren) {
        return updated(null, newChildren);
    }

    public Node withLocation(SourceLocation newLocation) {
        return new Node(tag, children, newLocation);
    }

    /**
     * @return The s-expression form of this subtree, on a single line.
     */
    public String toSexp() {
        StringBuilder sb = new StringBuilder();
        Nodes.appendSexp(sb, this);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node other)) {
            return false;
        }
        return tag.equals(other.tag) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return 31 * tag.hashCode() + children.hashCode();
    }

    @Override
    public String toString() {
        return toSexp();
    }

    private static List<Object> copyChildren(List<?> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        List<Object> copy = new ArrayList<>(source.size());
        for (Object child : source) {
            copy.add(normalize(child));
        }
        return Collections.unmodifiableList(copy);
    }

    private static Object normalize(Object child) {
        if (child == null || child instanceof Node || child instanceof String || child instanceof Long
                || child instanceof Double || child instanceof Boolean || child instanceof Atom) {
            return child;
        }
        if (child instanceof Integer || child instanceof Short || child instanceof Byte) {
            return ((Number) child).longValue();
        }
        if (child instanceof Float f) {
            return f.doubleValue();
        }
        if (child instanceof List<?> list) {
            return copyChildren(list);
        }
        throw new IllegalArgumentException("Unsupported child value of type " + child.getClass().getName());
    }
}
