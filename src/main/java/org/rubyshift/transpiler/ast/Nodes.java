package org.rubyshift.transpiler.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Static helpers for working with {@link Node} trees.
 */
public final class Nodes {

    private Nodes() {}

    public static boolean isNode(Object value) {
        return value instanceof Node;
    }

    public static boolean isNode(Object value, String tag) {
        return value instanceof Node n && n.is(tag);
    }

    /**
     * Returns the statements of a body: empty for {@code null}, the children of a
     * {@code begin}, or the body itself.
     */
    public static List<Node> statements(Node body) {
        List<Node> result = new ArrayList<>();
        if (body == null) {
            return result;
        }
        if (body.is("begin")) {
            for (Object child : body.children()) {
                if (child instanceof Node n) {
                    result.add(n);
                }
            }
        } else {
            result.add(body);
        }
        return result;
    }

    /**
     * Builds a body from statements: {@code null} for none, the single statement, or a
     * {@code begin} wrapping all of them.
     */
    public static Node body(List<Node> statements) {
        if (statements.isEmpty()) {
            return null;
        }
        if (statements.size() == 1) {
            return statements.get(0);
        }
        return Node.of("begin", statements);
    }

    /**
     * Visits every node of the subtree in pre-order, including nodes nested in list children.
     */
    public static void walk(Node root, Consumer<Node> visitor) {
        if (root == null) {
            return;
        }
        visitor.accept(root);
        for (Object child : root.children()) {
            walkValue(child, visitor);
        }
    }

    private static void walkValue(Object value, Consumer<Node> visitor) {
        if (value instanceof Node n) {
            walk(n, visitor);
        } else if (value instanceof List<?> list) {
            for (Object element : list) {
                walkValue(element, visitor);
            }
        }
    }

    static void appendSexp(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("nil");
        } else if (value instanceof Node node) {
            sb.append('(').append(node.tag());
            for (Object child : node.children()) {
                sb.append(' ');
                appendSexp(sb, child);
            }
            sb.append(')');
        } else if (value instanceof String s) {
            sb.append(quote(s));
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                appendSexp(sb, list.get(i));
            }
            sb.append(']');
        } else {
            sb.append(value);
        }
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
