package org.rubyshift.transpiler.printer;

import java.util.ArrayList;
import java.util.List;

import org.rubyshift.transpiler.annotation.Comment;
import org.rubyshift.transpiler.ast.Node;

/**
 * Prints a tree in the s-expression format read by the parser, one top-level statement per
 * line. {@code hide} nodes are left out of statement sequences.
 */
public class SexpPrinter implements NodePrinter {

    @Override
    public String print(Node root, PrintOptions options) {
        StringBuilder out = new StringBuilder();
        for (Node statement : topLevel(root)) {
            if (options.includeComments() && options.annotations() != null) {
                for (Comment comment : options.annotations().commentsFor(statement)) {
                    out.append(comment.text()).append('\n');
                }
            }
            out.append(visible(statement).toSexp()).append('\n');
        }
        return out.toString();
    }

    private static List<Node> topLevel(Node root) {
        List<Node> statements = new ArrayList<>();
        collect(root, statements);
        return statements;
    }

    private static void collect(Node node, List<Node> statements) {
        if (node == null || node.is("hide")) {
            return;
        }
        if (node.is("begin") && node.childCount() > 1) {
            for (Object child : node.children()) {
                if (child instanceof Node nested) {
                    collect(nested, statements);
                }
            }
        } else {
            statements.add(node);
        }
    }

    /**
     * Drops {@code hide} statements from nested statement sequences.
     */
    private static Node visible(Node node) {
        List<Object> children = new ArrayList<>(node.childCount());
        boolean changed = false;
        for (Object child : node.children()) {
            if (child instanceof Node nested) {
                if (node.is("begin") && nested.is("hide")) {
                    changed = true;
                    continue;
                }
                Node shown = visible(nested);
                changed |= shown != nested;
                children.add(shown);
            } else {
                children.add(child);
            }
        }
        return changed ? node.withChildren(children) : node;
    }
}
