package org.rubyshift.transpiler.filter.features.combiner;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.rubyshift.transpiler.ast.Atom;
import org.rubyshift.transpiler.ast.Node;

/**
 * Deduplicates imports of the same path.
 * <p>
 * Two forms are recognised: {@code (import path [default] [named...])} nodes and
 * {@code (send nil :import ...)} calls. Import nodes with the same path are merged into one
 * holding the first default binding and the union of named bindings; calls are only
 * deduplicated when identical.
 */
final class ImportMerger {

    private static final Atom IMPORT = Atom.of("import");
    private static final Atom FROM = Atom.of("from");

    private ImportMerger() {}

    static boolean isImport(Node node) {
        return node.is("import") || isImportCall(node);
    }

    private static boolean isImportCall(Node node) {
        return node.is("send") && node.childCount() >= 2 && node.child(0) == null && IMPORT.equals(node.child(1));
    }

    /**
     * @return The module path an import refers to.
     */
    static String pathOf(Node node) {
        if (isImportCall(node)) {
            for (Object child : node.children()) {
                if (child instanceof Node hash && hash.is("hash")) {
                    String from = fromPair(hash.children());
                    if (from != null) {
                        return from;
                    }
                }
            }
            for (Object child : node.children()) {
                if (child instanceof Node str && str.is("str")) {
                    return String.valueOf(str.child(0));
                }
            }
            return node.toSexp();
        }

        Object path = node.childCount() > 0 ? node.child(0) : null;
        if (path instanceof List<?> pairs) {
            String from = fromPair(pairs);
            if (from != null) {
                return from;
            }
            return pairs.isEmpty() ? "" : String.valueOf(pairs.get(0));
        }
        return String.valueOf(path);
    }

    private static String fromPair(List<?> pairs) {
        for (Object candidate : pairs) {
            if (candidate instanceof Node pair && pair.is("pair") && pair.childCount() == 2) {
                Node key = pair.childNode(0);
                Node value = pair.childNode(1);
                if (key != null && key.childCount() > 0 && FROM.equals(key.child(0)) && value != null && value.childCount() > 0) {
                    return String.valueOf(value.child(0));
                }
            }
        }
        return null;
    }

    /**
     * Merges a later import of the same path into an earlier one.
     *
     * @return The merged import, or {@code null} if the two cannot be merged and both must stay.
     */
    static Node merge(Node original, Node addition) {
        List<Object> originalBindings = original.children().subList(1, original.childCount());
        List<Object> additionalBindings = addition.children().subList(1, addition.childCount());

        if (original.tag().equals(addition.tag()) && originalBindings.equals(additionalBindings)) {
            return original;
        }
        if (!original.is("import") || !addition.is("import")) {
            return null;
        }
        if (additionalBindings.isEmpty()) {
            return original;
        }
        if (originalBindings.isEmpty()) {
            return addition;
        }

        List<Object> children = new ArrayList<>();
        children.add(original.child(0));
        children.addAll(mergeBindings(originalBindings, additionalBindings));
        return original.withChildren(children);
    }

    private static List<Object> mergeBindings(List<Object> original, List<Object> addition) {
        Node defaultBinding = defaultBinding(original);
        if (defaultBinding == null) {
            defaultBinding = defaultBinding(addition);
        }

        List<Object> result = new ArrayList<>();
        if (defaultBinding != null) {
            result.add(defaultBinding);
        }

        List<?> originalNamed = namedBindings(original);
        List<?> additionalNamed = namedBindings(addition);
        if (originalNamed != null || additionalNamed != null) {
            List<Object> all = new ArrayList<>();
            if (originalNamed != null) {
                all.addAll(originalNamed);
            }
            if (additionalNamed != null) {
                all.addAll(additionalNamed);
            }
            Set<Object> seen = new HashSet<>();
            List<Object> unique = new ArrayList<>();
            for (Object spec : all) {
                if (spec instanceof Node node && seen.add(node.childCount() > 1 ? node.child(1) : node)) {
                    unique.add(node);
                }
            }
            if (!unique.isEmpty()) {
                result.add(unique);
            }
        }
        return result;
    }

    private static Node defaultBinding(List<Object> bindings) {
        for (Object binding : bindings) {
            if (binding instanceof Node node && node.is("const")) {
                return node;
            }
        }
        return null;
    }

    private static List<?> namedBindings(List<Object> bindings) {
        for (Object binding : bindings) {
            if (binding instanceof List<?> list) {
                return list;
            }
        }
        return null;
    }
}
