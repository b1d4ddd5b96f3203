package org.rubyshift.transpiler.filter.features.combiner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.ast.Nodes;
import org.rubyshift.transpiler.filter.Filter;
import org.rubyshift.transpiler.filter.FilterContext;
import org.rubyshift.transpiler.filter.ordering.OrderingConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges reopened modules and classes of a statement sequence into their first definition,
 * and deduplicates imports of the same path.
 * <p>
 * Only {@code begin} nodes with more than one child are touched; a single-child {@code begin}
 * is expression grouping. Nested {@code begin} statements, as left behind by inlined files,
 * are flattened first.
 */
public class CombinerFilter extends Filter {

    public static final String ID = "combiner";

    private static final Logger log = LoggerFactory.getLogger(CombinerFilter.class);

    public CombinerFilter() {
        on("begin", this::onBegin);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<OrderingConstraint> orderingConstraints() {
        return List.of(OrderingConstraint.runAfter("esm"));
    }

    private Node onBegin(Node node, FilterContext ctx) {
        if (!node.is("begin") || node.childCount() <= 1) {
            return ctx.next(node);
        }
        List<Node> statements = merge(ctx.processAll(node.children()));
        if (statements.isEmpty()) {
            return null;
        }
        if (statements.size() == 1) {
            return statements.get(0);
        }
        return node.withChildren(statements);
    }

    /**
     * Flattens nested {@code begin}s, merges definitions and imports, drops removed statements.
     */
    static List<Node> merge(List<?> statements) {
        Map<DefinitionKey, Integer> definitions = new HashMap<>();
        Map<String, Integer> imports = new HashMap<>();
        List<Node> result = new ArrayList<>();

        for (Node node : flatten(statements)) {
            if (node.is("module") || node.is("class")) {
                DefinitionKey key = DefinitionKey.of(node);
                Integer index = definitions.get(key);
                if (index != null) {
                    log.debug("Merging reopened {}", key);
                    result.set(index, mergeDefinition(result.get(index), node));
                } else {
                    definitions.put(key, result.size());
                    result.add(node);
                }
            } else if (ImportMerger.isImport(node)) {
                String path = ImportMerger.pathOf(node);
                Integer index = imports.get(path);
                Node merged = index == null ? null : ImportMerger.merge(result.get(index), node);
                if (merged != null) {
                    result.set(index, merged);
                } else {
                    if (index == null) {
                        imports.put(path, result.size());
                    }
                    result.add(node);
                }
            } else {
                result.add(node);
            }
        }
        return result;
    }

    private static List<Node> flatten(List<?> statements) {
        List<Node> flat = new ArrayList<>();
        for (Object statement : statements) {
            if (statement instanceof Node node) {
                if (node.is("begin")) {
                    flat.addAll(flatten(node.children()));
                } else {
                    flat.add(node);
                }
            }
        }
        return flat;
    }

    private static Node mergeDefinition(Node original, Node reopened) {
        boolean isClass = original.is("class");
        int bodyIndex = isClass ? 2 : 1;

        List<Node> members = new ArrayList<>(Nodes.statements(original.childNode(bodyIndex)));
        members.addAll(Nodes.statements(reopened.childNode(bodyIndex)));
        Node body = Nodes.body(staticFieldsFirst(merge(members)));

        if (isClass) {
            Node superclass = original.childNode(1) != null ? original.childNode(1) : reopened.childNode(1);
            return original.withChildren(Arrays.asList(original.child(0), superclass, body));
        }
        return original.withChildren(Arrays.asList(original.child(0), body));
    }

    private static List<Node> staticFieldsFirst(List<Node> members) {
        List<Node> ordered = new ArrayList<>();
        List<Node> others = new ArrayList<>();
        for (Node member : members) {
            (member.is("cvasgn") ? ordered : others).add(member);
        }
        ordered.addAll(others);
        return ordered;
    }
}
