package org.rubyshift.transpiler.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.pipeline.PipelineContext;
import org.rubyshift.transpiler.pragma.Pragma;

/**
 * An ordered list of filters applied to a tree.
 * <p>
 * Dispatch for a node walks the filters from a start position and calls the first handler
 * registered for the node's tag. That handler decides whether to continue down the chain
 * through {@link FilterContext#next(Node)}. When no filter handles a synthetic tag, dispatch
 * restarts from the first filter with the tag's canonical counterpart (see
 * {@link TagAliases}); when nothing handles the tag at all, the children are processed.
 */
public class FilterChain {

    private final List<Filter> filters;
    private final Set<String> filterIds;
    private final PipelineContext context;

    public FilterChain(List<Filter> filters, PipelineContext context) {
        this.filters = List.copyOf(filters);
        this.context = context;
        Set<String> ids = new LinkedHashSet<>();
        for (Filter filter : this.filters) {
            ids.add(filter.id());
        }
        this.filterIds = Collections.unmodifiableSet(ids);
    }

    public List<Filter> filters() {
        return filters;
    }

    public Set<String> filterIds() {
        return filterIds;
    }

    /**
     * Runs the full chain on a node.
     *
     * @return The replacement, or {@code null} if the node was removed.
     */
    public Node process(Node node) {
        if (node == null) {
            return null;
        }
        return dispatch(node, node.tag(), 0);
    }

    /**
     * Processes each child node with the full chain. Returns {@code node} itself when no child
     * changed.
     */
    public Node processChildren(Node node) {
        List<Object> children = node.children();
        List<Object> rebuilt = null;
        for (int i = 0; i < children.size(); i++) {
            Object child = children.get(i);
            Object processed = processValue(child);
            if (rebuilt == null && processed != child) {
                rebuilt = new ArrayList<>(children.subList(0, i));
            }
            if (rebuilt != null) {
                rebuilt.add(processed);
            }
        }
        return rebuilt == null ? node : node.withChildren(rebuilt);
    }

    /**
     * Processes every node of a list with the full chain.
     */
    public List<Object> processAll(List<?> values) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add(processValue(value));
        }
        return result;
    }

    private Object processValue(Object value) {
        if (value instanceof Node node) {
            return process(node);
        }
        if (value instanceof List<?> list) {
            List<Object> processed = processAll(list);
            for (int i = 0; i < list.size(); i++) {
                if (processed.get(i) != list.get(i)) {
                    return processed;
                }
            }
            return list;
        }
        return value;
    }

    private Node dispatch(Node node, String tag, int from) {
        for (int i = from; i < filters.size(); i++) {
            NodeHandler handler = filters.get(i).handlerFor(tag);
            if (handler != null) {
                return handler.handle(node, new Link(i, tag));
            }
        }
        String canonical = TagAliases.canonical(tag);
        if (canonical != null) {
            return dispatch(node, canonical, 0);
        }
        return processChildren(node);
    }

    /**
     * The context handed to a handler at a given chain position.
     */
    private final class Link implements FilterContext {

        private final int position;
        private final String tag;

        Link(int position, String tag) {
            this.position = position;
            this.tag = tag;
        }

        @Override
        public Node next(Node node) {
            if (node == null) {
                return null;
            }
            return dispatch(node, tag, position + 1);
        }

        @Override
        public Node process(Node node) {
            return FilterChain.this.process(node);
        }

        @Override
        public Node processChildren(Node node) {
            return FilterChain.this.processChildren(node);
        }

        @Override
        public List<Object> processAll(List<?> values) {
            return FilterChain.this.processAll(values);
        }

        @Override
        public PipelineContext pipeline() {
            return context;
        }

        @Override
        public boolean hasPragma(Node node, Pragma pragma) {
            return context.pragmas().hasPragma(node, pragma);
        }

        @Override
        public boolean isExcluded(String methodName) {
            return context.methods().isExcluded(methodName);
        }

        @Override
        public void prepend(Node node) {
            context.prepend(node);
        }

        @Override
        public boolean hasFilter(String filterId) {
            return filterIds.contains(filterId);
        }
    }
}
