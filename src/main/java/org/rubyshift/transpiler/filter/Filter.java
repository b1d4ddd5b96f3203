package org.rubyshift.transpiler.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.rubyshift.transpiler.filter.ordering.OrderingConstraint;
import org.rubyshift.transpiler.pipeline.PipelineContext;

/**
 * A rewriting pass. Subclasses register one {@link NodeHandler} per tag they are interested
 * in; tags without a handler pass through to the next filter.
 * <p>
 * Filters are created per transpilation, so instance fields may hold traversal state.
 */
public abstract class Filter {

    private final Map<String, NodeHandler> handlers = new LinkedHashMap<>();

    /**
     * @return The stable identity used in configuration and ordering constraints.
     */
    public abstract String id();

    /**
     * Registers the handler for a tag, replacing any previous one.
     */
    protected final void on(String tag, NodeHandler handler) {
        handlers.put(tag, handler);
    }

    /**
     * @return The handler for {@code tag}, or {@code null} if this filter does not handle it.
     */
    public NodeHandler handlerFor(String tag) {
        return handlers.get(tag);
    }

    public Set<String> handledTags() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * @return Where this filter wants to sit relative to others, in declaration order.
     */
    public List<OrderingConstraint> orderingConstraints() {
        return List.of();
    }

    /**
     * Called once before the chain runs.
     */
    public void prepare(PipelineContext context) {
    }

    @Override
    public String toString() {
        return id();
    }
}
