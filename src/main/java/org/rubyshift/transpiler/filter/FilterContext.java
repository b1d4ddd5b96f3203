package org.rubyshift.transpiler.filter;

import java.util.List;

import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.pipeline.PipelineContext;
import org.rubyshift.transpiler.pragma.Pragma;

/**
 * The view of the transformation chain a {@link NodeHandler} works with.
 * <p>
 * A context is bound to the position of the handler's filter in the chain, so that
 * {@link #next(Node)} continues with the filters after it.
 */
public interface FilterContext {

    /**
     * Hands the node to the next filter in the chain that handles the current tag, or to the
     * default traversal if none does.
     */
    Node next(Node node);

    /**
     * Runs the full chain, from the first filter, on any node.
     */
    Node process(Node node);

    /**
     * Runs the full chain on every child node and rebuilds the node only if a child changed.
     */
    Node processChildren(Node node);

    /**
     * Runs the full chain on every node in the list; other values are passed through.
     */
    List<Object> processAll(List<?> values);

    /**
     * @return Cross-file state of the current transpilation.
     */
    PipelineContext pipeline();

    /**
     * Shorthand for the pragma engine of the current transpilation.
     */
    boolean hasPragma(Node node, Pragma pragma);

    /**
     * @return {@code true} if the configured method selection excludes {@code methodName}.
     */
    boolean isExcluded(String methodName);

    /**
     * Queues a node to be placed before the program once the chain has finished.
     */
    void prepend(Node node);

    /**
     * @return {@code true} if a filter with the given id is part of the chain.
     */
    boolean hasFilter(String filterId);
}
