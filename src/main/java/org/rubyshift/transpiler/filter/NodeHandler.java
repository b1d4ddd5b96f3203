package org.rubyshift.transpiler.filter;

import org.rubyshift.transpiler.ast.Node;

/**
 * Rewrites nodes of one tag on behalf of a {@link Filter}.
 */
@FunctionalInterface
public interface NodeHandler {

    /**
     * @param node    The node being processed.
     * @param context Gives access to the rest of the chain and to shared state.
     * @return The replacement node, the node itself, or {@code null} to remove it.
     */
    Node handle(Node node, FilterContext context);
}
