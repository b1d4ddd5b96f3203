package org.rubyshift.transpiler.printer;

import org.rubyshift.transpiler.ast.Node;

/**
 * Renders a transformed tree as text.
 */
public interface NodePrinter {

    /**
     * @param root    The tree, may be {@code null}.
     * @param options Printing options.
     * @return The rendered text.
     */
    String print(Node root, PrintOptions options);
}
