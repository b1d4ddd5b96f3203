package org.rubyshift.transpiler.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.rubyshift.transpiler.annotation.CommentAssociator;
import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.filter.Filter;
import org.rubyshift.transpiler.filter.FilterChain;
import org.rubyshift.transpiler.filter.ordering.OrderingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a set of filters over a tree: resolves their order, applies the chain and places the
 * queued prepend list before the result.
 */
public class Pipeline {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final PipelineContext context;
    private final List<Filter> filters;

    public Pipeline(PipelineContext context, List<Filter> filters) {
        this.context = context;
        this.filters = List.copyOf(filters);
    }

    /**
     * @param root The parsed tree, may be {@code null}.
     * @return The transformed tree, or {@code null} if nothing is left.
     */
    public Node run(Node root) {
        List<Filter> ordered = OrderingResolver.resolve(filters);
        if (log.isDebugEnabled()) {
            log.debug("Filter order: {}", ordered.stream().map(Filter::id).collect(Collectors.joining(", ")));
        }
        FilterChain chain = new FilterChain(ordered, context);
        context.bindFilterIds(chain.filterIds());
        for (Filter filter : ordered) {
            filter.prepare(context);
        }

        Node result = withPrependList(chain.process(root));
        context.annotations().associateAll(CommentAssociator.associate(result, context.annotations().rawComments()));
        return result;
    }

    private Node withPrependList(Node result) {
        List<Node> imports = new ArrayList<>();
        List<Node> others = new ArrayList<>();
        for (Node node : context.prependList()) {
            if (node.is("import")) {
                imports.add(node);
            } else {
                others.add(node);
            }
        }
        if (context.options().disableAutoimports()) {
            imports.clear();
        }
        if (imports.isEmpty() && others.isEmpty()) {
            return result;
        }
        List<Node> statements = new ArrayList<>(imports);
        statements.addAll(others);
        if (result != null) {
            statements.add(result);
        }
        return Node.of("begin", statements);
    }
}
