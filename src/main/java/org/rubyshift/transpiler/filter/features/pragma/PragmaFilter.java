package org.rubyshift.transpiler.filter.features.pragma;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.rubyshift.transpiler.ast.Atom;
import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.filter.Filter;
import org.rubyshift.transpiler.filter.FilterContext;
import org.rubyshift.transpiler.filter.ordering.OrderingConstraint;
import org.rubyshift.transpiler.pipeline.PipelineContext;
import org.rubyshift.transpiler.pragma.Pragma;

/**
 * Applies line pragmas: rewrites ambiguous operations according to the type or behavior a
 * {@code # Pragma: <name>} comment asserts for the line, and drops statements marked
 * {@code skip}.
 * <p>
 * Replacement nodes are built without location so that re-processing them does not match
 * the pragma again. Nodes whose line carries no relevant pragma pass through unchanged.
 */
public class PragmaFilter extends Filter {

    public static final String ID = "pragma";

    private static final Atom REQUIRE = Atom.of("require");
    private static final Atom REQUIRE_RELATIVE = Atom.of("require_relative");
    private static final Node OBJECT = Node.of("const", null, Atom.of("Object"));

    private boolean es2020;

    public PragmaFilter() {
        on("or", (node, ctx) -> rewriteOr(node, ctx, "nullish_or", "logical_or"));
        on("or_asgn", (node, ctx) -> rewriteOr(node, ctx, "nullish_asgn", "logical_asgn"));
        on("def", this::onDef);
        on("defs", this::skippable);
        on("alias", this::skippable);
        on("deff", (node, ctx) -> ctx.processChildren(node));
        on("array", this::onArray);
        on("send", this::onSend);
        on("self", this::onSelf);
        on("block", this::onBlock);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<OrderingConstraint> orderingConstraints() {
        return List.of(OrderingConstraint.runBefore("functions", "esm"));
    }

    @Override
    public void prepare(PipelineContext context) {
        this.es2020 = context.options().es2020();
    }

    private Node rewriteOr(Node node, FilterContext ctx, String nullishTag, String logicalTag) {
        if (es2020 && ctx.hasPragma(node, Pragma.NULLISH)) {
            return ctx.process(Node.of(nullishTag, node.children()));
        }
        if (ctx.hasPragma(node, Pragma.LOGICAL)) {
            return ctx.process(Node.of(logicalTag, node.children()));
        }
        return ctx.next(node);
    }

    private Node skippable(Node node, FilterContext ctx) {
        if (ctx.hasPragma(node, Pragma.SKIP)) {
            return Node.of("hide");
        }
        return ctx.next(node);
    }

    private Node onDef(Node node, FilterContext ctx) {
        if (ctx.hasPragma(node, Pragma.SKIP)) {
            return Node.of("hide");
        }
        if (node.childCount() > 0 && node.child(0) == null && ctx.hasPragma(node, Pragma.NOES2015)) {
            return node.updated("deff", ctx.processAll(node.children()));
        }
        return ctx.next(node);
    }

    private Node onArray(Node node, FilterContext ctx) {
        if (!es2020 || !ctx.hasPragma(node, Pragma.GUARD)) {
            return ctx.next(node);
        }
        boolean changed = false;
        List<Object> items = new ArrayList<>(node.childCount());
        for (Object item : node.children()) {
            if (item instanceof Node splat && splat.is("splat") && splat.childCount() > 0 && splat.child(0) != null) {
                Node guarded = Node.of("begin", Node.of("nullish_or", splat.child(0), Node.of("array")));
                items.add(Node.of("splat", guarded));
                changed = true;
            } else {
                items.add(item);
            }
        }
        if (!changed) {
            return ctx.next(node);
        }
        return node.withChildren(ctx.processAll(items));
    }

    private Node onSend(Node node, FilterContext ctx) {
        if (node.childCount() < 2 || !(node.child(1) instanceof Atom method)) {
            return ctx.next(node);
        }
        Object target = node.child(0);
        List<Object> args = node.children().subList(2, node.childCount());

        if (target == null && (REQUIRE.equals(method) || REQUIRE_RELATIVE.equals(method))
                && ctx.hasPragma(node, Pragma.SKIP)) {
            return Node.of("hide");
        }

        switch (method.name()) {
            case "dup" -> {
                if (ctx.hasPragma(node, Pragma.ARRAY)) {
                    return ctx.process(Node.of("send", target, Atom.of("slice")));
                } else if (ctx.hasPragma(node, Pragma.HASH)) {
                    return ctx.process(Node.of("hash", Node.of("kwsplat", target)));
                } else if (ctx.hasPragma(node, Pragma.STRING) && target instanceof Node receiver) {
                    return ctx.process(receiver);
                }
            }
            case "<<" -> {
                if (args.size() == 1 && ctx.hasPragma(node, Pragma.ARRAY)) {
                    return ctx.process(Node.of("send", target, Atom.of("push"), args.get(0)));
                } else if (args.size() == 1 && ctx.hasPragma(node, Pragma.STRING)) {
                    return ctx.process(Node.of("op_asgn", target, Atom.of("+"), args.get(0)));
                }
            }
            case "include?" -> {
                if (args.size() == 1 && ctx.hasPragma(node, Pragma.HASH)) {
                    return ctx.process(Node.of("in?", args.get(0), target));
                }
            }
            case "call" -> {
                if (target != null && ctx.hasPragma(node, Pragma.METHOD)) {
                    List<Object> children = new ArrayList<>();
                    children.add(target);
                    children.add(null);
                    children.addAll(args);
                    return ctx.process(node.updated("call", children));
                }
            }
            case "class" -> {
                if (target != null && ctx.hasPragma(node, Pragma.PROTO)) {
                    return ctx.process(Node.of("attr", target, Atom.of("constructor")));
                }
            }
            default -> {
                // no pragma-sensitive method
            }
        }
        return ctx.next(node);
    }

    private Node onSelf(Node node, FilterContext ctx) {
        if (ctx.hasPragma(node, Pragma.SELF)) {
            return Node.of("send", null, Atom.of("this"));
        }
        return ctx.next(node);
    }

    private Node onBlock(Node node, FilterContext ctx) {
        Node call = node.childNode(0);
        Node args = node.childNode(1);
        Object body = node.childCount() > 2 ? node.child(2) : null;
        if (call == null || args == null) {
            return ctx.next(node);
        }

        if (ctx.hasPragma(node, Pragma.NOES2015)) {
            Node function = node.updated("deff", Arrays.asList(null, args, body));
            List<Object> children = new ArrayList<>(call.children());
            children.add(function);
            return ctx.process(Node.of(call.tag(), children));
        }

        if (ctx.hasPragma(node, Pragma.ENTRIES) && call.is("send") && call.childCount() >= 2 && call.child(0) != null) {
            Object target = call.child(0);
            String method = call.child(1) instanceof Atom atom ? atom.name() : "";
            Node entries = Node.of("send", OBJECT, Atom.of("entries"), target);
            Node entryArgs = args.childCount() > 1 ? Node.of("args", Node.of("mlhs", args.children())) : args;
            switch (method) {
                case "each", "each_pair" -> {
                    return ctx.process(Node.of("block", Node.of("send", entries, Atom.of("forEach")), entryArgs, body));
                }
                case "map" -> {
                    return ctx.process(Node.of("block", Node.of("send", entries, Atom.of("map")), entryArgs, body));
                }
                case "select" -> {
                    Node filtered = ctx.process(Node.of("block", Node.of("send", entries, Atom.of("filter")), entryArgs, body));
                    return Node.of("send", OBJECT, Atom.of("fromEntries"), filtered);
                }
                default -> {
                    // not a hash iteration
                }
            }
        }
        return ctx.next(node);
    }
}
