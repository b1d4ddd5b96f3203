package org.rubyshift.transpiler.filter.features.require;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.rubyshift.transpiler.ast.Atom;
import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.filter.Filter;
import org.rubyshift.transpiler.filter.FilterContext;
import org.rubyshift.transpiler.io.SourceLoader;
import org.rubyshift.transpiler.parser.ParseResult;
import org.rubyshift.transpiler.pipeline.InlineContext;
import org.rubyshift.transpiler.pipeline.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces statement-level {@code require "x"} and {@code require_relative "x"} calls with the
 * transformed contents of the required file.
 * <p>
 * Each file is inlined at most once per transpilation; later requires of it become
 * {@code (hide)}. Requires used as values, e.g. the right-hand side of an assignment or an
 * argument, are left alone. When module output is enabled and the required file exports
 * names, an {@code import} node is queued instead and the file's tree is kept hidden; later
 * requires of that file queue the same import again.
 */
public class RequireFilter extends Filter {

    public static final String ID = "require";

    private static final Logger log = LoggerFactory.getLogger(RequireFilter.class);

    private static final Atom REQUIRE = Atom.of("require");
    private static final Atom REQUIRE_RELATIVE = Atom.of("require_relative");

    private RequireResolver resolver;
    private boolean inExpression;

    public RequireFilter() {
        on("send", this::onSend);
        on("lvasgn", this::asExpression);
        on("casgn", this::asExpression);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void prepare(PipelineContext context) {
        this.resolver = new RequireResolver(context.options().requireExtensions());
        this.inExpression = false;
        InlineContext inline = context.inlineContext();
        if (inline.hasPrimaryFile()) {
            try {
                Path primary = SourceLoader.canonicalize(inline.primaryFile());
                inline.markInlined(primary);
                inline.recordTimestamp(primary);
            } catch (IOException e) {
                log.debug("Primary file {} is not on disk, not tracking it: {}", inline.primaryFile(), e.getMessage());
            }
        }
    }

    private Node onSend(Node node, FilterContext ctx) {
        if (!inExpression && isRequireStatement(node) && ctx.pipeline().inlineContext().hasPrimaryFile()) {
            return inline(node, ctx);
        }
        return asExpression(node, ctx);
    }

    private Node asExpression(Node node, FilterContext ctx) {
        boolean saved = inExpression;
        inExpression = true;
        try {
            return ctx.next(node);
        } finally {
            inExpression = saved;
        }
    }

    static boolean isRequireStatement(Node node) {
        if (node.childCount() != 3 || node.child(0) != null) {
            return false;
        }
        Object method = node.child(1);
        Node argument = node.childNode(2);
        return (REQUIRE.equals(method) || REQUIRE_RELATIVE.equals(method))
                && argument != null && argument.is("str") && argument.child(0) instanceof String;
    }

    private Node inline(Node node, FilterContext ctx) {
        PipelineContext pipeline = ctx.pipeline();
        InlineContext inline = pipeline.inlineContext();
        String reference = (String) node.childNode(2).child(0);

        Path baseDirectory = REQUIRE_RELATIVE.equals(node.child(1))
                ? directoryOf(inline.activeFile(), inline)
                : inline.primaryDirectory().resolve(inline.relativeBase());
        Path file = resolver.resolve(reference, baseDirectory)
                .orElseThrow(() -> new UnresolvedRequireException(reference, node.location()));

        Path canonical;
        try {
            canonical = SourceLoader.canonicalize(file);
        } catch (IOException e) {
            throw new UnresolvedRequireException(reference, node.location());
        }
        if (inline.isInlined(canonical)) {
            log.debug("Skipping {}, already inlined", canonical);
            if (pipeline.modulesEnabled()) {
                inline.importFor(canonical).ifPresent(ctx::prepend);
            }
            return Node.of("hide");
        }
        inline.markInlined(canonical);
        try {
            inline.recordTimestamp(canonical);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read modification time of " + canonical, e);
        }

        log.debug("Inlining {} (depth {})", file, inline.depth() + 1);
        ParseResult parsed = pipeline.parseFile(file);
        Node root = parsed.root();
        pipeline.annotations().associate(node, pipeline.annotations().commentsFor(root));

        Path relativeBase = relativeDirectory(inline.primaryDirectory(), file);
        ExportCollector.Exports exports = pipeline.modulesEnabled()
                ? ExportCollector.collect(root, pipeline.options().autoexports())
                : new ExportCollector.Exports(null, List.of());

        try (InlineContext.Scope ignored = inline.enter(file, relativeBase)) {
            if (exports.isEmpty()) {
                return ctx.process(root);
            }

            List<Object> importChildren = new ArrayList<>();
            importChildren.add(importPath(inline.primaryDirectory(), file));
            importChildren.addAll(exports.bindings());
            Node importNode = Node.of("import", importChildren);
            inline.recordImport(canonical, importNode);
            ctx.prepend(importNode);

            int keep = pipeline.prependList().size();
            Node hidden = ctx.process(root == null ? Node.of("hide") : Node.of("hide", root));
            if (!pipeline.options().requireRecursive()) {
                pipeline.truncatePrependList(keep);
            }
            return hidden;
        }
    }

    private static Path directoryOf(Path file, InlineContext inline) {
        Path parent = file == null ? null : file.getParent();
        return parent != null ? parent : inline.primaryDirectory();
    }

    private static Path relativeDirectory(Path primaryDirectory, Path file) {
        Path parent = file.toAbsolutePath().normalize().getParent();
        return parent == null ? Path.of("") : primaryDirectory.relativize(parent);
    }

    private static String importPath(Path primaryDirectory, Path file) {
        String relative = primaryDirectory.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
        return relative.startsWith(".") ? relative : "./" + relative;
    }
}
