package org.rubyshift.transpiler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import org.rubyshift.transpiler.api.CompilationException;
import org.rubyshift.transpiler.api.TranspilationResult;
import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.diagnostics.DiagnosticsEngine;
import org.rubyshift.transpiler.filter.Filter;
import org.rubyshift.transpiler.filter.FilterRegistry;
import org.rubyshift.transpiler.filter.features.require.UnresolvedRequireException;
import org.rubyshift.transpiler.io.SourceLoader;
import org.rubyshift.transpiler.parser.ParseResult;
import org.rubyshift.transpiler.parser.SexpParser;
import org.rubyshift.transpiler.parser.SourceParseException;
import org.rubyshift.transpiler.parser.SourceParser;
import org.rubyshift.transpiler.pipeline.Pipeline;
import org.rubyshift.transpiler.pipeline.PipelineContext;
import org.rubyshift.transpiler.printer.NodePrinter;
import org.rubyshift.transpiler.printer.PrintOptions;
import org.rubyshift.transpiler.printer.SexpPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the transpiler: parse, run the configured filters, print.
 * <p>
 * A transpiler is stateless between calls; every call gets its own annotation store, inline
 * context and filter instances.
 */
public class Transpiler {

    private static final Logger log = LoggerFactory.getLogger(Transpiler.class);

    private final TranspilerOptions options;
    private final FilterRegistry registry;
    private final SourceParser parser;
    private final NodePrinter printer;

    public Transpiler(TranspilerOptions options) {
        this(options, FilterRegistry.initialize(), new SexpParser(), new SexpPrinter());
    }

    public Transpiler(TranspilerOptions options, FilterRegistry registry, SourceParser parser, NodePrinter printer) {
        this.options = options;
        this.registry = registry;
        this.parser = parser;
        this.printer = printer;
    }

    /**
     * Transpiles a file; requires inside it resolve relative to its directory.
     *
     * @throws CompilationException If the file cannot be read, parsed or its requires resolved.
     */
    public TranspilationResult transpileFile(Path file) throws CompilationException {
        SourceLoader.LoadResult loaded;
        try {
            loaded = SourceLoader.loadFile(file);
        } catch (IOException e) {
            throw new CompilationException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        return run(loaded.content(), loaded.logicalName(), options.withFile(file));
    }

    /**
     * Transpiles source text. Requires are only inlined if the options name a file.
     *
     * @param source   The source text.
     * @param fileName The logical name used in locations, may be {@code null}.
     * @throws CompilationException If the source cannot be parsed or its requires resolved.
     */
    public TranspilationResult transpile(String source, String fileName) throws CompilationException {
        return run(source, fileName, options);
    }

    private TranspilationResult run(String source, String fileName, TranspilerOptions effective) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        PipelineContext context = new PipelineContext(effective, parser, diagnostics);
        try {
            ParseResult parsed = context.parse(source, fileName);
            List<Filter> filters = registry.create(effective.filters(), diagnostics);
            Node tree = new Pipeline(context, filters).run(parsed.root());
            String output = printer.print(tree, new PrintOptions(effective.includeComments(), context.annotations()));
            log.debug("Transpiled {} with {} inlined file(s)", fileName, context.inlineContext().inlinedFiles().size());
            return new TranspilationResult(tree, output, context.inlineContext().timestamps(), diagnostics.getDiagnostics());
        } catch (UnresolvedRequireException e) {
            diagnostics.reportError(e.getMessage(), e.getLocation());
            throw new CompilationException(diagnostics.summary(), e);
        } catch (SourceParseException e) {
            diagnostics.reportError(e.getMessage(), e.getLocation());
            throw new CompilationException(diagnostics.summary(), e);
        } catch (UncheckedIOException e) {
            diagnostics.reportError(e.getMessage(), fileName, 0);
            throw new CompilationException(diagnostics.summary(), e.getCause());
        }
    }
}
