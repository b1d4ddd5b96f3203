package org.rubyshift.transpiler.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.rubyshift.transpiler.TranspilerOptions;
import org.rubyshift.transpiler.annotation.AnnotationStore;
import org.rubyshift.transpiler.annotation.CommentAssociator;
import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.diagnostics.DiagnosticsEngine;
import org.rubyshift.transpiler.filter.MethodSelection;
import org.rubyshift.transpiler.io.SourceLoader;
import org.rubyshift.transpiler.parser.ParseResult;
import org.rubyshift.transpiler.parser.SourceParser;
import org.rubyshift.transpiler.pragma.PragmaEngine;

/**
 * State shared by all filters and all files of one transpilation.
 */
public class PipelineContext {

    private static final Set<String> MODULE_FILTERS = Set.of("esm", "cjs");

    private final TranspilerOptions options;
    private final SourceParser parser;
    private final DiagnosticsEngine diagnostics;
    private final AnnotationStore annotations;
    private final PragmaEngine pragmas;
    private final InlineContext inlineContext;
    private final MethodSelection methods;
    private final List<Node> prependList = new ArrayList<>();
    private Set<String> filterIds = Set.of();

    public PipelineContext(TranspilerOptions options, SourceParser parser, DiagnosticsEngine diagnostics) {
        this(options, parser, diagnostics, new AnnotationStore());
    }

    public PipelineContext(TranspilerOptions options, SourceParser parser, DiagnosticsEngine diagnostics, AnnotationStore annotations) {
        this.options = options;
        this.parser = parser;
        this.diagnostics = diagnostics;
        this.annotations = annotations;
        this.pragmas = new PragmaEngine(annotations);
        this.inlineContext = new InlineContext(options.file(), options.effectiveSecondaryFile());
        this.methods = MethodSelection.of(options.includeAll(), options.includeOnly(), options.include(), options.exclude());
    }

    public TranspilerOptions options() {
        return options;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public AnnotationStore annotations() {
        return annotations;
    }

    public PragmaEngine pragmas() {
        return pragmas;
    }

    public InlineContext inlineContext() {
        return inlineContext;
    }

    public MethodSelection methods() {
        return methods;
    }

    /**
     * Parses source text and contributes its comments to the shared store.
     */
    public ParseResult parse(String source, String fileName) {
        ParseResult result = parser.parse(source, fileName);
        annotations.append(result.comments());
        annotations.associateAll(CommentAssociator.associate(result.root(), result.comments()));
        return result;
    }

    /**
     * Reads and parses a file, contributing its comments to the shared store.
     *
     * @throws UncheckedIOException If the file cannot be read.
     */
    public ParseResult parseFile(Path file) {
        try {
            SourceLoader.LoadResult loaded = SourceLoader.loadFile(file);
            return parse(loaded.content(), loaded.logicalName());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    /**
     * @return {@code true} if requires of files with exports should turn into imports.
     */
    public boolean modulesEnabled() {
        return options.modules() || filterIds.stream().anyMatch(MODULE_FILTERS::contains);
    }

    void bindFilterIds(Set<String> ids) {
        this.filterIds = Set.copyOf(ids);
    }

    public void prepend(Node node) {
        prependList.add(node);
    }

    public List<Node> prependList() {
        return Collections.unmodifiableList(prependList);
    }

    /**
     * Drops queued nodes beyond the first {@code size}.
     */
    public void truncatePrependList(int size) {
        while (prependList.size() > size) {
            prependList.remove(prependList.size() - 1);
        }
    }
}
