package org.rubyshift.transpiler.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.io.SourceLoader;

/**
 * Cross-file state of require inlining: which files were already inlined, which file is being
 * inlined right now and the directory {@code require} resolves against inside it.
 * <p>
 * Entering a file pushes a frame; closing the returned {@link Scope} pops it again, so the
 * previous state is restored on every exit path when used with try-with-resources.
 */
public class InlineContext {

    /**
     * @param file         The file being inlined.
     * @param relativeBase Its directory, relative to the primary file's directory.
     */
    public record Frame(Path file, Path relativeBase) {}

    private static final Path NO_BASE = Path.of("");

    private final Path primaryFile;
    private final Path secondaryFile;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private final Set<Path> inlined = new LinkedHashSet<>();
    private final Map<String, FileTime> timestamps = new LinkedHashMap<>();
    private final Map<Path, Node> imports = new LinkedHashMap<>();

    /**
     * @param primaryFile   The file being transpiled, or {@code null} for in-memory sources.
     * @param secondaryFile The file {@code require_relative} starts from, or {@code null} for the primary.
     */
    public InlineContext(Path primaryFile, Path secondaryFile) {
        this.primaryFile = primaryFile == null ? null : primaryFile.toAbsolutePath().normalize();
        Path secondary = secondaryFile != null ? secondaryFile : primaryFile;
        this.secondaryFile = secondary == null ? null : secondary.toAbsolutePath().normalize();
    }

    public boolean hasPrimaryFile() {
        return primaryFile != null;
    }

    public Path primaryFile() {
        return primaryFile;
    }

    public Path primaryDirectory() {
        Path parent = primaryFile == null ? null : primaryFile.getParent();
        return parent != null ? parent : Path.of("").toAbsolutePath();
    }

    /**
     * @return The file currently being inlined, or the secondary file at top level.
     */
    public Path activeFile() {
        Frame top = stack.peek();
        return top != null ? top.file() : secondaryFile;
    }

    /**
     * @return The directory {@code require} resolves against, relative to the primary directory.
     */
    public Path relativeBase() {
        Frame top = stack.peek();
        return top != null ? top.relativeBase() : NO_BASE;
    }

    public int depth() {
        return stack.size();
    }

    public boolean isInlined(Path canonicalPath) {
        return inlined.contains(canonicalPath);
    }

    public void markInlined(Path canonicalPath) {
        inlined.add(canonicalPath);
    }

    /**
     * Remembers the {@code import} node generated for an inlined file.
     */
    public void recordImport(Path canonicalPath, Node importNode) {
        imports.put(canonicalPath, importNode);
    }

    /**
     * @return The {@code import} generated when the file was first inlined, if it had exports.
     */
    public Optional<Node> importFor(Path canonicalPath) {
        return Optional.ofNullable(imports.get(canonicalPath));
    }

    public Set<Path> inlinedFiles() {
        return Collections.unmodifiableSet(inlined);
    }

    /**
     * Records the modification time of a file.
     */
    public void recordTimestamp(Path canonicalPath) throws IOException {
        timestamps.put(SourceLoader.logicalName(canonicalPath), SourceLoader.lastModified(canonicalPath));
    }

    public Map<String, FileTime> timestamps() {
        return Collections.unmodifiableMap(timestamps);
    }

    /**
     * Makes {@code file} the active file until the returned scope is closed.
     */
    public Scope enter(Path file, Path relativeBase) {
        stack.push(new Frame(file.toAbsolutePath().normalize(), relativeBase));
        return new Scope();
    }

    /**
     * Restores the previous active file on close.
     */
    public final class Scope implements AutoCloseable {

        private boolean closed;

        private Scope() {}

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                stack.pop();
            }
        }
    }
}
