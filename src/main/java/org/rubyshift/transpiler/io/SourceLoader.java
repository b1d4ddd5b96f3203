package org.rubyshift.transpiler.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * Centralizes file access for the transpiler: reading sources, canonicalizing paths for
 * duplicate detection and reading modification times.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content with line endings normalized to {@code \n}.
     * @param logicalName The name used in locations and diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The path to read.
     * @return The loaded content, named by the normalized absolute path.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = logicalName(path);
        String content = normalizeLineEndings(Files.readString(path));
        return new LoadResult(content, logicalName);
    }

    /**
     * @return The absolute, normalized path with forward slashes.
     */
    public static String logicalName(Path path) {
        return path.toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    /**
     * Resolves symbolic links and relative segments so that two references to the same file
     * compare equal.
     *
     * @throws IOException If the file does not exist.
     */
    public static Path canonicalize(Path path) throws IOException {
        return path.toRealPath();
    }

    public static FileTime lastModified(Path path) throws IOException {
        return Files.getLastModifiedTime(path);
    }

    public static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
