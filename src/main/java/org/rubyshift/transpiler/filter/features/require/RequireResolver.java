package org.rubyshift.transpiler.filter.features.require;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Maps a required name to a file: the name itself, then the name with each configured
 * extension appended, against a base directory.
 */
public class RequireResolver {

    private final List<String> extensions;

    public RequireResolver(List<String> extensions) {
        this.extensions = List.copyOf(extensions);
    }

    /**
     * @param reference     The string argument of the require.
     * @param baseDirectory The directory relative references are resolved against.
     * @return The first existing regular file, or empty.
     */
    public Optional<Path> resolve(String reference, Path baseDirectory) {
        Path base = baseDirectory.resolve(reference).normalize();
        if (Files.isRegularFile(base)) {
            return Optional.of(base);
        }
        for (String extension : extensions) {
            Path candidate = base.resolveSibling(base.getFileName() + extension);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
