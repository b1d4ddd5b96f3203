package org.rubyshift.transpiler;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable settings of one transpilation.
 *
 * @param filters            The ids of the filters to apply, in configured order.
 * @param eslevel            Target language level, e.g. {@code 2020}.
 * @param autoexports        Whether top-level declarations of required files count as exported.
 * @param modules            Whether required files with exports become imports, even without a module filter.
 * @param requireRecursive   Keep imports produced by nested requires.
 * @param disableAutoimports Drop queued import nodes instead of prepending them.
 * @param requireExtensions  Extensions tried, in order, when a required name is not a file.
 * @param includeAll         Method selection: reset to include everything.
 * @param includeOnly        Method selection: explicit allow-list.
 * @param include            Method selection: methods to add.
 * @param exclude            Method selection: methods to remove.
 * @param includeComments    Print associated comments above top-level statements.
 * @param file               The primary file, or {@code null} when transpiling a string.
 * @param secondaryFile      The file {@code require_relative} resolves against initially, defaults to {@code file}.
 */
public record TranspilerOptions(
        List<String> filters,
        int eslevel,
        Autoexports autoexports,
        boolean modules,
        boolean requireRecursive,
        boolean disableAutoimports,
        List<String> requireExtensions,
        boolean includeAll,
        List<String> includeOnly,
        List<String> include,
        List<String> exclude,
        boolean includeComments,
        Path file,
        Path secondaryFile
) {

    /** The configuration path holding the transpiler settings. */
    public static final String CONFIG_PATH = "rubyshift.transpiler";

    /**
     * How top-level declarations of a required file are exported.
     */
    public enum Autoexports {
        /** Only explicit {@code export} statements. */
        OFF,
        /** Every top-level declaration as a named export. */
        ON,
        /** Like {@link #ON}, but a single declaration becomes the default export. */
        DEFAULT;

        public static Autoexports parse(String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "off", "false", "no" -> OFF;
                case "on", "true", "yes" -> ON;
                case "default" -> DEFAULT;
                default -> throw new IllegalArgumentException("Invalid autoexports value: " + value);
            };
        }
    }

    public TranspilerOptions {
        filters = List.copyOf(filters);
        requireExtensions = List.copyOf(requireExtensions);
        includeOnly = List.copyOf(includeOnly);
        include = List.copyOf(include);
        exclude = List.copyOf(exclude);
    }

    /**
     * @return The defaults from {@code reference.conf}.
     */
    public static TranspilerOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads the options below {@value #CONFIG_PATH}; missing keys fall back to {@code reference.conf}.
     */
    public static TranspilerOptions fromConfig(Config config) {
        Config section = config.hasPath(CONFIG_PATH) ? config.getConfig(CONFIG_PATH) : ConfigFactory.empty();
        Config c = section.withFallback(ConfigFactory.defaultReference().getConfig(CONFIG_PATH));
        return new TranspilerOptions(
                c.getStringList("filters"),
                c.getInt("eslevel"),
                Autoexports.parse(c.getString("autoexports")),
                c.getBoolean("modules"),
                c.getBoolean("require-recursive"),
                c.getBoolean("disable-autoimports"),
                c.getStringList("require.extensions"),
                c.getBoolean("methods.include-all"),
                c.getStringList("methods.include-only"),
                c.getStringList("methods.include"),
                c.getStringList("methods.exclude"),
                c.getBoolean("printer.include-comments"),
                null,
                null);
    }

    public boolean es2020() {
        return eslevel >= 2020;
    }

    /**
     * @return The file {@code require_relative} starts from.
     */
    public Path effectiveSecondaryFile() {
        return secondaryFile != null ? secondaryFile : file;
    }

    public TranspilerOptions withFile(Path newFile) {
        return new TranspilerOptions(filters, eslevel, autoexports, modules, requireRecursive, disableAutoimports,
                requireExtensions, includeAll, includeOnly, include, exclude, includeComments, newFile, secondaryFile);
    }

    public TranspilerOptions withSecondaryFile(Path newSecondaryFile) {
        return new TranspilerOptions(filters, eslevel, autoexports, modules, requireRecursive, disableAutoimports,
                requireExtensions, includeAll, includeOnly, include, exclude, includeComments, file, newSecondaryFile);
    }

    public TranspilerOptions withFilters(List<String> newFilters) {
        return new TranspilerOptions(newFilters, eslevel, autoexports, modules, requireRecursive, disableAutoimports,
                requireExtensions, includeAll, includeOnly, include, exclude, includeComments, file, secondaryFile);
    }

    public TranspilerOptions withEslevel(int newEslevel) {
        return new TranspilerOptions(filters, newEslevel, autoexports, modules, requireRecursive, disableAutoimports,
                requireExtensions, includeAll, includeOnly, include, exclude, includeComments, file, secondaryFile);
    }

    public TranspilerOptions withAutoexports(Autoexports newAutoexports) {
        return new TranspilerOptions(filters, eslevel, newAutoexports, modules, requireRecursive, disableAutoimports,
                requireExtensions, includeAll, includeOnly, include, exclude, includeComments, file, secondaryFile);
    }

    public TranspilerOptions withModules(boolean newModules) {
        return new TranspilerOptions(filters, eslevel, autoexports, newModules, requireRecursive, disableAutoimports,
                requireExtensions, includeAll, includeOnly, include, exclude, includeComments, file, secondaryFile);
    }

    public TranspilerOptions withRequireRecursive(boolean newRequireRecursive) {
        return new TranspilerOptions(filters, eslevel, autoexports, modules, newRequireRecursive, disableAutoimports,
                requireExtensions, includeAll, includeOnly, include, exclude, includeComments, file, secondaryFile);
    }

    public TranspilerOptions withDisableAutoimports(boolean newDisableAutoimports) {
        return new TranspilerOptions(filters, eslevel, autoexports, modules, requireRecursive, newDisableAutoimports,
                requireExtensions, includeAll, includeOnly, include, exclude, includeComments, file, secondaryFile);
    }

    public TranspilerOptions withIncludeComments(boolean newIncludeComments) {
        return new TranspilerOptions(filters, eslevel, autoexports, modules, requireRecursive, disableAutoimports,
                requireExtensions, includeAll, includeOnly, include, exclude, newIncludeComments, file, secondaryFile);
    }
}
