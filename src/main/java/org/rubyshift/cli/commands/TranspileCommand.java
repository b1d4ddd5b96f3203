package org.rubyshift.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

import org.rubyshift.cli.CommandLineInterface;
import org.rubyshift.transpiler.Transpiler;
import org.rubyshift.transpiler.TranspilerOptions;
import org.rubyshift.transpiler.api.CompilationException;
import org.rubyshift.transpiler.api.TranspilationResult;
import org.rubyshift.transpiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Transpiles a source file and prints the transformed tree.
 */
@Command(
    name = "transpile",
    mixinStandardHelpOptions = true,
    description = "Run the filter pipeline over a source file and print the result"
)
public class TranspileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranspileCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The source file to transpile")
    private File file;

    @Option(names = {"-F", "--filter"}, description = "Filter to apply, repeatable; replaces the configured list")
    private List<String> filters;

    @Option(names = {"--eslevel"}, description = "Target language level, e.g. 2020")
    private Integer eslevel;

    @Option(names = {"--autoexports"}, description = "off, on or default")
    private String autoexports;

    @Option(names = {"--comments"}, description = "Print comments associated with top-level statements")
    private boolean comments;

    @Option(names = {"-o", "--output"}, description = "Write the result to this file instead of stdout")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Log filter ordering and inlining decisions")
    private boolean verbose;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("org.rubyshift"))
                .setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        TranspilerOptions options;
        try {
            options = applyOverrides(TranspilerOptions.fromConfig(parent.getConfig()));
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try {
            TranspilationResult result = new Transpiler(options).transpileFile(file.toPath());
            for (Diagnostic diagnostic : result.diagnostics()) {
                err.println(diagnostic);
            }
            if (output != null) {
                Files.writeString(output.toPath(), result.output());
                log.info("Wrote {} ({} file(s) read)", output, result.timestamps().size());
            } else {
                out.print(result.output());
                out.flush();
            }
            return 0;
        } catch (CompilationException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: failed to write " + output + ": " + e.getMessage());
            return 1;
        }
    }

    private TranspilerOptions applyOverrides(TranspilerOptions options) {
        TranspilerOptions result = options;
        if (filters != null && !filters.isEmpty()) {
            result = result.withFilters(filters);
        }
        if (eslevel != null) {
            result = result.withEslevel(eslevel);
        }
        if (autoexports != null) {
            result = result.withAutoexports(TranspilerOptions.Autoexports.parse(autoexports));
        }
        if (comments) {
            result = result.withIncludeComments(true);
        }
        return result;
    }
}
