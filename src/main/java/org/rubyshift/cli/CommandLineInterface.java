package org.rubyshift.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.rubyshift.cli.commands.TranspileCommand;
import org.rubyshift.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "rubyshift",
    mixinStandardHelpOptions = true,
    version = "rubyshift 1.0",
    description = "rubyshift - source-to-source transpiler pipeline",
    subcommands = {
        TranspileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/rubyshift.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("rubyshift");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use.
     *
     * @throws IllegalArgumentException                If the configured file does not exist.
     * @throws com.typesafe.config.ConfigException     If the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> log.debug(message);
                    case WARN -> log.warn(message);
                }
            });
        }
        return config;
    }
}
