package org.ontodsl.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.ontodsl.cli.commands.CompileCommand;
import org.ontodsl.config.ConfigLoader;
import org.ontodsl.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "ontodsl",
    mixinStandardHelpOptions = true,
    version = "OntoDSL 1.0",
    description = "OntoDSL - compiles graph transformation pipelines to Cypher",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("ontodsl");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @return The merged configuration.
     * @throws IllegalArgumentException if the configured file is missing or malformed.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException e) {
                throw new IllegalArgumentException("Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
