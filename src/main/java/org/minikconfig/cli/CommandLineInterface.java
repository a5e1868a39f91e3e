package org.minikconfig.cli;

import com.typesafe.config.Config;
import org.minikconfig.cli.commands.CheckCommand;
import org.minikconfig.cli.commands.GenerateCommand;
import org.minikconfig.cli.commands.InspectCommand;
import org.minikconfig.config.ConfigLoader;
import org.minikconfig.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "minikconfig",
    mixinStandardHelpOptions = true,
    version = "minikconfig 1.0",
    description = "Parses Kconfig-style descriptions and writes the resulting .config selection",
    subcommands = {
        GenerateCommand.class,
        CheckCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the picocli command line with all subcommands registered.
     * @return A new command line for a fresh {@link CommandLineInterface}.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("minikconfig");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        // Initialize logger early for config loading feedback
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        if (configFile != null) {
            logger.debug("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
        }
        // Config load order: System Props > Env Vars > File > Classpath defaults
        this.config = ConfigLoader.load(configFile);

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Returns the merged configuration, loading it and applying the logging settings on first use.
     * @return The configuration.
     * @throws IllegalArgumentException if the file given with <code>--config</code> does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
