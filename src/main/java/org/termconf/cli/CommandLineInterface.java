package org.termconf.cli;

import com.typesafe.config.Config;
import org.termconf.cli.commands.ParseCommand;
import org.termconf.cli.commands.PromptCommand;
import org.termconf.config.ConfigLoader;
import org.termconf.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "termconf",
    mixinStandardHelpOptions = true,
    version = "termconf 1.0",
    description = "Reads and checks terminal configuration commands",
    subcommands = {
        ParseCommand.class,
        PromptCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand given.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException If a configuration file was given but does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file not found: " + configFile.getAbsolutePath());
            }
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            LoggingConfigurator.configure(config);
            LOG.debug("Configuration loaded");
        }
        return config;
    }
}
