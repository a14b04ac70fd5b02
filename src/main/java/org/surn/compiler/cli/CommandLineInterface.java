package org.surn.compiler.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.surn.compiler.config.ConfigLoader;
import org.surn.compiler.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "surnc",
    mixinStandardHelpOptions = true,
    version = "surnc 0.1.0",
    description = "Surn compiler front end",
    subcommands = {
        ParseCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for sources with syntax or lexical errors. */
    public static final int EXIT_PARSE_ERROR = 1;
    /** Exit code for unreadable files and broken configuration. */
    public static final int EXIT_IO_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("surnc");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     * @return The resolved configuration.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.exists()) {
                throw new ConfigException.Generic("Configuration file specified via --config was not found: "
                        + configFile.getAbsolutePath());
            }
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            LoggingConfigurator.configure(config);
            LOG.debug("Configuration loaded.");
        }
        return config;
    }
}
