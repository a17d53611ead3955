package org.larkfront.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.larkfront.cli.commands.ParseCommand;
import org.larkfront.cli.commands.TokenizeCommand;
import org.larkfront.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "larkfront",
    mixinStandardHelpOptions = true,
    version = "larkfront 1.0",
    description = "larkfront - tokenizer and load-statement parser for Starlark-like build files",
    subcommands = {
        TokenizeCommand.class,
        ParseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "larkfront.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: larkfront.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("larkfront");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // Config load order: System Props > Env Vars > File > Classpath defaults
        Config fileConfig = ConfigFactory.empty();
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(this.configFile);
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.exists()) {
                logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
            }
        }

        this.config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
