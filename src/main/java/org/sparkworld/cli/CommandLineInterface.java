package org.sparkworld.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.cli.commands.InitCommand;
import org.sparkworld.cli.commands.InspectCommand;
import org.sparkworld.cli.commands.ListCommand;
import org.sparkworld.cli.commands.TickCommand;
import org.sparkworld.cli.config.ConfigLoader;
import org.sparkworld.cli.config.LoggingConfigurator;
import org.sparkworld.service.SparkWorldService;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "sparkworld",
    mixinStandardHelpOptions = true,
    version = "Spark-World 1.0",
    description = "Spark-World - a closed spark economy of autonomous minds",
    subcommands = {
        InitCommand.class,
        TickCommand.class,
        InspectCommand.class,
        ListCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/sparkworld.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        System.exit(commandLine.execute(args));
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
        commandLine.setCommandName("sparkworld");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            throw e;
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("sparkworld.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private void reconfigureLogback() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * @return The resolved configuration, loaded on first use.
     * @throws IllegalArgumentException if an explicitly named configuration file does not exist.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Creates a service from the resolved configuration. The caller closes it.
     */
    public SparkWorldService createService() {
        return SparkWorldService.fromConfig(getConfig());
    }
}
