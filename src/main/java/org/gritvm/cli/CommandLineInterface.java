package org.gritvm.cli;

import com.typesafe.config.Config;
import org.gritvm.cli.commands.ListCommand;
import org.gritvm.cli.commands.RunCommand;
import org.gritvm.cli.config.ConfigLoader;
import org.gritvm.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "gritvm",
    mixinStandardHelpOptions = true,
    version = "GritVM 1.0",
    description = "GritVM - a small accumulator machine",
    subcommands = {
        RunCommand.class,
        ListCommand.class,
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

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("gritvm");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration.
     * @throws com.typesafe.config.ConfigException if the {@code --config} file is missing or malformed.
     */
    public Config getConfig() {
        if (config == null) {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
