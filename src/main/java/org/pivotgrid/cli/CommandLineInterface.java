package org.pivotgrid.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.pivotgrid.cli.commands.ComputeCommand;
import org.pivotgrid.cli.commands.FieldsCommand;
import org.pivotgrid.cli.commands.node.NodeCommand;
import org.pivotgrid.node.config.ConfigLoader;
import org.pivotgrid.node.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pivotgrid",
    mixinStandardHelpOptions = true,
    version = "pivotgrid 1.0",
    description = "Hierarchical pivot tables over SQL datasets",
    subcommands = {
        NodeCommand.class,
        ComputeCommand.class,
        FieldsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pivotgrid");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @throws CommandLine.ParameterException if an explicit configuration file is missing
     * @throws ConfigException if the configuration cannot be parsed
     */
    public synchronized Config getConfig(final CommandLine commandLine) {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                throw new CommandLine.ParameterException(commandLine,
                    "Configuration file not found: " + configFile.getAbsolutePath());
            }
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
