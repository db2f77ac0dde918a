package org.fhirstack.cli;

import com.typesafe.config.Config;
import org.fhirstack.cli.commands.DownCommand;
import org.fhirstack.cli.commands.StatusCommand;
import org.fhirstack.cli.commands.UpCommand;
import org.fhirstack.cli.commands.ValidateCommand;
import org.fhirstack.config.ConfigLoader;
import org.fhirstack.config.LoggingConfigurator;
import org.fhirstack.config.StackConfigParser;
import org.fhirstack.orchestrator.Orchestrator;
import org.fhirstack.orchestrator.StackDefinition;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
    name = "fhir-stack",
    mixinStandardHelpOptions = true,
    version = "fhir-stack 1.0",
    description = "Starts, stops and inspects a FHIR store together with the services it depends on",
    subcommands = {
        UpCommand.class,
        DownCommand.class,
        StatusCommand.class,
        ValidateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private final Function<StackDefinition, Orchestrator> orchestratorFactory;
    private Config config;

    public CommandLineInterface() {
        this(Orchestrator::forStack);
    }

    /**
     * @param orchestratorFactory creates the orchestrator the subcommands work with
     */
    public CommandLineInterface(final Function<StackDefinition, Orchestrator> orchestratorFactory) {
        this.orchestratorFactory = orchestratorFactory;
    }

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("fhir-stack");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @throws org.fhirstack.config.ConfigurationException if the configuration cannot be loaded
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * @throws org.fhirstack.registry.StackException if the configuration or a service declaration is invalid
     */
    public StackDefinition loadStack() {
        return StackConfigParser.parse(getConfig());
    }

    public Orchestrator createOrchestrator(final StackDefinition stack) {
        return orchestratorFactory.apply(stack);
    }
}
