package org.fhirstack.cli.commands;

import org.fhirstack.cli.CommandLineInterface;
import org.fhirstack.orchestrator.StackDefinition;
import org.fhirstack.registry.ServiceSpecRegistry;
import org.fhirstack.registry.StackException;
import org.fhirstack.scheduler.Topology;
import org.fhirstack.spec.ServiceSpec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Loads the configuration and checks the service graph without starting anything.
 * Exit code 2 means the configuration or the topology is invalid.
 */
@Command(
    name = "validate",
    description = "Validates the configuration and prints the startup order."
)
public class ValidateCommand implements Callable<Integer> {

    static final int INVALID = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final Topology topology;
        final StackDefinition stack;
        try {
            stack = parent.loadStack();
            final ServiceSpecRegistry registry = new ServiceSpecRegistry();
            registry.registerAll(stack.services());
            registry.validateAcyclic();
            topology = Topology.of(registry);
        } catch (StackException e) {
            spec.commandLine().getErr().println("Invalid: " + e.getMessage());
            return INVALID;
        }

        out.println("Stack '" + stack.name() + "' is valid. Startup order:");
        int position = 1;
        for (final ServiceSpec service : topology.startupOrder()) {
            out.printf("  %d. %-24s %s%s%n", position++, service.name(), service.launch().describe(),
                service.dependsOn().isEmpty() ? "" : " (after " + String.join(", ", service.dependsOn()) + ")");
        }
        out.flush();
        return 0;
    }
}
