package org.fhirstack.cli.commands;

import org.fhirstack.cli.CommandLineInterface;
import org.fhirstack.cli.rendering.StatusTableRenderer;
import org.fhirstack.health.ProbeResult;
import org.fhirstack.orchestrator.Orchestrator;
import org.fhirstack.orchestrator.ServiceStatus;
import org.fhirstack.orchestrator.StackDefinition;
import org.fhirstack.registry.StackException;
import org.fhirstack.supervisor.launchers.DockerDaemonUnavailableException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "status",
    description = "Shows the state, health and restart count of every service."
)
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--probe"}, description = "Run each running service's health probe once.")
    private boolean probe;

    @Override
    public Integer call() {
        final PrintWriter err = spec.commandLine().getErr();
        final StackDefinition stack;
        try {
            stack = parent.loadStack();
        } catch (StackException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try (Orchestrator orchestrator = parent.createOrchestrator(stack)) {
            orchestrator.adoptRunning();
            final List<ServiceStatus> statuses = orchestrator.status();
            final Map<String, ProbeResult> probes = new LinkedHashMap<>();
            if (probe) {
                for (final ServiceStatus status : statuses) {
                    orchestrator.probe(status.name()).ifPresent(result -> probes.put(status.name(), result));
                }
            }
            new StatusTableRenderer().render(statuses, probes, spec.commandLine().getOut());
            return 0;
        } catch (StackException | DockerDaemonUnavailableException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
