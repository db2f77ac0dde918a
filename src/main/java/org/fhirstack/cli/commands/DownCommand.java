package org.fhirstack.cli.commands;

import org.fhirstack.cli.CommandLineInterface;
import org.fhirstack.cli.rendering.StackReportRenderer;
import org.fhirstack.orchestrator.Orchestrator;
import org.fhirstack.orchestrator.StackDefinition;
import org.fhirstack.orchestrator.TeardownReport;
import org.fhirstack.registry.StackException;
import org.fhirstack.supervisor.launchers.DockerDaemonUnavailableException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Stops every running service of the stack in reverse dependency order. Services that fail to
 * stop are reported but do not change the exit code; only a teardown that cannot be attempted
 * at all does.
 */
@Command(
    name = "down",
    description = "Stops all running services in reverse dependency order."
)
public class DownCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
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
            final TeardownReport report = orchestrator.down();
            new StackReportRenderer().render(report, stack.name(), out);
            return 0;
        } catch (StackException | DockerDaemonUnavailableException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
