package org.fhirstack.cli.commands;

import org.fhirstack.cli.CommandLineInterface;
import org.fhirstack.cli.rendering.StackReportRenderer;
import org.fhirstack.orchestrator.Orchestrator;
import org.fhirstack.orchestrator.StackDefinition;
import org.fhirstack.orchestrator.StackReport;
import org.fhirstack.registry.StackException;
import org.fhirstack.spec.LaunchDescriptor;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.launchers.DockerDaemonUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
    name = "up",
    description = "Starts all services in dependency order, each one after its dependencies are healthy."
)
public class UpCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-d", "--detach"}, description = "Leave the services running in the background and exit.")
    private boolean detach;

    @Override
    public Integer call() throws Exception {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final StackDefinition stack;
        final Orchestrator orchestrator;
        try {
            stack = parent.loadStack();
            if (detach && !commandServices(stack).isEmpty()) {
                err.println("Error: --detach needs every service to be image based, but these run as local commands: "
                    + commandServices(stack));
                return 1;
            }
            orchestrator = parent.createOrchestrator(stack);
        } catch (StackException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        final AtomicBoolean tornDown = new AtomicBoolean(false);
        try {
            orchestrator.adoptRunning();
            final StackReport report = orchestrator.up();
            new StackReportRenderer().render(report, stack.waitForHealthy(), out);
            if (!report.success()) {
                if (!detach) {
                    tearDown(orchestrator, tornDown);
                } else {
                    out.println("Run 'fhir-stack down' to stop the services that did start.");
                }
                return 1;
            }
            if (detach) {
                out.println("Services keep running in the background. Run 'fhir-stack down' to stop them.");
                return 0;
            }
            superviseUntilInterrupted(orchestrator, tornDown);
            return 0;
        } catch (DockerDaemonUnavailableException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            orchestrator.close();
        }
    }

    private void superviseUntilInterrupted(final Orchestrator orchestrator, final AtomicBoolean tornDown) {
        final Thread shutdownHook = new Thread(() -> tearDown(orchestrator, tornDown), "fhir-stack-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Supervising stack '{}', press Ctrl+C to stop", orchestrator.stack().name());
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tearDown(orchestrator, tornDown);
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        }
    }

    private static void tearDown(final Orchestrator orchestrator, final AtomicBoolean tornDown) {
        if (tornDown.compareAndSet(false, true)) {
            orchestrator.down();
        }
    }

    static List<String> commandServices(final StackDefinition stack) {
        return stack.services().stream()
            .filter(service -> service.launch().kind() == LaunchDescriptor.Kind.COMMAND)
            .map(ServiceSpec::name)
            .toList();
    }
}
