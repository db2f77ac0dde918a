package org.fhirstack.orchestrator;

import org.fhirstack.health.HealthMonitor;
import org.fhirstack.health.HealthRecord;
import org.fhirstack.health.ProbeResult;
import org.fhirstack.health.probes.HealthProbeFactory;
import org.fhirstack.registry.ServiceSpecRegistry;
import org.fhirstack.scheduler.DependencyScheduler;
import org.fhirstack.scheduler.DependencyTimeoutException;
import org.fhirstack.scheduler.ServiceOutcome;
import org.fhirstack.scheduler.ServiceResult;
import org.fhirstack.scheduler.StartupResult;
import org.fhirstack.scheduler.Topology;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.IInstanceListener;
import org.fhirstack.supervisor.InstanceSnapshot;
import org.fhirstack.supervisor.InstanceState;
import org.fhirstack.supervisor.InstanceStateChangedEvent;
import org.fhirstack.supervisor.ProcessSupervisor;
import org.fhirstack.supervisor.ServiceInstance;
import org.fhirstack.supervisor.launchers.CompositeLauncher;
import org.fhirstack.supervisor.launchers.DockerClientFactory;
import org.fhirstack.supervisor.launchers.DockerLauncher;
import org.fhirstack.supervisor.launchers.ProcessLauncher;
import org.fhirstack.supervisor.spi.ILauncher;
import org.fhirstack.supervisor.spi.IServiceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Brings a stack up and down and answers status queries. Composes the registry, the scheduler,
 * the supervisor and the health monitor of one stack.
 * <p>
 * Nothing is persisted: a new orchestrator knows only the services it started itself, plus any
 * it finds with {@link #adoptRunning()}.
 */
public class Orchestrator implements IInstanceListener, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Orchestrator.class);

    private final StackDefinition stack;
    private final ServiceSpecRegistry registry = new ServiceSpecRegistry();
    private final Topology topology;
    private final ILauncher launcher;
    private final ProcessSupervisor supervisor;
    private final HealthMonitor monitor;
    private final DependencyScheduler scheduler;
    private final List<String> failedServices = new CopyOnWriteArrayList<>();
    private volatile CompletableFuture<StartupResult> inFlight;
    private volatile boolean downRequested;

    /**
     * Validates the stack and wires its components.
     *
     * @throws org.fhirstack.registry.StackException if the stack definition is invalid
     */
    public Orchestrator(StackDefinition stack, ILauncher launcher) {
        this(stack, launcher, new HealthProbeFactory());
    }

    public Orchestrator(StackDefinition stack, ILauncher launcher, HealthProbeFactory probeFactory) {
        this.stack = stack;
        registry.registerAll(stack.services());
        registry.validateAcyclic();
        this.topology = Topology.of(registry);
        this.launcher = launcher;
        this.supervisor = new ProcessSupervisor(launcher);
        this.monitor = new HealthMonitor(probeFactory);
        this.scheduler = new DependencyScheduler(supervisor, monitor, stack.dependencyTimeout(), stack.stopTimeout());
        supervisor.addListener(monitor);
        supervisor.addListener(this);
        monitor.addListener(supervisor);
    }

    /**
     * Creates an orchestrator with the default launchers: local processes for command services,
     * Docker for image services. The Docker client is only created when first needed.
     */
    public static Orchestrator forStack(StackDefinition stack) {
        ILauncher launcher = new CompositeLauncher(List.of(
            new ProcessLauncher(stack.logDirectory()),
            new DockerLauncher(stack.name(), () -> DockerClientFactory.create(stack.dockerHost()))));
        return new Orchestrator(stack, launcher);
    }

    public StackDefinition stack() {
        return stack;
    }

    public Topology topology() {
        return topology;
    }

    /**
     * Starts all services in dependency order and blocks until the run is over.
     *
     * @return per-service outcomes; never throws for failures of individual services
     * @throws IllegalStateException if another {@code up} is in progress
     */
    public StackReport up() {
        CompletableFuture<StartupResult> run;
        synchronized (this) {
            if (inFlight != null && !inFlight.isDone()) {
                throw new IllegalStateException("Stack '" + stack.name() + "' is already being started");
            }
            downRequested = false;
            failedServices.clear();
            LOGGER.info("Starting stack '{}' ({} services): {}", stack.name(), topology.size(), topology.names());
            run = scheduler.advance(topology);
            inFlight = run;
        }

        StartupResult result;
        String error = null;
        try {
            result = run.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (!(cause instanceof DependencyTimeoutException timeout)) {
                throw e;
            }
            LOGGER.error("{}", timeout.getMessage());
            result = timeout.getResult();
            error = timeout.getMessage();
        }

        if (error == null && stack.waitForHealthy() && !downRequested) {
            awaitHealthy(result);
        }
        List<ServiceReport> reports = new ArrayList<>();
        for (ServiceResult serviceResult : result.services()) {
            reports.add(new ServiceReport(serviceResult.name(), serviceResult.outcome(),
                healthOf(serviceResult.name()).status(), serviceResult.message()));
        }
        boolean success = error == null && reports.stream().allMatch(report -> report.isSuccess(stack.waitForHealthy()));
        StackReport report = new StackReport(stack.name(), success, reports, Optional.ofNullable(error));
        if (success) {
            LOGGER.info("Stack '{}' is up", stack.name());
        } else {
            LOGGER.warn("Stack '{}' did not come up cleanly: {}", stack.name(),
                report.failures(stack.waitForHealthy()).stream().map(ServiceReport::name).toList());
        }
        return report;
    }

    /**
     * Stops every live instance in shutdown order. An {@code up} in progress is cancelled first.
     * Failures to stop individual services are collected, the teardown always continues.
     */
    public TeardownReport down() {
        downRequested = true;
        scheduler.cancel();
        awaitInFlight();

        List<String> stopped = new ArrayList<>();
        List<TeardownReport.StopFailure> failures = new ArrayList<>();
        for (ServiceSpec spec : topology.shutdownOrder()) {
            Optional<ServiceInstance> instance = supervisor.instance(spec.name());
            if (instance.isEmpty()) {
                continue;
            }
            boolean live = !instance.get().getState().isTerminal();
            try {
                LOGGER.info("Stopping service '{}'", spec.name());
                supervisor.stop(instance.get(), stack.stopTimeout());
                if (live) {
                    stopped.add(spec.name());
                }
            } catch (RuntimeException e) {
                LOGGER.error("Failed to stop '{}': {}", spec.name(), e.getMessage());
                failures.add(new TeardownReport.StopFailure(spec.name(), String.valueOf(e.getMessage())));
            }
        }
        TeardownReport report = new TeardownReport(stopped, failures);
        if (report.isSuccess()) {
            LOGGER.info("Stack '{}' is down ({} services stopped)", stack.name(), stopped.size());
        } else {
            LOGGER.warn("Stack '{}' is down with {} stop failure(s)", stack.name(), failures.size());
        }
        return report;
    }

    /**
     * @return one entry per declared service in startup order
     */
    public List<ServiceStatus> status() {
        List<ServiceStatus> statuses = new ArrayList<>();
        for (ServiceSpec spec : topology.startupOrder()) {
            Optional<InstanceSnapshot> snapshot = supervisor.instance(spec.name()).map(ServiceInstance::snapshot);
            statuses.add(snapshot
                .map(s -> new ServiceStatus(s.name(), s.state(), healthOf(s.name()), s.restartCount(), s.handleId(), s.lastExitCode()))
                .orElseGet(() -> ServiceStatus.notRunning(spec.name())));
        }
        return statuses;
    }

    /**
     * Registers services that are already running (for example containers started by an earlier,
     * detached {@code up}) as live instances.
     *
     * @return names of the adopted services
     */
    public List<String> adoptRunning() {
        List<String> adopted = new ArrayList<>();
        for (ServiceSpec spec : topology.startupOrder()) {
            if (supervisor.instance(spec.name()).isPresent()) {
                continue;
            }
            Optional<IServiceHandle> handle = launcher.discover(spec);
            if (handle.isPresent()) {
                supervisor.adopt(spec, handle.get());
                adopted.add(spec.name());
            }
        }
        if (!adopted.isEmpty()) {
            LOGGER.info("Adopted running services: {}", adopted);
        }
        return adopted;
    }

    /**
     * Runs the health probe of a live service once.
     */
    public Optional<ProbeResult> probe(String name) {
        return supervisor.instance(name)
            .filter(instance -> instance.getState() == InstanceState.RUNNING)
            .map(monitor::probeOnce);
    }

    /**
     * @return services that ended {@link InstanceState#FAILED} since the last {@code up}
     */
    public List<String> failedServices() {
        return List.copyOf(failedServices);
    }

    @Override
    public void onStateChanged(InstanceStateChangedEvent event) {
        if (event.newState() == InstanceState.FAILED) {
            failedServices.add(event.serviceName());
        }
    }

    /**
     * Shuts down the orchestrator's threads and the launcher. Running services are left alone;
     * call {@link #down()} first to stop them.
     */
    @Override
    public void close() {
        scheduler.close();
        monitor.close();
        supervisor.close();
        try {
            launcher.close();
        } catch (Exception e) {
            LOGGER.warn("Failed to close launcher: {}", e.getMessage());
        }
    }

    private HealthRecord healthOf(String name) {
        return monitor.record(name)
            .or(() -> supervisor.instance(name).map(ServiceInstance::getLastHealth))
            .orElse(HealthRecord.unknown());
    }

    private void awaitHealthy(StartupResult result) {
        long deadline = System.nanoTime() + stack.dependencyTimeout().toNanos();
        for (ServiceResult serviceResult : result.services()) {
            if (serviceResult.outcome() != ServiceOutcome.STARTED) {
                continue;
            }
            long remaining = deadline - System.nanoTime();
            try {
                monitor.readiness(serviceResult.name()).get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                LOGGER.warn("Service '{}' is not healthy after {} ms", serviceResult.name(), stack.dependencyTimeout().toMillis());
            } catch (ExecutionException e) {
                LOGGER.debug("Service '{}' did not become healthy: {}", serviceResult.name(), e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void awaitInFlight() {
        CompletableFuture<StartupResult> run = inFlight;
        if (run == null || run.isDone()) {
            return;
        }
        LOGGER.info("Cancelling startup of stack '{}'", stack.name());
        try {
            run.get(stack.stopTimeout().plus(Duration.ofSeconds(5)).toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOGGER.warn("Startup did not settle within {} ms, stopping services anyway", stack.stopTimeout().toMillis());
        } catch (ExecutionException | CancellationException e) {
            LOGGER.debug("Cancelled startup ended with: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
