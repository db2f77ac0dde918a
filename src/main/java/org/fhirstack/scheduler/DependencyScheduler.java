package org.fhirstack.scheduler;

import org.fhirstack.health.HealthMonitor;
import org.fhirstack.health.HealthRecord;
import org.fhirstack.health.UnhealthyServiceException;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.InstanceState;
import org.fhirstack.supervisor.ProcessSupervisor;
import org.fhirstack.supervisor.ServiceInstance;
import org.fhirstack.supervisor.ServiceStopException;
import org.fhirstack.supervisor.spi.LaunchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts the services of a {@link Topology} one after another, each only once every one of its
 * dependencies is healthy.
 * <p>
 * A run is a chain of {@link CompletableFuture}s: while a service waits for its dependencies no
 * thread is blocked. Launches run on a dedicated launcher thread because
 * {@link ProcessSupervisor#start} may block while retrying.
 * <ul>
 *   <li>A dependency that fails or turns unhealthy causes its waiting dependents to be
 *       {@link ServiceOutcome#SKIPPED}; unrelated services continue.</li>
 *   <li>A dependency wait that exceeds the dependency timeout aborts the run: the remaining
 *       services are {@link ServiceOutcome#ABORTED}, already started ones are stopped in reverse
 *       order and the run completes with a {@link DependencyTimeoutException}.</li>
 *   <li>{@link #cancel()} aborts the current run without rollback.</li>
 * </ul>
 */
public class DependencyScheduler implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyScheduler.class);

    private final ProcessSupervisor supervisor;
    private final HealthMonitor monitor;
    private final Duration dependencyTimeout;
    private final Duration stopTimeout;
    private final ExecutorService launchExecutor;
    private volatile Run current;

    public DependencyScheduler(ProcessSupervisor supervisor, HealthMonitor monitor,
                               Duration dependencyTimeout, Duration stopTimeout) {
        this.supervisor = supervisor;
        this.monitor = monitor;
        this.dependencyTimeout = dependencyTimeout;
        this.stopTimeout = stopTimeout;
        AtomicInteger counter = new AtomicInteger();
        this.launchExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "scheduler-launch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public List<ServiceSpec> startupOrder(Topology topology) {
        return topology.startupOrder();
    }

    public List<ServiceSpec> shutdownOrder(Topology topology) {
        return topology.shutdownOrder();
    }

    /**
     * Starts all services of the topology in startup order.
     *
     * @return completes with the per-service outcomes, or exceptionally with a
     *         {@link DependencyTimeoutException} after rolling back
     */
    public CompletableFuture<StartupResult> advance(Topology topology) {
        Run run = new Run(topology);
        current = run;
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (ServiceSpec spec : topology.startupOrder()) {
            chain = chain.thenCompose(ignored -> run.step(spec));
        }
        return chain.thenCompose(ignored -> run.finish());
    }

    /**
     * Cancels the run in progress: pending dependency waits are abandoned and no further service
     * is launched. Services that are already running are left to the caller.
     */
    public void cancel() {
        Run run = current;
        if (run != null) {
            run.cancel();
        }
    }

    @Override
    public void close() {
        cancel();
        launchExecutor.shutdownNow();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * State of one {@link #advance} call. Steps execute strictly one after another.
     */
    private final class Run {

        private final Topology topology;
        private final Map<String, ServiceResult> results = new LinkedHashMap<>();
        private volatile boolean cancelled;
        private volatile DependencyTimeoutException timeout;
        private volatile CompletableFuture<Void> currentWait;

        private Run(Topology topology) {
            this.topology = topology;
        }

        private CompletableFuture<Void> step(ServiceSpec spec) {
            if (cancelled) {
                record(spec, ServiceOutcome.ABORTED, "startup cancelled");
                return CompletableFuture.completedFuture(null);
            }
            if (timeout != null) {
                record(spec, ServiceOutcome.ABORTED, "startup aborted after '" + timeout.getServiceName() + "' timed out");
                return CompletableFuture.completedFuture(null);
            }
            Optional<ServiceResult> blocker = spec.dependsOn().stream()
                .map(this::resultOf)
                .filter(result -> !result.isStarted())
                .findFirst();
            if (blocker.isPresent()) {
                ServiceResult result = blocker.get();
                record(spec, ServiceOutcome.SKIPPED,
                    "dependency '" + result.name() + "' did not start (" + result.outcome().name().toLowerCase(Locale.ROOT) + ")");
                return CompletableFuture.completedFuture(null);
            }
            if (spec.dependsOn().isEmpty()) {
                return launch(spec);
            }

            LOGGER.info("Service '{}' is waiting for {} to become healthy", spec.name(), spec.dependsOn());
            Map<String, CompletableFuture<HealthRecord>> signals = new LinkedHashMap<>();
            spec.dependsOn().forEach(dependency -> signals.put(dependency, monitor.readiness(dependency)));
            CompletableFuture<Void> gate = allHealthy(signals)
                .orTimeout(dependencyTimeout.toMillis(), TimeUnit.MILLISECONDS);
            currentWait = gate;
            if (cancelled) {
                gate.cancel(false);
            }
            return gate.handle((ignored, error) -> error)
                .thenCompose(error -> {
                    currentWait = null;
                    if (error == null) {
                        return launch(spec);
                    }
                    onWaitFailed(spec, signals, unwrap(error));
                    return CompletableFuture.completedFuture(null);
                });
        }

        private void onWaitFailed(ServiceSpec spec, Map<String, CompletableFuture<HealthRecord>> signals, Throwable cause) {
            if (cause instanceof TimeoutException) {
                List<String> pending = signals.entrySet().stream()
                    .filter(entry -> !entry.getValue().isDone())
                    .map(Map.Entry::getKey)
                    .toList();
                LOGGER.error("Service '{}' timed out after {} ms waiting for {}", spec.name(), dependencyTimeout.toMillis(), pending);
                record(spec, ServiceOutcome.TIMED_OUT, "dependencies " + pending + " not healthy within "
                    + dependencyTimeout.toMillis() + " ms");
                timeout = new DependencyTimeoutException(spec.name(), pending, dependencyTimeout, null);
            } else if (cause instanceof UnhealthyServiceException unhealthy) {
                LOGGER.warn("Skipping '{}': {}", spec.name(), unhealthy.getMessage());
                record(spec, ServiceOutcome.SKIPPED, "dependency '" + unhealthy.getServiceName() + "' did not become healthy: "
                    + unhealthy.getMessage());
            } else if (cause instanceof CancellationException) {
                record(spec, ServiceOutcome.ABORTED, "startup cancelled");
            } else {
                LOGGER.error("Waiting for the dependencies of '{}' failed: {}", spec.name(), cause.getMessage());
                record(spec, ServiceOutcome.FAILED, String.valueOf(cause.getMessage()));
            }
        }

        private CompletableFuture<Void> launch(ServiceSpec spec) {
            try {
                return CompletableFuture.runAsync(() -> launchNow(spec), launchExecutor);
            } catch (RejectedExecutionException e) {
                record(spec, ServiceOutcome.ABORTED, "scheduler is shut down");
                return CompletableFuture.completedFuture(null);
            }
        }

        private void launchNow(ServiceSpec spec) {
            if (cancelled) {
                record(spec, ServiceOutcome.ABORTED, "startup cancelled");
                return;
            }
            Optional<ServiceInstance> existing = supervisor.instance(spec.name())
                .filter(instance -> instance.getState() == InstanceState.RUNNING);
            if (existing.isPresent()) {
                LOGGER.info("Service '{}' is already running", spec.name());
                record(spec, ServiceOutcome.STARTED, "already running (" + existing.get().snapshot().handleId() + ")");
                return;
            }
            LOGGER.info("Starting service '{}'", spec.name());
            monitor.expectNewRun(spec.name());
            try {
                ServiceInstance instance = supervisor.start(spec);
                String handle = instance.getHandle() == null ? "" : " (" + instance.getHandle().id() + ")";
                record(spec, ServiceOutcome.STARTED, "launched" + handle);
            } catch (LaunchException e) {
                record(spec, cancelled ? ServiceOutcome.ABORTED : ServiceOutcome.FAILED, e.getMessage());
            } catch (RuntimeException e) {
                LOGGER.error("Unexpected failure starting '{}': {}", spec.name(), e.getMessage());
                LOGGER.debug("Start failure details:", e);
                record(spec, ServiceOutcome.FAILED, String.valueOf(e.getMessage()));
            }
        }

        private CompletableFuture<StartupResult> finish() {
            DependencyTimeoutException timedOut = timeout;
            if (timedOut == null) {
                return CompletableFuture.completedFuture(snapshot());
            }
            CompletableFuture<StartupResult> rolledBack = new CompletableFuture<>();
            Runnable rollback = () -> {
                rollback();
                rolledBack.completeExceptionally(new DependencyTimeoutException(timedOut.getServiceName(),
                    timedOut.getPendingDependencies(), dependencyTimeout, snapshot()));
            };
            try {
                launchExecutor.execute(rollback);
            } catch (RejectedExecutionException e) {
                rollback.run();
            }
            return rolledBack;
        }

        private void rollback() {
            for (ServiceSpec spec : topology.shutdownOrder()) {
                ServiceResult result = resultOf(spec.name());
                if (!result.isStarted()) {
                    continue;
                }
                supervisor.instance(spec.name()).ifPresent(instance -> {
                    LOGGER.info("Rolling back service '{}'", spec.name());
                    try {
                        supervisor.stop(instance, stopTimeout);
                    } catch (ServiceStopException e) {
                        LOGGER.error("Rollback of '{}' failed: {}", spec.name(), e.getMessage());
                    }
                });
                record(spec, ServiceOutcome.ABORTED, "rolled back after '" + timeout.getServiceName() + "' timed out");
            }
        }

        private void cancel() {
            cancelled = true;
            CompletableFuture<Void> wait = currentWait;
            if (wait != null) {
                wait.cancel(false);
            }
        }

        private synchronized void record(ServiceSpec spec, ServiceOutcome outcome, String message) {
            results.put(spec.name(), new ServiceResult(spec.name(), outcome, message));
        }

        private synchronized ServiceResult resultOf(String name) {
            ServiceResult result = results.get(name);
            return result != null ? result : new ServiceResult(name, ServiceOutcome.ABORTED, "not scheduled");
        }

        private synchronized StartupResult snapshot() {
            List<ServiceResult> ordered = new ArrayList<>();
            for (ServiceSpec spec : topology.startupOrder()) {
                ServiceResult result = results.get(spec.name());
                if (result != null) {
                    ordered.add(result);
                }
            }
            return new StartupResult(ordered);
        }
    }

    /**
     * Completes once all signals completed normally, or exceptionally as soon as one fails.
     */
    private static CompletableFuture<Void> allHealthy(Map<String, CompletableFuture<HealthRecord>> signals) {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        AtomicInteger remaining = new AtomicInteger(signals.size());
        signals.values().forEach(signal -> signal.whenComplete((record, error) -> {
            if (error != null) {
                gate.completeExceptionally(unwrap(error));
            } else if (remaining.decrementAndGet() == 0) {
                gate.complete(null);
            }
        }));
        return gate;
    }
}
