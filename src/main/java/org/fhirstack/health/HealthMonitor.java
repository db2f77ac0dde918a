package org.fhirstack.health;

import org.fhirstack.health.probes.HealthProbeFactory;
import org.fhirstack.spec.HealthProbeSpec;
import org.fhirstack.supervisor.IInstanceListener;
import org.fhirstack.supervisor.InstanceState;
import org.fhirstack.supervisor.InstanceStateChangedEvent;
import org.fhirstack.supervisor.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the readiness of every {@link InstanceState#RUNNING} instance and maintains its
 * {@link HealthRecord}.
 * <p>
 * Monitoring of an instance starts when the supervisor reports it {@code RUNNING} and stops as
 * soon as it leaves that state; a restarted instance starts again from
 * {@link HealthStatus#UNKNOWN}. {@code successThreshold} consecutive successes make an instance
 * {@link HealthStatus#HEALTHY}, {@code failureThreshold} consecutive failures make it
 * {@link HealthStatus#UNHEALTHY}. Failures during the probe's start period are not counted
 * until the instance has been healthy once.
 * <p>
 * Each service also has a readiness signal ({@link #readiness(String)}): it completes with the
 * first healthy record of the current run and fails with {@link UnhealthyServiceException} once the
 * instance turns unhealthy, fails or is stopped. A crash resets it until the next run is healthy.
 */
public class HealthMonitor implements IInstanceListener, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final HealthProbeFactory probeFactory;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Watch> watches = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<HealthRecord>> readiness = new ConcurrentHashMap<>();
    private final List<IHealthListener> listeners = new CopyOnWriteArrayList<>();

    public HealthMonitor(HealthProbeFactory probeFactory) {
        this(probeFactory, 2);
    }

    public HealthMonitor(HealthProbeFactory probeFactory, int threads) {
        this.probeFactory = probeFactory;
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "health-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(IHealthListener listener) {
        listeners.add(listener);
    }

    public void removeListener(IHealthListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onStateChanged(InstanceStateChangedEvent event) {
        ServiceInstance instance = event.instance();
        if (event.newState() == InstanceState.RUNNING) {
            watch(instance);
            return;
        }
        if (event.oldState() == InstanceState.RUNNING) {
            unwatch(instance.getName());
            // healthy in the previous run only; waiters from now on need the next run to become healthy
            readiness.computeIfPresent(instance.getName(), (key, existing) ->
                existing.isDone() && !existing.isCompletedExceptionally() ? new CompletableFuture<>() : existing);
        }
        if (event.newState() == InstanceState.FAILED) {
            failReadiness(instance.getName(), "failed");
        } else if (event.newState() == InstanceState.STOPPED) {
            failReadiness(instance.getName(), "was stopped");
        }
    }

    /**
     * Starts polling an instance. Replaces any previous watch of the same service.
     */
    public void watch(ServiceInstance instance) {
        String name = instance.getName();
        HealthProbeSpec probeSpec = instance.getSpec().health();
        readiness.compute(name, (key, existing) ->
            existing == null || existing.isDone() ? new CompletableFuture<>() : existing);
        Watch watch = new Watch(instance, instance.getGeneration(), probeFactory.create(probeSpec),
            System.nanoTime() + probeSpec.startPeriod().toNanos());
        Watch previous = watches.put(name, watch);
        if (previous != null) {
            previous.cancel();
        }
        long intervalMillis = probeSpec.interval().toMillis();
        try {
            watch.future = scheduler.scheduleWithFixedDelay(() -> runProbe(watch),
                intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Health monitor is closed, not watching '{}'", name);
            return;
        }
        LOGGER.debug("Watching '{}' with {} probe every {} ms", name, probeSpec.type(), intervalMillis);
    }

    public void unwatch(String name) {
        Watch watch = watches.remove(name);
        if (watch != null) {
            watch.cancel();
            LOGGER.debug("Stopped watching '{}'", name);
        }
    }

    /**
     * Discards the readiness outcome of an earlier run. Called before the service is launched again
     * so that dependents wait for the new run even before its state changes arrive.
     */
    public void expectNewRun(String name) {
        readiness.compute(name, (key, existing) ->
            existing == null || existing.isDone() ? new CompletableFuture<>() : existing);
    }

    /**
     * @return a future that completes once the service is healthy in its current run
     */
    public CompletableFuture<HealthRecord> readiness(String name) {
        return readiness.computeIfAbsent(name, key -> new CompletableFuture<>()).copy();
    }

    /**
     * @return the latest record of a watched service
     */
    public Optional<HealthRecord> record(String name) {
        Watch watch = watches.get(name);
        return watch == null ? Optional.empty() : Optional.of(watch.record);
    }

    /**
     * Runs the instance's probe once on the calling thread, without touching its record.
     */
    public ProbeResult probeOnce(ServiceInstance instance) {
        return safeCheck(probeFactory.create(instance.getSpec().health()), instance);
    }

    @Override
    public void close() {
        watches.values().forEach(Watch::cancel);
        watches.clear();
        scheduler.shutdownNow();
        readiness.values().forEach(future -> future.cancel(false));
    }

    private void runProbe(Watch watch) {
        if (watch.cancelled) {
            return;
        }
        ProbeResult result = safeCheck(watch.probe, watch.instance);
        HealthRecord before;
        HealthRecord after;
        synchronized (watch) {
            if (watch.cancelled) {
                return;
            }
            before = watch.record;
            after = evaluate(before, result, watch.instance.getSpec().health(), System.nanoTime() < watch.graceEndsAt);
            watch.record = after;
        }
        LOGGER.trace("Probe of '{}': {} ({})", watch.instance.getName(), result.success() ? "ok" : "failed", result.message());
        if (after.status() != before.status()) {
            publish(watch, before.status(), after);
        }
    }

    /**
     * Applies one probe result to a record.
     *
     * @param inGracePeriod {@code true} while the start period has not elapsed
     */
    static HealthRecord evaluate(HealthRecord current, ProbeResult result, HealthProbeSpec spec, boolean inGracePeriod) {
        Instant now = Instant.now();
        if (result.success()) {
            int successes = current.consecutiveSuccesses() + 1;
            HealthStatus status = successes >= spec.successThreshold() ? HealthStatus.HEALTHY : current.status();
            return new HealthRecord(status, successes, 0, now, result.message());
        }
        if (inGracePeriod && current.status() != HealthStatus.HEALTHY) {
            return new HealthRecord(current.status(), 0, current.consecutiveFailures(), now,
                result.message() + " (start period)");
        }
        int failures = current.consecutiveFailures() + 1;
        HealthStatus status = failures >= spec.failureThreshold() ? HealthStatus.UNHEALTHY : current.status();
        return new HealthRecord(status, 0, failures, now, result.message());
    }

    private void publish(Watch watch, HealthStatus oldStatus, HealthRecord record) {
        String name = watch.instance.getName();
        if (record.status() == HealthStatus.HEALTHY) {
            LOGGER.info("Service '{}' is healthy", name);
            readiness.computeIfAbsent(name, key -> new CompletableFuture<>()).complete(record);
        } else if (record.status() == HealthStatus.UNHEALTHY) {
            LOGGER.warn("Service '{}' is unhealthy after {} failed probe(s): {}",
                name, record.consecutiveFailures(), record.lastMessage());
            failReadiness(name, "is unhealthy: " + record.lastMessage());
        }
        HealthTransition transition = new HealthTransition(watch.instance, watch.generation, oldStatus, record);
        for (IHealthListener listener : listeners) {
            try {
                listener.onHealthChanged(transition);
            } catch (RuntimeException e) {
                LOGGER.warn("Health listener {} failed for '{}': {}",
                    listener.getClass().getSimpleName(), name, e.getMessage());
            }
        }
    }

    /**
     * Fails the pending readiness signal, or replaces a completed one with a failed signal so that
     * later waiters do not see an earlier healthy result.
     */
    private void failReadiness(String name, String reason) {
        UnhealthyServiceException failure = new UnhealthyServiceException(name, reason);
        readiness.computeIfPresent(name, (key, existing) -> {
            if (existing.completeExceptionally(failure)) {
                return existing;
            }
            return CompletableFuture.failedFuture(failure);
        });
    }

    private static ProbeResult safeCheck(IHealthProbe probe, ServiceInstance instance) {
        try {
            return probe.check(instance);
        } catch (RuntimeException e) {
            return ProbeResult.failure("probe error: " + e.getMessage());
        }
    }

    private static final class Watch {
        private final ServiceInstance instance;
        private final long generation;
        private final IHealthProbe probe;
        private final long graceEndsAt;
        private volatile HealthRecord record = HealthRecord.unknown();
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private Watch(ServiceInstance instance, long generation, IHealthProbe probe, long graceEndsAt) {
            this.instance = instance;
            this.generation = generation;
            this.probe = probe;
            this.graceEndsAt = graceEndsAt;
        }

        private void cancel() {
            cancelled = true;
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
