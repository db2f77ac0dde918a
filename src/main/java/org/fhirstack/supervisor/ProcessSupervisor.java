package org.fhirstack.supervisor;

import org.fhirstack.health.HealthRecord;
import org.fhirstack.health.HealthStatus;
import org.fhirstack.health.HealthTransition;
import org.fhirstack.health.IHealthListener;
import org.fhirstack.spec.RestartPolicy;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.spi.ILauncher;
import org.fhirstack.supervisor.spi.IServiceHandle;
import org.fhirstack.supervisor.spi.LaunchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Starts, stops and restarts service instances and owns the table of live instances.
 * <p>
 * <strong>Threading:</strong> the instance table and every {@link ServiceInstance} mutation is
 * guarded by a single lock. Process exits and health verdicts are not handled on the thread
 * that observes them: they are posted as messages to the supervisor's event thread, which
 * serializes them with orchestrator-driven stops. Restarts are fired by a timer after the
 * backoff of the instance's {@link RestartPolicy}. State transitions are published to
 * {@link IInstanceListener}s on a dedicated dispatcher thread, in order.
 */
public class ProcessSupervisor implements IHealthListener, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);

    private final ILauncher launcher;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ServiceInstance> instances = new LinkedHashMap<>();
    private final BlockingQueue<SupervisorEvent> events = new LinkedBlockingQueue<>();
    private final List<IInstanceListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService timers;
    private final ExecutorService dispatcher;
    private final Thread eventThread;
    private volatile boolean closed;

    public ProcessSupervisor(final ILauncher launcher) {
        this.launcher = launcher;
        this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("supervisor-timer"));
        this.dispatcher = Executors.newSingleThreadExecutor(daemonThreads("supervisor-dispatch"));
        this.eventThread = new Thread(this::runEventLoop, "supervisor-events");
        this.eventThread.setDaemon(true);
        this.eventThread.start();
    }

    public void addListener(final IInstanceListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final IInstanceListener listener) {
        listeners.remove(listener);
    }

    /**
     * Launches a service and returns once the OS reports it alive. The instance is not yet
     * health-checked. Failed launches are retried according to the restart policy, sleeping
     * for the policy's backoff between attempts.
     *
     * @param spec the service to launch
     * @return the running instance
     * @throws LaunchException       if the launch failed and the policy allows no further attempt;
     *                               the instance is left in {@link InstanceState#FAILED}
     * @throws IllegalStateException if a live instance of the service already exists
     */
    public ServiceInstance start(final ServiceSpec spec) throws LaunchException {
        final ServiceInstance instance;
        lock.lock();
        try {
            ensureOpen();
            final ServiceInstance existing = instances.get(spec.name());
            if (existing != null && !existing.getState().isTerminal()) {
                throw new IllegalStateException("Service '" + spec.name() + "' is already " + existing.getState());
            }
            instance = new ServiceInstance(spec);
            instances.put(spec.name(), instance);
            transition(instance, InstanceState.STARTING);
        } finally {
            lock.unlock();
        }

        final RestartPolicy policy = spec.restart();
        int attempt = 0;
        while (true) {
            final IServiceHandle handle;
            try {
                handle = launcher.launch(spec);
            } catch (final LaunchException e) {
                final Duration delay = onLaunchFailure(instance, policy, attempt, e);
                if (delay == null) {
                    throw e;
                }
                LOGGER.warn("{} Retrying in {} ms.", e.getMessage(), delay.toMillis());
                sleepBeforeRetry(instance, delay, e);
                attempt++;
                continue;
            }
            if (!completeLaunch(instance, handle)) {
                throw new LaunchException(spec.name(), "stopped while launching");
            }
            LOGGER.info("Service '{}' is running ({})", spec.name(), handle.id());
            return instance;
        }
    }

    /**
     * Registers an already running process or container (found via {@link ILauncher#discover})
     * as a live instance.
     */
    public ServiceInstance adopt(final ServiceSpec spec, final IServiceHandle handle) {
        lock.lock();
        try {
            ensureOpen();
            final ServiceInstance existing = instances.get(spec.name());
            if (existing != null && !existing.getState().isTerminal()) {
                throw new IllegalStateException("Service '" + spec.name() + "' is already " + existing.getState());
            }
            final ServiceInstance instance = new ServiceInstance(spec);
            instances.put(spec.name(), instance);
            transition(instance, InstanceState.STARTING);
            attachAndRun(instance, handle);
            LOGGER.info("Adopted running service '{}' ({})", spec.name(), handle.id());
            return instance;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops an instance: graceful termination, then a forced kill if it is still alive after
     * {@code timeout}. Pending restarts are cancelled. On success the instance is
     * {@link InstanceState#STOPPED} and removed from the instance table. Stopping an instance
     * that is already stopped or failed only removes it from the table.
     *
     * @throws ServiceStopException if the instance could not be terminated; it is then left
     *                              {@link InstanceState#FAILED}
     */
    public void stop(final ServiceInstance instance, final Duration timeout) {
        final IServiceHandle handle;
        final InstanceState previous;
        lock.lock();
        try {
            previous = instance.getState();
            if (previous.isTerminal()) {
                instances.remove(instance.getName(), instance);
                return;
            }
            if (previous == InstanceState.STOPPING) {
                LOGGER.debug("Service '{}' is already stopping", instance.getName());
                return;
            }
            instance.requestStop();
            cancelPendingRestart(instance);
            transition(instance, InstanceState.STOPPING);
            handle = instance.getHandle();
            if (handle == null && previous != InstanceState.STARTING) {
                // crashed and waiting for a restart, or never launched
                finishStop(instance);
                return;
            }
        } finally {
            lock.unlock();
        }
        if (handle == null) {
            // the launching thread sees the stop request and tears the new handle down
            LOGGER.debug("Service '{}' is being launched, stop deferred to the launcher thread", instance.getName());
            return;
        }

        LOGGER.debug("Stopping service '{}' ({})", instance.getName(), handle.id());
        try {
            terminate(instance.getName(), handle, timeout);
        } catch (final RuntimeException e) {
            lock.lock();
            try {
                instance.detach();
                transition(instance, InstanceState.FAILED);
            } finally {
                lock.unlock();
            }
            releaseQuietly(instance.getName(), handle);
            throw e instanceof ServiceStopException stopException
                ? stopException
                : new ServiceStopException(instance.getName(), e.getMessage(), e);
        }
        releaseQuietly(instance.getName(), handle);
        lock.lock();
        try {
            finishStop(instance);
        } finally {
            lock.unlock();
        }
        LOGGER.info("Service '{}' stopped", instance.getName());
    }

    /**
     * Exit notification for an instance. The call only enqueues a message; the supervisor's event
     * thread decides between restart and failure.
     */
    public void onExit(final ServiceInstance instance, final int exitCode) {
        events.offer(new ExitEvent(instance.getName(), instance.getGeneration(), exitCode, null));
    }

    @Override
    public void onHealthChanged(final HealthTransition transition) {
        events.offer(new HealthEvent(transition.serviceName(), transition.generation(), transition.record()));
    }

    public Optional<ServiceInstance> instance(final String name) {
        lock.lock();
        try {
            return Optional.ofNullable(instances.get(name));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the live instance table in launch order
     */
    public List<ServiceInstance> instances() {
        lock.lock();
        try {
            return List.copyOf(instances.values());
        } finally {
            lock.unlock();
        }
    }

    public List<InstanceSnapshot> snapshots() {
        return instances().stream().map(ServiceInstance::snapshot).toList();
    }

    /**
     * Shuts down the supervisor's threads. Running instances are left alone; stop them first.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        eventThread.interrupt();
        timers.shutdownNow();
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(2, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
            eventThread.join(2000);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -- launch helpers --

    /**
     * Records a failed launch attempt.
     *
     * @return the backoff before the next attempt, or {@code null} if the instance has failed
     */
    private Duration onLaunchFailure(final ServiceInstance instance, final RestartPolicy policy,
                                     final int attempt, final LaunchException cause) {
        lock.lock();
        try {
            if (instance.isStopRequested()) {
                finishStop(instance);
                return null;
            }
            if (!closed && policy.permitsRestart(true, attempt)) {
                final Duration delay = policy.backoffFor(attempt);
                instance.recordRestart(new RestartAttempt(attempt, delay, Instant.now(), "launch failed"));
                return delay;
            }
            transition(instance, InstanceState.FAILED);
            LOGGER.error("{}", cause.getMessage());
            LOGGER.debug("Launch failure details:", cause);
            return null;
        } finally {
            lock.unlock();
        }
    }

    private void sleepBeforeRetry(final ServiceInstance instance, final Duration delay,
                                  final LaunchException cause) throws LaunchException {
        try {
            TimeUnit.MILLISECONDS.sleep(delay.toMillis());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            lock.lock();
            try {
                if (instance.isStopRequested()) {
                    finishStop(instance);
                } else {
                    transition(instance, InstanceState.FAILED);
                }
            } finally {
                lock.unlock();
            }
            throw new LaunchException(instance.getName(), "interrupted while waiting to retry", cause);
        }
    }

    /**
     * Attaches a freshly launched handle, unless a stop was requested meanwhile, in which case
     * the handle is torn down and the instance is finished as stopped.
     *
     * @return {@code true} if the instance is now running
     */
    private boolean completeLaunch(final ServiceInstance instance, final IServiceHandle handle) {
        lock.lock();
        try {
            if (!instance.isStopRequested()) {
                attachAndRun(instance, handle);
                return true;
            }
        } finally {
            lock.unlock();
        }
        LOGGER.debug("Service '{}' was stopped while launching, tearing down {}", instance.getName(), handle.id());
        try {
            terminate(instance.getName(), handle, KILL_GRACE);
        } catch (final RuntimeException e) {
            LOGGER.warn("Failed to tear down '{}' after a stop during launch: {}", instance.getName(), e.getMessage());
        }
        releaseQuietly(instance.getName(), handle);
        lock.lock();
        try {
            finishStop(instance);
        } finally {
            lock.unlock();
        }
        return false;
    }

    private void attachAndRun(final ServiceInstance instance, final IServiceHandle handle) {
        instance.attach(handle);
        instance.setLastHealth(HealthRecord.unknown());
        final long generation = instance.getGeneration();
        final String name = instance.getName();
        transition(instance, InstanceState.RUNNING);
        handle.onExit().whenComplete((exitCode, error) ->
            events.offer(new ExitEvent(name, generation, exitCode, error)));
    }

    private void relaunch(final String name, final long generation) {
        final ServiceInstance instance;
        lock.lock();
        try {
            instance = instances.get(name);
            if (instance == null || instance.getGeneration() != generation
                || instance.getState() != InstanceState.CRASHED || instance.isStopRequested() || closed) {
                return;
            }
            instance.setPendingRestart(null);
            transition(instance, InstanceState.STARTING);
        } finally {
            lock.unlock();
        }

        final IServiceHandle handle;
        try {
            handle = launcher.launch(instance.getSpec());
        } catch (final LaunchException e) {
            lock.lock();
            try {
                if (instance.isStopRequested()) {
                    finishStop(instance);
                } else {
                    LOGGER.warn("{}", e.getMessage());
                    transition(instance, InstanceState.CRASHED);
                    scheduleRestartOrFail(instance, true, "relaunch failed");
                }
            } finally {
                lock.unlock();
            }
            return;
        }
        if (completeLaunch(instance, handle)) {
            LOGGER.info("Service '{}' restarted ({}, restart #{})", name, handle.id(), instance.getRestartCount());
        }
    }

    // -- event handling --

    private void runEventLoop() {
        while (!closed) {
            try {
                final SupervisorEvent event = events.take();
                if (event instanceof ExitEvent exit) {
                    handleExit(exit);
                } else if (event instanceof HealthEvent health) {
                    handleHealth(health);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (final RuntimeException e) {
                LOGGER.error("Failed to process supervisor event: {}", e.getMessage());
                LOGGER.debug("Event processing failure details:", e);
            }
        }
    }

    private void handleExit(final ExitEvent event) {
        final IServiceHandle handle;
        lock.lock();
        try {
            final ServiceInstance instance = instances.get(event.name());
            if (instance == null || instance.getGeneration() != event.generation()
                || instance.isStopRequested() || instance.getState() != InstanceState.RUNNING) {
                return; // stale, or stop() is in charge
            }
            handle = instance.getHandle();
            instance.setLastExitCode(event.exitCode());
            final boolean failed = instance.isRestartForUnhealthy()
                || event.exitCode() == null || event.exitCode() != 0;
            final String reason;
            if (instance.isRestartForUnhealthy()) {
                reason = "unhealthy";
            } else if (event.exitCode() == null) {
                reason = "exit not observable: " + (event.error() == null ? "unknown" : event.error().getMessage());
            } else {
                reason = "exit code " + event.exitCode();
            }
            LOGGER.warn("Service '{}' exited unexpectedly ({})", event.name(), reason);
            instance.detach();
            transition(instance, InstanceState.CRASHED);
            scheduleRestartOrFail(instance, failed, reason);
        } finally {
            lock.unlock();
        }
        if (handle != null) {
            releaseQuietly(event.name(), handle);
        }
    }

    private void handleHealth(final HealthEvent event) {
        final IServiceHandle handle;
        lock.lock();
        try {
            final ServiceInstance instance = instances.get(event.name());
            if (instance == null || instance.getGeneration() != event.generation()) {
                return;
            }
            instance.setLastHealth(event.record());
            if (event.record().status() != HealthStatus.UNHEALTHY
                || instance.getState() != InstanceState.RUNNING
                || instance.isStopRequested()
                || instance.isRestartForUnhealthy()) {
                return;
            }
            final RestartPolicy policy = instance.getSpec().restart();
            if (!policy.permitsRestart(true, instance.getRestartCount())) {
                LOGGER.warn("Service '{}' is unhealthy ({}); restart policy '{}' does not restart it",
                    event.name(), event.record().lastMessage(), policy.mode().configName());
                return;
            }
            LOGGER.warn("Service '{}' is unhealthy ({}); terminating it for restart",
                event.name(), event.record().lastMessage());
            instance.markRestartForUnhealthy();
            handle = instance.getHandle();
            final long generation = instance.getGeneration();
            timers.schedule(() -> killIfStillAlive(event.name(), generation, handle),
                KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
        // terminate() may block on the Docker daemon and must not run under the lock
        try {
            handle.terminate();
        } catch (final RuntimeException e) {
            LOGGER.warn("Failed to terminate unhealthy service '{}' ({}), killing it", event.name(), e.getMessage());
            killQuietly(event.name(), handle);
        }
    }

    private void killIfStillAlive(final String name, final long generation, final IServiceHandle handle) {
        lock.lock();
        try {
            final ServiceInstance instance = instances.get(name);
            if (instance == null || instance.getGeneration() != generation || !handle.isAlive()) {
                return;
            }
        } finally {
            lock.unlock();
        }
        LOGGER.warn("Service '{}' ignored the termination request, killing it", name);
        killQuietly(name, handle);
    }

    private void killQuietly(final String name, final IServiceHandle handle) {
        try {
            handle.kill();
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to kill '{}': {}", name, e.getMessage());
        }
    }

    /**
     * Decides what happens to a {@link InstanceState#CRASHED} instance. Caller holds the lock.
     */
    private void scheduleRestartOrFail(final ServiceInstance instance, final boolean failed, final String reason) {
        final RestartPolicy policy = instance.getSpec().restart();
        final int attempt = instance.getRestartCount();
        if (!closed && policy.permitsRestart(failed, attempt)) {
            final Duration delay = policy.backoffFor(attempt);
            instance.recordRestart(new RestartAttempt(attempt, delay, Instant.now(), reason));
            final String name = instance.getName();
            final long generation = instance.getGeneration();
            try {
                final ScheduledFuture<?> future = timers.schedule(() -> relaunch(name, generation),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
                instance.setPendingRestart(future);
                LOGGER.info("Restarting '{}' in {} ms (attempt {})", name, delay.toMillis(), attempt + 1);
                return;
            } catch (final RejectedExecutionException e) {
                LOGGER.debug("Supervisor is shutting down, not restarting '{}'", name);
            }
        }
        transition(instance, InstanceState.FAILED);
        LOGGER.error("Service '{}' failed ({}), restart policy '{}' exhausted after {} restart(s)",
            instance.getName(), reason, policy.mode().configName(), attempt);
    }

    // -- internals --

    private void terminate(final String name, final IServiceHandle handle, final Duration timeout) {
        handle.terminate();
        if (awaitExit(name, handle, timeout)) {
            return;
        }
        LOGGER.warn("Service '{}' did not stop within {} ms, killing it", name, timeout.toMillis());
        handle.kill();
        if (!awaitExit(name, handle, KILL_GRACE)) {
            throw new ServiceStopException(name, "still alive after forced kill", null);
        }
    }

    private boolean awaitExit(final String name, final IServiceHandle handle, final Duration timeout) {
        try {
            handle.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (final TimeoutException e) {
            return false;
        } catch (final ExecutionException e) {
            LOGGER.debug("Exit of '{}' could not be observed: {}", name, e.getMessage());
            return !handle.isAlive();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceStopException(name, "interrupted while waiting for exit", e);
        }
    }

    private void finishStop(final ServiceInstance instance) {
        instance.detach();
        transition(instance, InstanceState.STOPPED);
        instances.remove(instance.getName(), instance);
    }

    private void cancelPendingRestart(final ServiceInstance instance) {
        final ScheduledFuture<?> pending = instance.getPendingRestart();
        if (pending != null) {
            pending.cancel(false);
            instance.setPendingRestart(null);
        }
    }

    private void releaseQuietly(final String name, final IServiceHandle handle) {
        try {
            handle.release();
        } catch (final RuntimeException e) {
            LOGGER.warn("Failed to release resources of '{}': {}", name, e.getMessage());
        }
    }

    private void transition(final ServiceInstance instance, final InstanceState newState) {
        final InstanceState oldState = instance.getState();
        if (!oldState.canTransitionTo(newState)) {
            throw new IllegalStateException(String.format("Service '%s' cannot go from %s to %s",
                instance.getName(), oldState, newState));
        }
        instance.setState(newState);
        LOGGER.debug("Service '{}': {} -> {}", instance.getName(), oldState, newState);
        final InstanceStateChangedEvent event =
            new InstanceStateChangedEvent(instance, oldState, newState, Instant.now());
        try {
            dispatcher.execute(() -> notifyListeners(event));
        } catch (final RejectedExecutionException e) {
            LOGGER.debug("Dispatcher closed, dropping {} event for '{}'", newState, instance.getName());
        }
    }

    private void notifyListeners(final InstanceStateChangedEvent event) {
        for (final IInstanceListener listener : listeners) {
            try {
                listener.onStateChanged(event);
            } catch (final RuntimeException e) {
                LOGGER.warn("Instance listener {} failed on {} event for '{}': {}",
                    listener.getClass().getSimpleName(), event.newState(), event.serviceName(), e.getMessage());
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Supervisor is closed");
        }
    }

    private static ThreadFactory daemonThreads(final String name) {
        final AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            final Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Messages processed by the event thread.
     */
    private interface SupervisorEvent {
    }

    private record ExitEvent(String name, long generation, Integer exitCode, Throwable error) implements SupervisorEvent {
    }

    private record HealthEvent(String name, long generation, HealthRecord record) implements SupervisorEvent {
    }
}
