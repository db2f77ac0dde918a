package org.fhirstack.supervisor;

import org.fhirstack.health.HealthRecord;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.spi.IServiceHandle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * Runtime realization of a {@link ServiceSpec}.
 * <p>
 * The instance and its {@link IServiceHandle} are owned by the {@link ProcessSupervisor}: all
 * mutators are package-private and only called while holding the supervisor's lock. Readers
 * may call the getters from any thread and see the latest published values.
 */
public final class ServiceInstance {

    private final ServiceSpec spec;
    private volatile InstanceState state = InstanceState.PENDING;
    private volatile IServiceHandle handle;
    private volatile HealthRecord lastHealth = HealthRecord.unknown();
    private volatile int restartCount;
    private volatile Integer lastExitCode;
    private volatile long generation;
    private final List<RestartAttempt> restartHistory = new CopyOnWriteArrayList<>();

    // Supervisor-private bookkeeping
    private boolean stopRequested;
    private boolean restartForUnhealthy;
    private ScheduledFuture<?> pendingRestart;

    ServiceInstance(final ServiceSpec spec) {
        this.spec = spec;
    }

    public ServiceSpec getSpec() {
        return spec;
    }

    public String getName() {
        return spec.name();
    }

    public InstanceState getState() {
        return state;
    }

    /**
     * @return the current handle, or {@code null} while no process or container is attached
     */
    public IServiceHandle getHandle() {
        return handle;
    }

    public HealthRecord getLastHealth() {
        return lastHealth;
    }

    public int getRestartCount() {
        return restartCount;
    }

    public Integer getLastExitCode() {
        return lastExitCode;
    }

    /**
     * Incremented on every successful launch; events tagged with an older generation are stale.
     */
    public long getGeneration() {
        return generation;
    }

    public List<RestartAttempt> getRestartHistory() {
        return List.copyOf(restartHistory);
    }

    public InstanceSnapshot snapshot() {
        final IServiceHandle current = handle;
        return new InstanceSnapshot(spec.name(), state, lastHealth, restartCount,
            current == null ? null : current.id(), lastExitCode);
    }

    // -- supervisor-only mutators --

    void setState(final InstanceState newState) {
        this.state = newState;
    }

    void attach(final IServiceHandle newHandle) {
        this.handle = newHandle;
        this.generation++;
        this.restartForUnhealthy = false;
    }

    void detach() {
        this.handle = null;
    }

    void setLastHealth(final HealthRecord record) {
        this.lastHealth = record;
    }

    void setLastExitCode(final Integer exitCode) {
        this.lastExitCode = exitCode;
    }

    void recordRestart(final RestartAttempt attempt) {
        restartHistory.add(attempt);
        restartCount = restartHistory.size();
    }

    boolean isStopRequested() {
        return stopRequested;
    }

    void requestStop() {
        this.stopRequested = true;
    }

    boolean isRestartForUnhealthy() {
        return restartForUnhealthy;
    }

    void markRestartForUnhealthy() {
        this.restartForUnhealthy = true;
    }

    ScheduledFuture<?> getPendingRestart() {
        return pendingRestart;
    }

    void setPendingRestart(final ScheduledFuture<?> future) {
        this.pendingRestart = future;
    }

    @Override
    public String toString() {
        return "ServiceInstance[" + spec.name() + ", " + state + "]";
    }
}
