package org.fhirstack.supervisor.spi;

import java.util.concurrent.CompletableFuture;

/**
 * OS-level handle of a launched service (a local process or a container).
 * A handle is owned by exactly one {@code ServiceInstance}; only the supervisor calls it.
 */
public interface IServiceHandle {

    /**
     * @return a stable identifier for display, e.g. a PID or a container id
     */
    String id();

    boolean isAlive();

    /**
     * Completes with the exit code once the process or container has terminated.
     * Completes exceptionally if termination can no longer be observed.
     */
    CompletableFuture<Integer> onExit();

    /**
     * Requests a graceful shutdown (SIGTERM or equivalent). Does not wait.
     */
    void terminate();

    /**
     * Forcibly kills the service (SIGKILL or equivalent). Does not wait.
     */
    void kill();

    /**
     * Releases OS resources held for the service, e.g. removes the container or closes streams.
     * Called once the service is known to have exited.
     */
    void release();
}
