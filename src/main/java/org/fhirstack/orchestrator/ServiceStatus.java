package org.fhirstack.orchestrator;

import org.fhirstack.health.HealthRecord;
import org.fhirstack.supervisor.InstanceState;

/**
 * Read-only status of a declared service.
 *
 * @param name         Service name.
 * @param state        Lifecycle state, {@code null} if the service has no live instance.
 * @param health       Latest health record.
 * @param restartCount Restarts scheduled so far.
 * @param handleId     PID or container id, {@code null} if nothing is attached.
 * @param lastExitCode Exit code of the last termination, if any.
 */
public record ServiceStatus(
    String name,
    InstanceState state,
    HealthRecord health,
    int restartCount,
    String handleId,
    Integer lastExitCode
) {

    public static ServiceStatus notRunning(String name) {
        return new ServiceStatus(name, null, HealthRecord.unknown(), 0, null, null);
    }

    public boolean isRunning() {
        return state == InstanceState.RUNNING;
    }
}
