package org.fhirstack.supervisor;

import org.fhirstack.health.HealthRecord;

/**
 * Point-in-time view of a {@link ServiceInstance}, safe to hand to readers.
 *
 * @param name         Service name.
 * @param state        Lifecycle state.
 * @param health       Last health record reported for the instance.
 * @param restartCount Restarts scheduled so far.
 * @param handleId     PID or container id, {@code null} if nothing is attached.
 * @param lastExitCode Exit code of the last termination, if any.
 */
public record InstanceSnapshot(
    String name,
    InstanceState state,
    HealthRecord health,
    int restartCount,
    String handleId,
    Integer lastExitCode
) {
}
