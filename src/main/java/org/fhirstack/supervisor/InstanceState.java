package org.fhirstack.supervisor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a {@link ServiceInstance}.
 * <pre>
 * PENDING -> STARTING -> RUNNING -> STOPPING -> STOPPED
 *                 |          |
 *                 |          +-> CRASHED -> STARTING (restart) | FAILED | STOPPING
 *                 +-> FAILED (launch failed) | CRASHED (relaunch failed)
 * </pre>
 */
public enum InstanceState {
    PENDING,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    CRASHED,
    FAILED;

    public Set<InstanceState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(STARTING, STOPPING);
            case STARTING -> EnumSet.of(RUNNING, CRASHED, FAILED, STOPPING);
            case RUNNING -> EnumSet.of(STOPPING, CRASHED);
            case CRASHED -> EnumSet.of(STARTING, FAILED, STOPPING);
            case STOPPING -> EnumSet.of(STOPPED, FAILED);
            case STOPPED, FAILED -> EnumSet.noneOf(InstanceState.class);
        };
    }

    public boolean canTransitionTo(InstanceState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
