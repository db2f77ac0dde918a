package org.fhirstack.supervisor;

import java.time.Instant;

/**
 * Published by the {@link ProcessSupervisor} whenever an instance transitions between states.
 */
public record InstanceStateChangedEvent(
    ServiceInstance instance,
    InstanceState oldState,
    InstanceState newState,
    Instant timestamp
) {

    public String serviceName() {
        return instance.getName();
    }
}
