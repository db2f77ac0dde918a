package org.fhirstack.health;

import org.fhirstack.supervisor.ServiceInstance;

/**
 * Published by the {@link HealthMonitor} when an instance's {@link HealthStatus} changes.
 *
 * @param instance   The monitored instance.
 * @param generation Launch generation of the instance the probe ran against.
 * @param oldStatus  Status before the probe.
 * @param record     Record after the probe; {@code record.status()} is the new status.
 */
public record HealthTransition(ServiceInstance instance, long generation, HealthStatus oldStatus, HealthRecord record) {

    public String serviceName() {
        return instance.getName();
    }

    public HealthStatus newStatus() {
        return record.status();
    }
}
