package org.fhirstack.health;

import org.fhirstack.supervisor.ServiceInstance;

/**
 * A single readiness check. Implementations must return within the probe's configured timeout
 * and report failures as {@link ProbeResult#failure(String)} rather than throwing.
 */
public interface IHealthProbe {

    ProbeResult check(ServiceInstance instance);
}
