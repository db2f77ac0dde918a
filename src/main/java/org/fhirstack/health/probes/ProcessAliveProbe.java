package org.fhirstack.health.probes;

import org.fhirstack.health.IHealthProbe;
import org.fhirstack.health.ProbeResult;
import org.fhirstack.supervisor.ServiceInstance;
import org.fhirstack.supervisor.spi.IServiceHandle;

/**
 * Healthy while the instance's process or container is alive.
 */
public class ProcessAliveProbe implements IHealthProbe {

    @Override
    public ProbeResult check(ServiceInstance instance) {
        IServiceHandle handle = instance.getHandle();
        if (handle == null) {
            return ProbeResult.failure("no process attached");
        }
        try {
            return handle.isAlive()
                ? ProbeResult.success(handle.id() + " is alive")
                : ProbeResult.failure(handle.id() + " is not alive");
        } catch (RuntimeException e) {
            return ProbeResult.failure("cannot inspect " + handle.id() + ": " + e.getMessage());
        }
    }
}
