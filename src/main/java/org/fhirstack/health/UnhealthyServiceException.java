package org.fhirstack.health;

import org.fhirstack.registry.StackException;

/**
 * Completes the readiness signal of a service that will not become healthy in its current run:
 * it was reported unhealthy, failed, or was stopped.
 */
public class UnhealthyServiceException extends StackException {

    private final String serviceName;

    public UnhealthyServiceException(String serviceName, String reason) {
        super("Service '" + serviceName + "' " + reason);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
