package org.fhirstack.supervisor;

import org.fhirstack.registry.StackException;

/**
 * Thrown when a service could not be stopped cleanly.
 */
public class ServiceStopException extends StackException {

    private final String serviceName;

    public ServiceStopException(String serviceName, String message, Throwable cause) {
        super("Failed to stop '" + serviceName + "': " + message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
