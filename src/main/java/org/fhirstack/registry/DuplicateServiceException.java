package org.fhirstack.registry;

/**
 * Thrown when a service name is registered twice.
 */
public class DuplicateServiceException extends StackException {

    private final String serviceName;

    public DuplicateServiceException(String serviceName) {
        super("Service '" + serviceName + "' is already registered.");
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
