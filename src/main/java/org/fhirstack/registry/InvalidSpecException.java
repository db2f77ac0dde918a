package org.fhirstack.registry;

/**
 * Thrown when a service description is malformed or references a service that does not exist.
 */
public class InvalidSpecException extends StackException {

    private final String serviceName;

    public InvalidSpecException(String serviceName, String message) {
        super(serviceName == null ? message : "Service '" + serviceName + "': " + message);
        this.serviceName = serviceName;
    }

    public InvalidSpecException(String serviceName, String message, Throwable cause) {
        super(serviceName == null ? message : "Service '" + serviceName + "': " + message, cause);
        this.serviceName = serviceName;
    }

    /**
     * @return the name of the offending service, or {@code null} if the error is not tied to one service
     */
    public String getServiceName() {
        return serviceName;
    }
}
