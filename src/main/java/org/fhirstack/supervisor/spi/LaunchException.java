package org.fhirstack.supervisor.spi;

/**
 * Thrown when a service cannot be brought up by its launcher, e.g. because the executable
 * does not exist or the image cannot be pulled.
 */
public class LaunchException extends Exception {

    private final String serviceName;

    public LaunchException(String serviceName, String message) {
        super("Failed to launch '" + serviceName + "': " + message);
        this.serviceName = serviceName;
    }

    public LaunchException(String serviceName, String message, Throwable cause) {
        super("Failed to launch '" + serviceName + "': " + message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
