package org.fhirstack.scheduler;

import org.fhirstack.registry.StackException;

import java.time.Duration;
import java.util.List;

/**
 * Raised when the dependencies of a service do not become healthy within the dependency
 * timeout. The run is aborted and services already started are rolled back.
 */
public class DependencyTimeoutException extends StackException {

    private final String serviceName;
    private final List<String> pendingDependencies;
    private final transient StartupResult result;

    public DependencyTimeoutException(String serviceName, List<String> pendingDependencies,
                                      Duration timeout, StartupResult result) {
        super("Service '" + serviceName + "' timed out after " + timeout.toMillis()
            + " ms waiting for " + String.join(", ", pendingDependencies) + " to become healthy");
        this.serviceName = serviceName;
        this.pendingDependencies = List.copyOf(pendingDependencies);
        this.result = result;
    }

    public String getServiceName() {
        return serviceName;
    }

    public List<String> getPendingDependencies() {
        return pendingDependencies;
    }

    /**
     * @return the outcomes of the aborted run, including the rolled back services
     */
    public StartupResult getResult() {
        return result;
    }
}
