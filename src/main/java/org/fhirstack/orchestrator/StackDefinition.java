package org.fhirstack.orchestrator;

import org.fhirstack.spec.ServiceSpec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * A named set of services plus the settings that govern one orchestrator.
 *
 * @param name              Stack name; prefixes container and volume names.
 * @param workDir           Directory for service logs of command-based services.
 * @param dependencyTimeout Maximum time a service waits for its dependencies to become healthy.
 * @param stopTimeout       Grace period between the termination request and a forced kill.
 * @param waitForHealthy    Whether {@code up} also waits for the last services to become healthy.
 * @param dockerHost        Docker endpoint, {@code null} for the default resolution.
 * @param services          Services in declaration order.
 */
public record StackDefinition(
    String name,
    Path workDir,
    Duration dependencyTimeout,
    Duration stopTimeout,
    boolean waitForHealthy,
    String dockerHost,
    List<ServiceSpec> services
) {

    public StackDefinition {
        services = List.copyOf(services);
    }

    public Path logDirectory() {
        return workDir.resolve("logs");
    }
}
