package org.fhirstack.orchestrator;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link Orchestrator#up()}.
 *
 * @param stackName Stack that was brought up.
 * @param success   {@code true} if every service started (and, if required, became healthy).
 * @param services  Per-service reports in startup order.
 * @param error     Run-level failure such as a dependency timeout.
 */
public record StackReport(String stackName, boolean success, List<ServiceReport> services, Optional<String> error) {

    public StackReport {
        services = List.copyOf(services);
    }

    public List<ServiceReport> failures(boolean requireHealthy) {
        return services.stream().filter(report -> !report.isSuccess(requireHealthy)).toList();
    }
}
