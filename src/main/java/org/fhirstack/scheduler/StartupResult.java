package org.fhirstack.scheduler;

import java.util.List;
import java.util.Optional;

/**
 * Per-service outcomes of a startup run, in startup order.
 */
public record StartupResult(List<ServiceResult> services) {

    public StartupResult {
        services = List.copyOf(services);
    }

    public boolean isSuccess() {
        return services.stream().allMatch(ServiceResult::isStarted);
    }

    public Optional<ServiceResult> result(String name) {
        return services.stream().filter(result -> result.name().equals(name)).findFirst();
    }

    public List<ServiceResult> failures() {
        return services.stream().filter(result -> !result.isStarted()).toList();
    }
}
