package org.fhirstack.orchestrator;

import org.fhirstack.health.HealthStatus;
import org.fhirstack.scheduler.ServiceOutcome;

/**
 * Result of {@code up} for one service.
 *
 * @param name    Service name.
 * @param outcome Startup outcome.
 * @param health  Health at the end of the run.
 * @param message Detail, e.g. the blocking dependency or launch error.
 */
public record ServiceReport(String name, ServiceOutcome outcome, HealthStatus health, String message) {

    /**
     * @param requireHealthy whether an unhealthy or unknown health counts as failure
     */
    public boolean isSuccess(boolean requireHealthy) {
        return outcome == ServiceOutcome.STARTED && (!requireHealthy || health == HealthStatus.HEALTHY);
    }
}
