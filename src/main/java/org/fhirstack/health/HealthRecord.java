package org.fhirstack.health;

import java.time.Instant;

/**
 * Immutable snapshot of an instance's health, maintained by the {@link HealthMonitor}.
 *
 * @param status               Current verdict.
 * @param consecutiveSuccesses Successful probes since the last failure.
 * @param consecutiveFailures  Counted failed probes since the last success.
 * @param lastChecked          Time of the last probe, or {@code null} if none ran yet.
 * @param lastMessage          Outcome description of the last probe.
 */
public record HealthRecord(
    HealthStatus status,
    int consecutiveSuccesses,
    int consecutiveFailures,
    Instant lastChecked,
    String lastMessage
) {

    private static final HealthRecord UNKNOWN = new HealthRecord(HealthStatus.UNKNOWN, 0, 0, null, "not checked yet");

    public static HealthRecord unknown() {
        return UNKNOWN;
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
