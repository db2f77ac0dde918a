package org.fhirstack.orchestrator;

import java.util.List;

/**
 * Outcome of {@link Orchestrator#down()}. Stop failures are collected; they never abort a teardown.
 *
 * @param stopped  Services stopped, in shutdown order.
 * @param failures Services that could not be stopped cleanly.
 */
public record TeardownReport(List<String> stopped, List<StopFailure> failures) {

    public TeardownReport {
        stopped = List.copyOf(stopped);
        failures = List.copyOf(failures);
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public record StopFailure(String name, String message) {
    }
}
