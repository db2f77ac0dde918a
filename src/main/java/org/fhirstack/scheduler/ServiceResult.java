package org.fhirstack.scheduler;

/**
 * Outcome of a single service in a startup run.
 *
 * @param name    Service name.
 * @param outcome What happened.
 * @param message Human readable detail, e.g. the launch error or the blocking dependency.
 */
public record ServiceResult(String name, ServiceOutcome outcome, String message) {

    public boolean isStarted() {
        return outcome == ServiceOutcome.STARTED;
    }
}
