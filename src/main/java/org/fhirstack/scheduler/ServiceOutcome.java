package org.fhirstack.scheduler;

/**
 * What happened to a service during one startup run.
 */
public enum ServiceOutcome {
    /** Launched after all dependencies were healthy. */
    STARTED,
    /** The launcher gave up on the service. */
    FAILED,
    /** Not started because a dependency did not start or turned unhealthy. */
    SKIPPED,
    /** Its dependencies did not become healthy within the dependency timeout. */
    TIMED_OUT,
    /** Not started, or rolled back, because the run was cancelled or timed out elsewhere. */
    ABORTED
}
