package org.fhirstack.health;

/**
 * Rolling readiness verdict of a running instance.
 */
public enum HealthStatus {
    UNKNOWN,
    HEALTHY,
    UNHEALTHY
}
