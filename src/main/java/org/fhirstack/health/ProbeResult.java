package org.fhirstack.health;

/**
 * Outcome of a single probe execution.
 */
public record ProbeResult(boolean success, String message) {

    public static ProbeResult success(String message) {
        return new ProbeResult(true, message);
    }

    public static ProbeResult failure(String message) {
        return new ProbeResult(false, message);
    }
}
