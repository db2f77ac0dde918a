package org.fhirstack.supervisor;

import java.time.Duration;
import java.time.Instant;

/**
 * A restart scheduled by the supervisor after a crash.
 *
 * @param attempt     Zero-based attempt number for the instance.
 * @param delay       Backoff applied before relaunching.
 * @param scheduledAt When the restart was scheduled.
 * @param reason      Why the instance crashed, e.g. {@code "exit code 1"}.
 */
public record RestartAttempt(int attempt, Duration delay, Instant scheduledAt, String reason) {
}
