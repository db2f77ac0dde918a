package org.fhirstack.health;

/**
 * Receives health status changes from the {@link HealthMonitor}. Called from probe threads;
 * implementations must not block.
 */
public interface IHealthListener {

    void onHealthChanged(HealthTransition transition);
}
