package org.fhirstack.supervisor;

/**
 * Receives lifecycle transitions from the {@link ProcessSupervisor}.
 * <p>
 * Events are delivered on a single dispatcher thread in the order the transitions happened.
 * Listeners must not block.
 */
public interface IInstanceListener {

    void onStateChanged(InstanceStateChangedEvent event);
}
