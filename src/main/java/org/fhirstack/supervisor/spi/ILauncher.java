package org.fhirstack.supervisor.spi;

import org.fhirstack.spec.ServiceSpec;

import java.util.Optional;

/**
 * Back end that turns a {@link ServiceSpec} into a running process or container.
 */
public interface ILauncher extends AutoCloseable {

    /**
     * @return {@code true} if this launcher can handle the spec's launch descriptor
     */
    boolean supports(ServiceSpec spec);

    /**
     * Launches the service and returns as soon as the OS reports it alive.
     *
     * @throws LaunchException if the service cannot be started
     */
    IServiceHandle launch(ServiceSpec spec) throws LaunchException;

    /**
     * Looks for an instance of the service that is already running, e.g. a container started by
     * an earlier {@code up --detach}. Launchers whose handles cannot outlive the orchestrator
     * return {@link Optional#empty()}.
     */
    default Optional<IServiceHandle> discover(ServiceSpec spec) {
        return Optional.empty();
    }

    /**
     * Releases clients and threads held by the launcher. Launched services are not affected.
     */
    @Override
    default void close() {
    }
}
