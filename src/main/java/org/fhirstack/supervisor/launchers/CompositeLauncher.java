package org.fhirstack.supervisor.launchers;

import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.spi.ILauncher;
import org.fhirstack.supervisor.spi.IServiceHandle;
import org.fhirstack.supervisor.spi.LaunchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Routes each service to the first delegate that {@link ILauncher#supports(ServiceSpec) supports} it.
 */
public class CompositeLauncher implements ILauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompositeLauncher.class);

    private final List<ILauncher> delegates;

    public CompositeLauncher(final List<ILauncher> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean supports(final ServiceSpec spec) {
        return delegateFor(spec).isPresent();
    }

    @Override
    public IServiceHandle launch(final ServiceSpec spec) throws LaunchException {
        final ILauncher delegate = delegateFor(spec).orElseThrow(() ->
            new LaunchException(spec.name(), "no launcher available for " + spec.launch().kind() + " services"));
        return delegate.launch(spec);
    }

    @Override
    public Optional<IServiceHandle> discover(final ServiceSpec spec) {
        return delegateFor(spec).flatMap(delegate -> delegate.discover(spec));
    }

    @Override
    public void close() {
        for (final ILauncher delegate : delegates) {
            try {
                delegate.close();
            } catch (final Exception e) {
                LOGGER.warn("Failed to close {}: {}", delegate.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private Optional<ILauncher> delegateFor(final ServiceSpec spec) {
        return delegates.stream().filter(delegate -> delegate.supports(spec)).findFirst();
    }
}
