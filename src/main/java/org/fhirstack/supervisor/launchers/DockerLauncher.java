package org.fhirstack.supervisor.launchers;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.Container;
import org.fhirstack.spec.LaunchDescriptor;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.spi.ILauncher;
import org.fhirstack.supervisor.spi.IServiceHandle;
import org.fhirstack.supervisor.spi.LaunchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Launches {@link LaunchDescriptor.Kind#IMAGE} services as Docker containers.
 * <p>
 * Containers are named {@code <stack>-<service>} and labelled with {@link #STACK_LABEL} and
 * {@link #SERVICE_LABEL} so that a later process can {@link #discover(ServiceSpec) find} them.
 * All containers of a stack join the network {@code <stack>_default}, where each is reachable
 * under its service name. Named volumes are scoped to the stack as {@code <stack>_<volume>};
 * relative host paths are resolved against the working directory.
 */
public class DockerLauncher implements ILauncher {

    public static final String STACK_LABEL = "fhirstack.stack";
    public static final String SERVICE_LABEL = "fhirstack.service";

    private static final Logger LOGGER = LoggerFactory.getLogger(DockerLauncher.class);

    private final String stackName;
    private final Supplier<DockerClient> clientFactory;
    private final ExecutorService waiters;
    private DockerContainerClient client;

    /**
     * @param stackName     prefix of container and volume names
     * @param clientFactory creates the Docker client on first use
     */
    public DockerLauncher(final String stackName, final Supplier<DockerClient> clientFactory) {
        this.stackName = stackName;
        this.clientFactory = clientFactory;
        final AtomicInteger counter = new AtomicInteger();
        this.waiters = Executors.newCachedThreadPool(runnable -> {
            final Thread thread = new Thread(runnable, "container-waiter-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    DockerLauncher(final String stackName, final DockerContainerClient client) {
        this(stackName, () -> {
            throw new IllegalStateException("client is preset");
        });
        this.client = client;
    }

    @Override
    public boolean supports(final ServiceSpec spec) {
        return spec.launch().kind() == LaunchDescriptor.Kind.IMAGE;
    }

    @Override
    public IServiceHandle launch(final ServiceSpec spec) throws LaunchException {
        final LaunchDescriptor launch = spec.launch();
        final DockerContainerClient docker = client();
        try {
            docker.ensureImage(launch.image());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LaunchException(spec.name(), "interrupted while pulling " + launch.image(), e);
        } catch (final DockerException | DockerDaemonUnavailableException e) {
            throw new LaunchException(spec.name(), "cannot pull image " + launch.image() + ": " + e.getMessage(), e);
        }

        try {
            removeLeftovers(spec, docker);
            final String containerId = docker.createContainer(new ContainerRequest(
                containerName(spec),
                launch.image(),
                launch.command(),
                spec.environment(),
                spec.ports(),
                resolveBinds(spec.volumes()),
                labels(spec)));
            try {
                final String networkId = docker.ensureNetwork(networkName(), Map.of(STACK_LABEL, stackName));
                docker.connectToNetwork(containerId, networkId, spec.name());
                docker.startContainer(containerId);
            } catch (final RuntimeException e) {
                docker.removeContainer(containerId);
                throw e;
            }
            LOGGER.debug("Started container {} for '{}' from {}",
                DockerContainerClient.shortId(containerId), spec.name(), launch.image());
            return new ContainerHandle(docker, containerId, waiters);
        } catch (final DockerException | DockerDaemonUnavailableException e) {
            throw new LaunchException(spec.name(), e.getMessage(), e);
        }
    }

    @Override
    public Optional<IServiceHandle> discover(final ServiceSpec spec) {
        if (!supports(spec)) {
            return Optional.empty();
        }
        final DockerContainerClient docker = client();
        return docker.findContainers(labels(spec), false).stream()
            .findFirst()
            .map(container -> new ContainerHandle(docker, container.getId(), waiters));
    }

    @Override
    public void close() {
        waiters.shutdownNow();
        final DockerContainerClient current;
        synchronized (this) {
            current = client;
            client = null;
        }
        if (current != null) {
            try {
                current.close();
            } catch (final IOException e) {
                LOGGER.warn("Failed to close Docker client: {}", e.getMessage());
            }
        }
    }

    String containerName(final ServiceSpec spec) {
        return stackName + "-" + spec.name();
    }

    /**
     * Containers of a stack share this network and reach each other by service name.
     */
    String networkName() {
        return stackName + "_default";
    }

    Map<String, String> labels(final ServiceSpec spec) {
        final Map<String, String> labels = new LinkedHashMap<>();
        labels.put(STACK_LABEL, stackName);
        labels.put(SERVICE_LABEL, spec.name());
        return labels;
    }

    List<String> resolveBinds(final List<String> volumes) {
        final List<String> binds = new ArrayList<>(volumes.size());
        for (final String volume : volumes) {
            final int colon = volume.indexOf(':');
            final String source = volume.substring(0, colon);
            final String rest = volume.substring(colon);
            if (source.startsWith("/")) {
                binds.add(volume);
            } else if (source.startsWith(".") || source.startsWith("~")) {
                final String expanded = source.startsWith("~")
                    ? System.getProperty("user.home") + source.substring(1)
                    : source;
                binds.add(Path.of(expanded).toAbsolutePath().normalize() + rest);
            } else {
                binds.add(stackName + "_" + source + rest);
            }
        }
        return binds;
    }

    private void removeLeftovers(final ServiceSpec spec, final DockerContainerClient docker) throws LaunchException {
        for (final Container container : docker.findContainers(labels(spec), true)) {
            if ("running".equalsIgnoreCase(container.getState())) {
                throw new LaunchException(spec.name(), "container " + DockerContainerClient.shortId(container.getId())
                    + " is already running; run 'down' first");
            }
            LOGGER.debug("Removing leftover container {} of '{}'",
                DockerContainerClient.shortId(container.getId()), spec.name());
            docker.removeContainer(container.getId());
        }
    }

    private synchronized DockerContainerClient client() {
        if (client == null) {
            client = new DockerContainerClient(clientFactory.get());
        }
        return client;
    }

    /**
     * Handle of a container. The exit code is obtained by a blocking wait on a waiter thread.
     */
    static final class ContainerHandle implements IServiceHandle {

        private final DockerContainerClient docker;
        private final String containerId;
        private final CompletableFuture<Integer> exit;

        ContainerHandle(final DockerContainerClient docker, final String containerId, final ExecutorService waiters) {
            this.docker = docker;
            this.containerId = containerId;
            this.exit = CompletableFuture.supplyAsync(() -> docker.waitForExit(containerId), waiters);
        }

        @Override
        public String id() {
            return "container " + DockerContainerClient.shortId(containerId);
        }

        @Override
        public boolean isAlive() {
            return !exit.isDone() && docker.isRunning(containerId);
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public void terminate() {
            docker.signal(containerId, "SIGTERM");
        }

        @Override
        public void kill() {
            docker.signal(containerId, "SIGKILL");
        }

        @Override
        public void release() {
            docker.removeContainer(containerId);
        }
    }
}
