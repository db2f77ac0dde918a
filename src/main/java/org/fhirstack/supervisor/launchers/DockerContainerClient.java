package org.fhirstack.supervisor.launchers;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Network;
import com.github.dockerjava.api.model.Ports;
import org.fhirstack.spec.PortMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around docker-java for the container operations the launcher needs. Failures
 * caused by an unreachable daemon are translated into {@link DockerDaemonUnavailableException}
 * with a hint; all other docker-java exceptions propagate unchanged.
 */
public class DockerContainerClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(DockerContainerClient.class);
    private static final String DOCKER_HINT =
        "Ensure Docker is installed, running, and that the process can access the Docker socket "
            + "(for example /var/run/docker.sock) or an explicit DOCKER_HOST.";

    private final DockerClient dockerClient;

    public DockerContainerClient(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    /**
     * Pulls the image unless it is already present locally.
     *
     * @throws InterruptedException if interrupted while pulling
     */
    public void ensureImage(String image) throws InterruptedException {
        try {
            callDocker("inspect image", () -> dockerClient.inspectImageCmd(image).exec());
            return;
        } catch (NotFoundException e) {
            LOGGER.info("Pulling image '{}'...", image);
        }
        PullImageCmd pull = dockerClient.pullImageCmd(image);
        if (!hasTagOrDigest(image)) {
            pull = pull.withTag("latest");
        }
        final PullImageCmd command = pull;
        PullImageResultCallback callback = callDocker("pull image", () -> command.exec(new PullImageResultCallback()));
        callback.awaitCompletion();
    }

    public String createContainer(ContainerRequest request) {
        return callDocker("create container", () -> {
            List<ExposedPort> exposed = new ArrayList<>();
            Ports bindings = new Ports();
            for (PortMapping port : request.ports()) {
                ExposedPort containerPort = "udp".equals(port.protocol())
                    ? ExposedPort.udp(port.containerPort())
                    : ExposedPort.tcp(port.containerPort());
                exposed.add(containerPort);
                bindings.bind(containerPort, Ports.Binding.bindPort(port.hostPort()));
            }
            List<Bind> binds = request.binds().stream().map(Bind::parse).toList();
            CreateContainerCmd create = dockerClient.createContainerCmd(request.image())
                .withName(request.name())
                .withEnv(toEnvArray(request.env()))
                .withLabels(request.labels())
                .withExposedPorts(exposed)
                .withHostConfig(HostConfig.newHostConfig()
                    .withPortBindings(bindings)
                    .withBinds(binds));
            if (!request.command().isEmpty()) {
                create = create.withCmd(request.command());
            }
            return create.exec().getId();
        });
    }

    /**
     * Creates a bridge network unless one with that name exists.
     *
     * @return the network id
     */
    public String ensureNetwork(String name, Map<String, String> labels) {
        return callDocker("create network", () -> {
            List<Network> existing = dockerClient.listNetworksCmd().withNameFilter(name).exec();
            for (Network network : existing) {
                if (name.equals(network.getName())) {
                    return network.getId();
                }
            }
            LOGGER.debug("Creating network '{}'", name);
            return dockerClient.createNetworkCmd()
                .withName(name)
                .withDriver("bridge")
                .withLabels(labels)
                .exec()
                .getId();
        });
    }

    /**
     * Connects a created container to a network under the given DNS alias.
     */
    public void connectToNetwork(String containerId, String networkId, String alias) {
        callDocker("connect container to network", () -> dockerClient.connectToNetworkCmd()
            .withContainerId(containerId)
            .withNetworkId(networkId)
            .withContainerNetwork(new ContainerNetwork().withAliases(alias))
            .exec());
    }

    public void startContainer(String containerId) {
        callDocker("start container", () -> dockerClient.startContainerCmd(containerId).exec());
    }

    /**
     * Blocks until the container exits.
     *
     * @return the container's exit code
     */
    public int waitForExit(String containerId) {
        Integer status = callDocker("wait for container",
            () -> dockerClient.waitContainerCmd(containerId).exec(new WaitContainerResultCallback()).awaitStatusCode());
        return status == null ? -1 : status;
    }

    /**
     * Sends a signal to a running container. A container that is no longer running is ignored.
     */
    public void signal(String containerId, String signal) {
        try {
            callDocker("signal container", () -> dockerClient.killContainerCmd(containerId).withSignal(signal).exec());
        } catch (ConflictException | NotFoundException e) {
            LOGGER.debug("Container {} is not running, {} not delivered", shortId(containerId), signal);
        }
    }

    public boolean isRunning(String containerId) {
        try {
            InspectContainerResponse inspect = callDocker("inspect container",
                () -> dockerClient.inspectContainerCmd(containerId).exec());
            return Boolean.TRUE.equals(inspect.getState().getRunning());
        } catch (NotFoundException e) {
            return false;
        }
    }

    public void removeContainer(String containerId) {
        try {
            callDocker("remove container", () -> dockerClient.removeContainerCmd(containerId).withForce(true).exec());
        } catch (NotFoundException e) {
            LOGGER.debug("Container {} already removed", shortId(containerId));
        }
    }

    /**
     * @param labels   labels that all must match
     * @param showAll  {@code true} to include stopped containers
     * @return matching containers
     */
    public List<Container> findContainers(Map<String, String> labels, boolean showAll) {
        return callDocker("list containers",
            () -> dockerClient.listContainersCmd().withShowAll(showAll).withLabelFilter(labels).exec());
    }

    public void close() throws IOException {
        dockerClient.close();
    }

    static String shortId(String containerId) {
        return containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }

    static boolean hasTagOrDigest(String image) {
        if (image.contains("@")) {
            return true;
        }
        int slash = image.lastIndexOf('/');
        return image.indexOf(':', slash + 1) >= 0;
    }

    private String[] toEnvArray(Map<String, String> env) {
        return env.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .toArray(String[]::new);
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private void callDocker(String action, Runnable runnable) {
        try {
            runnable.run();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof DockerDaemonUnavailableException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            return new DockerDaemonUnavailableException(
                "Unable to " + action + " because the Docker daemon is unavailable. " + DOCKER_HINT,
                e);
        }
        return e;
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT)
            .contains(needle.toLowerCase(Locale.ROOT));
    }
}
