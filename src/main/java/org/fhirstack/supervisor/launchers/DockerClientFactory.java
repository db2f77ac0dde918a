package org.fhirstack.supervisor.launchers;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;

import java.time.Duration;

/**
 * Builds docker-java clients. Without an explicit host the standard resolution applies
 * ({@code DOCKER_HOST}, then the local socket).
 */
public final class DockerClientFactory {

    private DockerClientFactory() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param dockerHost e.g. {@code unix:///var/run/docker.sock} or {@code tcp://host:2375};
     *                   {@code null} or blank for the default
     */
    public static DockerClient create(final String dockerHost) {
        final DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (dockerHost != null && !dockerHost.isBlank()) {
            builder.withDockerHost(dockerHost);
        }
        final DefaultDockerClientConfig config = builder.build();
        final DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
            .dockerHost(config.getDockerHost())
            .sslConfig(config.getSSLConfig())
            .connectionTimeout(Duration.ofSeconds(10))
            .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }
}
