package org.fhirstack.health.probes;

import org.fhirstack.health.IHealthProbe;
import org.fhirstack.spec.HealthProbeSpec;

import java.net.URI;
import java.net.http.HttpClient;

/**
 * Creates probe implementations for {@link HealthProbeSpec}s. HTTP probes share one client.
 */
public class HealthProbeFactory {

    private final HttpClient httpClient;

    public HealthProbeFactory() {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .build());
    }

    public HealthProbeFactory(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public IHealthProbe create(HealthProbeSpec spec) {
        return switch (spec.type()) {
            case HTTP -> new HttpHealthProbe(httpClient, URI.create(spec.target()), spec.timeout());
            case TCP -> TcpHealthProbe.forTarget(spec.target(), spec.timeout());
            case PROCESS -> new ProcessAliveProbe();
        };
    }
}
