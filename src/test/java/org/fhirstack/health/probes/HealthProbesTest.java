package org.fhirstack.health.probes;

import com.sun.net.httpserver.HttpServer;
import org.fhirstack.health.IHealthProbe;
import org.fhirstack.health.ProbeResult;
import org.fhirstack.spec.HealthProbeSpec;
import org.fhirstack.supervisor.ServiceInstance;
import org.fhirstack.testsupport.FakeServiceHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class HealthProbesTest {

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/fhir/metadata", exchange -> {
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private URI metadataUri() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/fhir/metadata");
    }

    private HttpHealthProbe httpProbe() {
        return new HttpHealthProbe(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build(),
            metadataUri(), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("HTTP probe succeeds on 2xx and 3xx")
    void http_successOn2xxAnd3xx() {
        assertThat(httpProbe().check(null).success()).isTrue();

        status.set(302);
        ProbeResult redirect = httpProbe().check(null);
        assertThat(redirect.success()).isTrue();
        assertThat(redirect.message()).isEqualTo("HTTP 302");
    }

    @Test
    @DisplayName("HTTP probe fails on 5xx and names the status")
    void http_failsOnServerError() {
        status.set(503);

        ProbeResult result = httpProbe().check(null);

        assertThat(result.success()).isFalse();
        assertThat(result.message()).startsWith("HTTP 503");
    }

    @Test
    @DisplayName("HTTP probe fails when nothing listens")
    void http_failsWhenRefused() {
        URI target = metadataUri();
        server.stop(0);

        ProbeResult result = new HttpHealthProbe(HttpClient.newHttpClient(), target, Duration.ofSeconds(2)).check(null);

        assertThat(result.success()).isFalse();
    }

    @Test
    @DisplayName("TCP probe succeeds while a port accepts and fails once it is closed")
    void tcp_connects() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
            ProbeResult open = TcpHealthProbe.forTarget("127.0.0.1:" + port, Duration.ofSeconds(1)).check(null);
            assertThat(open.success()).isTrue();
            assertThat(open.message()).isEqualTo("connected to 127.0.0.1:" + port);
        }

        ProbeResult closed = new TcpHealthProbe("127.0.0.1", port, Duration.ofSeconds(1)).check(null);

        assertThat(closed.success()).isFalse();
        assertThat(closed.message()).contains("127.0.0.1:" + port);
    }

    @Test
    @DisplayName("Process probe follows the handle's liveness")
    void process_followsHandle() {
        FakeServiceHandle handle = new FakeServiceHandle("pid 42");
        ServiceInstance instance = mock(ServiceInstance.class);
        when(instance.getHandle()).thenReturn(handle);
        ProcessAliveProbe probe = new ProcessAliveProbe();

        assertThat(probe.check(instance).success()).isTrue();
        handle.exit(0);
        assertThat(probe.check(instance)).isEqualTo(ProbeResult.failure("pid 42 is not alive"));
    }

    @Test
    @DisplayName("The factory picks the implementation by probe type")
    void factory_createsByType() {
        HealthProbeFactory factory = new HealthProbeFactory();

        IHealthProbe http = factory.create(HealthProbeSpec.http("http://localhost:5560/fhir/metadata"));
        IHealthProbe tcp = factory.create(HealthProbeSpec.tcp("localhost:17017"));
        IHealthProbe process = factory.create(HealthProbeSpec.process());

        assertThat(http).isInstanceOf(HttpHealthProbe.class);
        assertThat(tcp).isInstanceOf(TcpHealthProbe.class);
        assertThat(process).isInstanceOf(ProcessAliveProbe.class);
    }
}
