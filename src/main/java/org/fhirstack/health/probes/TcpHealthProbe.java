package org.fhirstack.health.probes;

import org.fhirstack.health.IHealthProbe;
import org.fhirstack.health.ProbeResult;
import org.fhirstack.supervisor.ServiceInstance;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * Succeeds if a TCP connection to the target can be opened.
 */
public class TcpHealthProbe implements IHealthProbe {

    private final String host;
    private final int port;
    private final Duration timeout;

    public TcpHealthProbe(String host, int port, Duration timeout) {
        this.host = host;
        this.port = port;
        this.timeout = timeout;
    }

    /**
     * @param hostAndPort target in {@code host:port} notation
     */
    public static TcpHealthProbe forTarget(String hostAndPort, Duration timeout) {
        int colon = hostAndPort.lastIndexOf(':');
        return new TcpHealthProbe(hostAndPort.substring(0, colon),
            Integer.parseInt(hostAndPort.substring(colon + 1)), timeout);
    }

    @Override
    public ProbeResult check(ServiceInstance instance) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return ProbeResult.success("connected to " + host + ":" + port);
        } catch (SocketTimeoutException e) {
            return ProbeResult.failure("connect to " + host + ":" + port + " timed out");
        } catch (IOException e) {
            return ProbeResult.failure("connect to " + host + ":" + port + " failed: " + e.getMessage());
        }
    }
}
