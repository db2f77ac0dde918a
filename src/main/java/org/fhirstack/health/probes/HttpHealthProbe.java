package org.fhirstack.health.probes;

import org.fhirstack.health.IHealthProbe;
import org.fhirstack.health.ProbeResult;
import org.fhirstack.supervisor.ServiceInstance;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Issues a GET request; any 2xx or 3xx status is a success.
 */
public class HttpHealthProbe implements IHealthProbe {

    private final HttpClient client;
    private final URI target;
    private final Duration timeout;

    public HttpHealthProbe(HttpClient client, URI target, Duration timeout) {
        this.client = client;
        this.target = target;
        this.timeout = timeout;
    }

    @Override
    public ProbeResult check(ServiceInstance instance) {
        HttpRequest request = HttpRequest.newBuilder(target)
            .timeout(timeout)
            .GET()
            .build();
        try {
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            if (status >= 200 && status < 400) {
                return ProbeResult.success("HTTP " + status);
            }
            return ProbeResult.failure("HTTP " + status + " from " + target);
        } catch (HttpTimeoutException e) {
            return ProbeResult.failure("no answer from " + target + " within " + timeout.toMillis() + " ms");
        } catch (IOException e) {
            return ProbeResult.failure("GET " + target + " failed: " + describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failure("interrupted");
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
