package org.fhirstack.supervisor.launchers;

import org.fhirstack.spec.PortMapping;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything needed to create one container.
 *
 * @param name    Container name.
 * @param image   Image reference.
 * @param command Command override, empty to use the image default.
 * @param env     Environment variables.
 * @param ports   Published ports.
 * @param binds   Volume binds in {@code source:target[:mode]} notation.
 * @param labels  Labels used to find the container again.
 */
public record ContainerRequest(
    String name,
    String image,
    List<String> command,
    Map<String, String> env,
    Set<PortMapping> ports,
    List<String> binds,
    Map<String, String> labels
) {
}
