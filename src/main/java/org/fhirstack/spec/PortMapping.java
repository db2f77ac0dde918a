package org.fhirstack.spec;

import java.util.Locale;

/**
 * A port published from a service to the host, written {@code host:container[/protocol]}
 * in configuration, e.g. {@code 5560:80} or {@code 17017:27017/tcp}.
 */
public record PortMapping(int hostPort, int containerPort, String protocol) {

    public PortMapping {
        checkPort(hostPort);
        checkPort(containerPort);
        protocol = protocol == null ? "tcp" : protocol.toLowerCase(Locale.ROOT);
        if (!protocol.equals("tcp") && !protocol.equals("udp")) {
            throw new IllegalArgumentException("Unsupported protocol '" + protocol + "'");
        }
    }

    public PortMapping(int hostPort, int containerPort) {
        this(hostPort, containerPort, "tcp");
    }

    /**
     * Parses the compose-style notation.
     *
     * @param value e.g. {@code "5560:80"}
     * @return the parsed mapping
     * @throws IllegalArgumentException if the notation is malformed
     */
    public static PortMapping parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Port mapping must not be empty");
        }
        String spec = value.trim();
        String protocol = "tcp";
        int slash = spec.indexOf('/');
        if (slash >= 0) {
            protocol = spec.substring(slash + 1);
            spec = spec.substring(0, slash);
        }
        String[] parts = spec.split(":");
        try {
            if (parts.length == 1) {
                int port = Integer.parseInt(parts[0]);
                return new PortMapping(port, port, protocol);
            }
            if (parts.length == 2) {
                return new PortMapping(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), protocol);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port mapping '" + value + "'", e);
        }
        throw new IllegalArgumentException("Invalid port mapping '" + value + "', expected host:container");
    }

    private static void checkPort(int port) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
    }

    @Override
    public String toString() {
        return hostPort + ":" + containerPort + "/" + protocol;
    }
}
