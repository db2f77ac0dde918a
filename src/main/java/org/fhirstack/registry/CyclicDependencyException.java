package org.fhirstack.registry;

import java.util.List;

/**
 * Thrown when the dependency relation between services contains a cycle.
 * The cycle is reported as a path that starts and ends with the same service,
 * e.g. {@code [a, b, a]}.
 */
public class CyclicDependencyException extends StackException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
