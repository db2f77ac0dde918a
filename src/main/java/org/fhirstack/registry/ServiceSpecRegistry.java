package org.fhirstack.registry;

import org.fhirstack.spec.ServiceSpec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the declared services of a stack and guarantees that they form a valid topology:
 * unique names, resolvable dependencies and an acyclic dependency relation.
 * <p>
 * Iteration order is registration order, which keeps diagnostics and the scheduler's
 * tie-breaking deterministic. All checks fail fast; a failed registration leaves the
 * registry unchanged.
 */
public final class ServiceSpecRegistry {

    private final Map<String, ServiceSpec> specs = new LinkedHashMap<>();

    /**
     * Registers a single service. Its dependencies must already be registered.
     *
     * @param spec the service to add
     * @throws DuplicateServiceException if a service with the same name exists
     * @throws InvalidSpecException      if a dependency is not registered
     */
    public synchronized void register(final ServiceSpec spec) {
        if (specs.containsKey(spec.name())) {
            throw new DuplicateServiceException(spec.name());
        }
        for (final String dependency : spec.dependsOn()) {
            if (!specs.containsKey(dependency)) {
                throw new InvalidSpecException(spec.name(), "depends on '" + dependency + "' which is not registered");
            }
        }
        specs.put(spec.name(), spec);
    }

    /**
     * Registers a batch of services as a unit. Dependencies may refer to any service that is
     * already registered or part of the batch, so the batch does not need to be in dependency
     * order. Nothing is registered if any check fails.
     *
     * @param batch services in the order they should be listed
     * @throws DuplicateServiceException if a name is taken or occurs twice in the batch
     * @throws InvalidSpecException      if a dependency cannot be resolved
     * @throws CyclicDependencyException if the combined dependency relation contains a cycle
     */
    public synchronized void registerAll(final Collection<ServiceSpec> batch) {
        final Map<String, ServiceSpec> merged = new LinkedHashMap<>(specs);
        for (final ServiceSpec spec : batch) {
            if (merged.putIfAbsent(spec.name(), spec) != null) {
                throw new DuplicateServiceException(spec.name());
            }
        }
        for (final ServiceSpec spec : batch) {
            for (final String dependency : spec.dependsOn()) {
                if (!merged.containsKey(dependency)) {
                    throw new InvalidSpecException(spec.name(), "depends on '" + dependency + "' which is not declared");
                }
            }
        }
        findCycle(merged).ifPresent(cycle -> {
            throw new CyclicDependencyException(cycle);
        });
        specs.clear();
        specs.putAll(merged);
    }

    /**
     * @return all services in registration order
     */
    public synchronized List<ServiceSpec> all() {
        return List.copyOf(specs.values());
    }

    public synchronized Optional<ServiceSpec> get(final String name) {
        return Optional.ofNullable(specs.get(name));
    }

    public synchronized boolean contains(final String name) {
        return specs.containsKey(name);
    }

    public synchronized int size() {
        return specs.size();
    }

    /**
     * Runs a depth-first search over the dependency relation.
     *
     * @throws CyclicDependencyException naming the first cycle found
     */
    public synchronized void validateAcyclic() {
        findCycle(specs).ifPresent(cycle -> {
            throw new CyclicDependencyException(cycle);
        });
    }

    private static Optional<List<String>> findCycle(final Map<String, ServiceSpec> graph) {
        final Map<String, Mark> marks = new HashMap<>();
        for (final String name : graph.keySet()) {
            if (!marks.containsKey(name)) {
                final List<String> cycle = visit(name, graph, marks, new LinkedHashSet<>());
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> visit(final String name, final Map<String, ServiceSpec> graph,
                                      final Map<String, Mark> marks, final LinkedHashSet<String> path) {
        marks.put(name, Mark.IN_PROGRESS);
        path.add(name);
        final ServiceSpec spec = graph.get(name);
        if (spec != null) {
            for (final String dependency : spec.dependsOn()) {
                final Mark mark = marks.get(dependency);
                if (mark == Mark.IN_PROGRESS) {
                    return cycleFrom(dependency, path);
                }
                if (mark == null) {
                    final List<String> cycle = visit(dependency, graph, marks, path);
                    if (cycle != null) {
                        return cycle;
                    }
                }
            }
        }
        path.remove(name);
        marks.put(name, Mark.DONE);
        return null;
    }

    private static List<String> cycleFrom(final String start, final Set<String> path) {
        final List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (final String node : path) {
            if (node.equals(start)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(node);
            }
        }
        cycle.add(start);
        return cycle;
    }

    private enum Mark { IN_PROGRESS, DONE }
}
