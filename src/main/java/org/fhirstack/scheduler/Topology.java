package org.fhirstack.scheduler;

import org.fhirstack.registry.CyclicDependencyException;
import org.fhirstack.registry.InvalidSpecException;
import org.fhirstack.registry.ServiceSpecRegistry;
import org.fhirstack.spec.ServiceSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Immutable, dependency-ordered snapshot of the services of one run.
 */
public final class Topology {

    private final List<ServiceSpec> startupOrder;
    private final Map<String, ServiceSpec> byName;

    private Topology(List<ServiceSpec> startupOrder) {
        this.startupOrder = List.copyOf(startupOrder);
        Map<String, ServiceSpec> index = new LinkedHashMap<>();
        startupOrder.forEach(spec -> index.put(spec.name(), spec));
        this.byName = Collections.unmodifiableMap(index);
    }

    public static Topology of(ServiceSpecRegistry registry) {
        return of(registry.all());
    }

    /**
     * Orders services with Kahn's algorithm. Among services whose dependencies are all placed,
     * the one declared first comes first.
     *
     * @param specs services in declaration order
     * @throws InvalidSpecException      if a dependency is not among {@code specs}
     * @throws CyclicDependencyException if the services cannot be ordered
     */
    public static Topology of(List<ServiceSpec> specs) {
        Map<String, Integer> declarationIndex = new HashMap<>();
        Map<String, ServiceSpec> byName = new HashMap<>();
        Map<String, Set<String>> dependents = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();

        for (ServiceSpec spec : specs) {
            declarationIndex.put(spec.name(), declarationIndex.size());
            byName.put(spec.name(), spec);
            dependents.put(spec.name(), new LinkedHashSet<>());
            inDegree.put(spec.name(), 0);
        }
        for (ServiceSpec spec : specs) {
            for (String dependency : spec.dependsOn()) {
                if (!byName.containsKey(dependency)) {
                    throw new InvalidSpecException(spec.name(), "depends on '" + dependency + "' which is not declared");
                }
                dependents.get(dependency).add(spec.name());
                inDegree.merge(spec.name(), 1, Integer::sum);
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparing(declarationIndex::get));
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });

        List<ServiceSpec> order = new ArrayList<>(specs.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(byName.get(current));
            for (String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != specs.size()) {
            // the registry reports the cycle as a path
            new ServiceSpecRegistry().registerAll(specs);
            List<String> remaining = specs.stream()
                .map(ServiceSpec::name)
                .filter(name -> inDegree.get(name) > 0)
                .toList();
            throw new CyclicDependencyException(remaining);
        }
        return new Topology(order);
    }

    /**
     * @return services with every service after all of its dependencies
     */
    public List<ServiceSpec> startupOrder() {
        return startupOrder;
    }

    /**
     * @return the reverse of {@link #startupOrder()}
     */
    public List<ServiceSpec> shutdownOrder() {
        List<ServiceSpec> reversed = new ArrayList<>(startupOrder);
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    public Optional<ServiceSpec> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public List<String> names() {
        return List.copyOf(byName.keySet());
    }

    public int size() {
        return startupOrder.size();
    }
}
