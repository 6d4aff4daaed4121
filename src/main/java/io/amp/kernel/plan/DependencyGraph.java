package io.amp.kernel.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * True data dependencies of a plan: explicit edges plus references to another node's output
 * (by node id or by one of its {@code out} names) found in {@code args} and {@code bind}.
 */
public final class DependencyGraph {
    private final Map<String, Set<String>> predecessors;

    private DependencyGraph(Map<String, Set<String>> predecessors) {
        this.predecessors = predecessors;
    }

    public static DependencyGraph of(Plan plan) {
        var producers = producers(plan);
        var predecessors = new LinkedHashMap<String, Set<String>>();
        for (var node : plan.nodes()) {
            predecessors.put(node.id(), new LinkedHashSet<>());
        }
        for (var edge : plan.edges()) {
            if (predecessors.containsKey(edge.to()) && predecessors.containsKey(edge.from())) {
                predecessors.get(edge.to()).add(edge.from());
            }
        }
        for (var node : plan.nodes()) {
            var deps = predecessors.get(node.id());
            for (var reference : references(node)) {
                var producer = producers.get(reference.root());
                if (producer != null && !producer.equals(node.id())) {
                    deps.add(producer);
                }
            }
        }
        return new DependencyGraph(predecessors);
    }

    static Map<String, String> producers(Plan plan) {
        var producers = new LinkedHashMap<String, String>();
        for (var node : plan.nodes()) {
            producers.putIfAbsent(node.id(), node.id());
        }
        for (var node : plan.nodes()) {
            for (var alias : node.out().keySet()) {
                producers.putIfAbsent(alias, node.id());
            }
        }
        return producers;
    }

    static List<Reference> references(Node node) {
        var refs = new ArrayList<Reference>();
        refs.addAll(Reference.collect(node.args()));
        refs.addAll(Reference.collect(node.bind()));
        return refs;
    }

    public Set<String> predecessors(String nodeId) {
        return Collections.unmodifiableSet(predecessors.getOrDefault(nodeId, Set.of()));
    }

    /**
     * Kahn layering: each wave holds the nodes whose predecessors all sit in earlier waves,
     * in plan declaration order. Returns empty when the graph has a cycle.
     */
    public Optional<List<List<String>>> layers() {
        var remaining = new LinkedHashMap<String, Set<String>>();
        predecessors.forEach((id, deps) -> remaining.put(id, new LinkedHashSet<>(deps)));
        var waves = new ArrayList<List<String>>();
        var placed = new LinkedHashSet<String>();
        while (!remaining.isEmpty()) {
            var wave = new ArrayList<String>();
            for (var entry : remaining.entrySet()) {
                if (placed.containsAll(entry.getValue())) {
                    wave.add(entry.getKey());
                }
            }
            if (wave.isEmpty()) {
                return Optional.empty();
            }
            wave.forEach(remaining::remove);
            placed.addAll(wave);
            waves.add(List.copyOf(wave));
        }
        return Optional.of(waves);
    }
}
