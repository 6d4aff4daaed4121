package io.amp.kernel.optimizer;

import io.amp.kernel.error.PlanValidationException;
import io.amp.kernel.plan.DependencyGraph;
import io.amp.kernel.plan.Node;
import io.amp.kernel.plan.Plan;
import io.amp.kernel.tools.ToolSpec;
import io.amp.kernel.tools.ToolSpecCache;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups nodes into topological waves and, inside each wave, front-loads cheap and fast calls by
 * ascending estimated cost x latency. Only mutually independent nodes are ever reordered.
 */
public final class PlanOptimizer {
    private static final Logger log = LoggerFactory.getLogger(PlanOptimizer.class);

    private static final Comparator<NodeEstimate> CHEAPEST_FIRST = Comparator
        .comparingDouble(NodeEstimate::score)
        .thenComparingDouble(NodeEstimate::costUsd)
        .thenComparingLong(NodeEstimate::latencyMs);

    private PlanOptimizer() {}

    public static ExecutionOrder optimize(Plan plan, ToolSpecCache cache) {
        var graph = DependencyGraph.of(plan);
        var layers = graph.layers()
            .orElseThrow(() -> new PlanValidationException(List.of("Plan contains a dependency cycle")));
        var estimates = new LinkedHashMap<String, NodeEstimate>();
        for (var node : plan.nodes()) {
            estimates.put(node.id(), estimate(node, cache));
        }

        var waves = new ArrayList<List<String>>();
        var reorderings = new ArrayList<Reordering>();
        for (int w = 0; w < layers.size(); w++) {
            var before = layers.get(w);
            var sorted = new ArrayList<>(before);
            // stable: equal estimates keep declaration order
            sorted.sort(Comparator.comparing(estimates::get, CHEAPEST_FIRST));
            waves.add(sorted);
            if (!sorted.equals(before)) {
                reorderings.addAll(describe(w, before, sorted, estimates));
            }
        }
        log.debug("Optimized {} node(s) into {} wave(s) with {} reordering(s)", plan.nodes().size(), waves.size(), reorderings.size());
        return new ExecutionOrder(waves, reorderings, estimates);
    }

    public static NodeEstimate estimate(Node node, ToolSpecCache cache) {
        ToolSpec spec = null;
        if (node.hasTool()) {
            spec = cache.get(node.tool()).map(tool -> tool.spec()).orElse(null);
        } else if (node.hasCapability()) {
            spec = cache.withCapability(node.capability()).stream()
                .map(tool -> tool.spec())
                .min(Comparator.comparingDouble(ToolSpec::estimatedCostUsd).thenComparingLong(ToolSpec::estimatedLatencyMs))
                .orElse(null);
        }
        if (spec == null) {
            return new NodeEstimate(node.id(), 0.0, 0L);
        }
        return new NodeEstimate(node.id(), spec.estimatedCostUsd(), spec.estimatedLatencyMs());
    }

    private static List<Reordering> describe(int wave, List<String> before, List<String> after, Map<String, NodeEstimate> estimates) {
        var result = new ArrayList<Reordering>();
        for (int to = 0; to < after.size(); to++) {
            var nodeId = after.get(to);
            int from = before.indexOf(nodeId);
            if (from <= to) {
                continue;
            }
            var overtook = before.get(to);
            var moved = estimates.get(nodeId);
            var displaced = estimates.get(overtook);
            result.add(new Reordering(wave, nodeId, from, to, overtook,
                moved.costUsd() - displaced.costUsd(),
                moved.latencyMs() - displaced.latencyMs(),
                before, after));
        }
        return result;
    }
}
