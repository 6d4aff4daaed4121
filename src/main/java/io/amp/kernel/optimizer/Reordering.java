package io.amp.kernel.optimizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Reordering(
    int wave,
    String nodeId,
    int fromIndex,
    int toIndex,
    String overtook,
    double deltaCostUsd,
    long deltaLatencyMs,
    List<String> before,
    List<String> after
) {
    public Reordering {
        before = List.copyOf(before);
        after = List.copyOf(after);
    }

    public Map<String, Object> toData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("wave", wave);
        data.put("node", nodeId);
        data.put("from_index", fromIndex);
        data.put("to_index", toIndex);
        data.put("overtook", overtook);
        data.put("estimated_cost_delta_usd", deltaCostUsd);
        data.put("estimated_latency_delta_ms", deltaLatencyMs);
        data.put("before", before);
        data.put("after", after);
        return data;
    }
}
