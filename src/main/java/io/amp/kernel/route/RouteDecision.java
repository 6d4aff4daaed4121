package io.amp.kernel.route;

import io.amp.kernel.tools.RegisteredTool;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RouteDecision(String capability, RegisteredTool selected, List<Rejection> rejected) {
    public RouteDecision {
        rejected = List.copyOf(rejected);
    }

    public record Rejection(String tool, String reason, double costPerCallUsd, long latencyP50Ms) {}

    public Map<String, Object> toData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("capability", capability);
        data.put("selected", selected.name());
        data.put("selected_cost_per_call_usd", selected.spec().estimatedCostUsd());
        data.put("selected_latency_p50_ms", selected.spec().estimatedLatencyMs());
        var alternatives = new ArrayList<Map<String, Object>>();
        for (var rejection : rejected) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("tool", rejection.tool());
            entry.put("reason", rejection.reason());
            entry.put("cost_per_call_usd", rejection.costPerCallUsd());
            entry.put("latency_p50_ms", rejection.latencyP50Ms());
            alternatives.add(entry);
        }
        data.put("rejected", alternatives);
        return data;
    }
}
