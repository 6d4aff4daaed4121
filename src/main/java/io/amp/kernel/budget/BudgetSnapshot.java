package io.amp.kernel.budget;

import java.util.LinkedHashMap;
import java.util.Map;

public record BudgetSnapshot(Usage totals, Double costCapUsd, Long latencyBudgetMs, int invocations) {
    public Double costHeadroomUsd() {
        return costCapUsd == null ? null : costCapUsd - totals.costUsd();
    }

    public Long latencyHeadroomMs() {
        return latencyBudgetMs == null ? null : latencyBudgetMs - totals.latencyMs();
    }

    public Map<String, Object> toData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("cost_usd", totals.costUsd());
        data.put("latency_ms", totals.latencyMs());
        data.put("tokens_in", totals.tokensIn());
        data.put("tokens_out", totals.tokensOut());
        data.put("invocations", invocations);
        var caps = new LinkedHashMap<String, Object>();
        caps.put("cost_cap_usd", costCapUsd);
        caps.put("latency_budget_ms", latencyBudgetMs);
        data.put("caps", caps);
        var headroom = new LinkedHashMap<String, Object>();
        headroom.put("cost_usd", costHeadroomUsd());
        headroom.put("latency_ms", latencyHeadroomMs());
        data.put("headroom", headroom);
        return data;
    }
}
