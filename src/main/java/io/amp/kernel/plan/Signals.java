package io.amp.kernel.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Signals(
    @JsonProperty("latency_budget_ms") Long latencyBudgetMs,
    @JsonProperty("cost_cap_usd") Double costCapUsd,
    @JsonProperty("risk") Double risk
) {
    public static final Signals NONE = new Signals(null, null, null);
}
