package io.amp.kernel.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolSpec(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("io") Map<String, Object> io,
    @JsonProperty("capabilities") List<String> capabilities,
    @JsonProperty("constraints") Constraints constraints,
    @JsonProperty("provenance") Provenance provenance,
    @JsonProperty("policy") Policy policy
) {
    public ToolSpec {
        io = io == null ? Map.of() : Map.copyOf(io);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        constraints = constraints == null ? Constraints.NONE : constraints;
        provenance = provenance == null ? new Provenance(false) : provenance;
        policy = policy == null ? new Policy(List.of()) : policy;
    }

    public boolean advertises(String capability) {
        return capability != null && capabilities.contains(capability);
    }

    @JsonIgnore
    public boolean attributionRequired() {
        return Boolean.TRUE.equals(provenance.attributionRequired());
    }

    @JsonIgnore
    public double estimatedCostUsd() {
        return constraints.costPerCallUsd() == null ? 0.0 : constraints.costPerCallUsd();
    }

    @JsonIgnore
    public long estimatedLatencyMs() {
        return constraints.latencyP50Ms() == null ? 0L : constraints.latencyP50Ms();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Constraints(
        @JsonProperty("latency_p50_ms") Long latencyP50Ms,
        @JsonProperty("cost_per_call_usd") Double costPerCallUsd,
        @JsonProperty("input_tokens_max") Long inputTokensMax,
        @JsonProperty("rate_limit_qps") Integer rateLimitQps,
        @JsonProperty("side_effects") Boolean sideEffects,
        @JsonProperty("timeout_ms") Long timeoutMs
    ) {
        public static final Constraints NONE = new Constraints(null, null, null, null, null, null);

        public static Constraints of(double costPerCallUsd, long latencyP50Ms) {
            return new Constraints(latencyP50Ms, costPerCallUsd, null, null, null, null);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Provenance(@JsonProperty("attribution_required") Boolean attributionRequired) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Policy(@JsonProperty("deny_if") List<String> denyIf) {
        public Policy {
            denyIf = denyIf == null ? List.of() : List.copyOf(denyIf);
        }
    }
}
