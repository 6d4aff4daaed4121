package io.amp.kernel.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StopConditions(
    @JsonProperty("max_nodes") Integer maxNodes,
    @JsonProperty("min_confidence") Double minConfidence
) {
    public static final StopConditions NONE = new StopConditions(null, null);
}
