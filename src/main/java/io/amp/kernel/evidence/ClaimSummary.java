package io.amp.kernel.evidence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClaimSummary(
    @JsonProperty("supports") int supports,
    @JsonProperty("contradictions") int contradictions,
    @JsonProperty("average_confidence") Double averageConfidence,
    @JsonProperty("max_confidence") Double maxConfidence,
    @JsonProperty("min_confidence") Double minConfidence
) {}
