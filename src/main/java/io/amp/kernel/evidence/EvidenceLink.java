package io.amp.kernel.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceLink(
    @JsonProperty("claim_id") String claimId,
    @JsonProperty("source") String source,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("explanation") String explanation
) {}
