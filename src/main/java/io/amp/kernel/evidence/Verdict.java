package io.amp.kernel.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Verdict(
    @JsonProperty("claim_id") String claimId,
    @JsonProperty("verdict") VerdictType verdict,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("needs_citation") boolean needsCitation
) {}
