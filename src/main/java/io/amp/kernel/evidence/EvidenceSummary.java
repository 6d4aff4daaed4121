package io.amp.kernel.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EvidenceSummary(
    @JsonProperty("total_claims") int totalClaims,
    @JsonProperty("supported_claims") int supportedClaims,
    @JsonProperty("contradicted_claims") int contradictedClaims,
    @JsonProperty("mean_confidence") double meanConfidence,
    @JsonProperty("min_confidence") double minConfidence,
    @JsonProperty("max_confidence") double maxConfidence,
    @JsonProperty("needs_citation_count") int needsCitationCount,
    @JsonProperty("per_claim") Map<String, ClaimSummary> perClaim
) {
    public EvidenceSummary {
        perClaim = perClaim == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(perClaim));
    }

    public Map<String, Object> toData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("total_claims", totalClaims);
        data.put("supported_claims", supportedClaims);
        data.put("contradicted_claims", contradictedClaims);
        data.put("mean_confidence", meanConfidence);
        data.put("min_confidence", minConfidence);
        data.put("max_confidence", maxConfidence);
        data.put("needs_citation_count", needsCitationCount);
        var claims = new LinkedHashMap<String, Object>();
        perClaim.forEach((claim, summary) -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("supports", summary.supports());
            entry.put("contradictions", summary.contradictions());
            entry.put("average_confidence", summary.averageConfidence());
            claims.put(claim, entry);
        });
        data.put("per_claim", claims);
        return data;
    }
}
