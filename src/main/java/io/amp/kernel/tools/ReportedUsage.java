package io.amp.kernel.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportedUsage(
    @JsonProperty("cost_usd") Double costUsd,
    @JsonProperty("tokens_in") Long tokensIn,
    @JsonProperty("tokens_out") Long tokensOut
) {}
