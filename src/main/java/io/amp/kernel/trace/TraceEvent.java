package io.amp.kernel.trace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TraceEvent(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("seq") long seq,
    @JsonProperty("step_id") String stepId,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("event_type") TraceEventType eventType,
    @JsonProperty("cost_usd") Double costUsd,
    @JsonProperty("tokens_in") Long tokensIn,
    @JsonProperty("tokens_out") Long tokensOut,
    @JsonProperty("citations") List<String> citations,
    @JsonProperty("signature") String signature,
    @JsonProperty("data") Map<String, Object> data
) {
    public TraceEvent {
        citations = citations == null ? null : List.copyOf(citations);
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public TraceEvent withSignature(String newSignature) {
        return new TraceEvent(planId, seq, stepId, timestamp, eventType, costUsd, tokensIn, tokensOut, citations, newSignature, data);
    }

    public Object data(String key) {
        return data.get(key);
    }

    public boolean isError(String errorName) {
        return errorName.equals(data.get("error"));
    }
}
