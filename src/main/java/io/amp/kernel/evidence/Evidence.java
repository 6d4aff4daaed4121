package io.amp.kernel.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Evidence(
    @JsonProperty("claims") List<String> claims,
    @JsonProperty("supports") List<EvidenceLink> supports,
    @JsonProperty("contradicts") List<EvidenceLink> contradicts,
    @JsonProperty("verdicts") List<Verdict> verdicts
) {
    private static final ObjectMapper JSON = new ObjectMapper();

    public Evidence {
        claims = claims == null ? List.of() : List.copyOf(claims);
        supports = supports == null ? List.of() : List.copyOf(supports);
        contradicts = contradicts == null ? List.of() : List.copyOf(contradicts);
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
    }

    /**
     * Reads evidence from a tool output map. Outputs wrapping it under {@code "evidence"} are unwrapped.
     *
     * @throws IllegalArgumentException when the value does not have the evidence shape
     */
    public static Evidence fromOutput(Object output) {
        if (!(output instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Evidence must be an object, got " + describe(output));
        }
        Object source = map.get("evidence") instanceof Map<?, ?> nested ? nested : map;
        return JSON.convertValue(source, Evidence.class);
    }

    public static Optional<Double> reportedConfidence(Object output) {
        if (output instanceof Map<?, ?> map && map.get("confidence") instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        return Optional.empty();
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
