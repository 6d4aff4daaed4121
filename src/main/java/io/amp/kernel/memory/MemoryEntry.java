package io.amp.kernel.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryEntry(
    @JsonProperty("key") String key,
    @JsonProperty("value") Object value,
    @JsonProperty("provenance") List<String> provenance,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("ttl") String ttl,
    @JsonProperty("timestamp") String timestamp
) {
    public MemoryEntry {
        provenance = provenance == null ? List.of() : List.copyOf(provenance);
    }
}
