package io.amp.kernel.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Edge(@JsonProperty("from") String from, @JsonProperty("to") String to) {}
