package io.amp.kernel.tools;

import java.time.Instant;
import java.util.Objects;

public record RegisteredTool(ToolSpec spec, String address, Instant fetchedAt) {
    public RegisteredTool {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(spec.name(), "spec.name");
        address = address == null ? "" : address;
        fetchedAt = fetchedAt == null ? Instant.now() : fetchedAt;
    }

    public RegisteredTool(ToolSpec spec, String address) {
        this(spec, address, Instant.now());
    }

    public String name() {
        return spec.name();
    }
}
