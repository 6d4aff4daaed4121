package io.amp.kernel.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum VerdictType {
    SUPPORTED,
    CONTRADICTED,
    NEUTRAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VerdictType fromWire(String value) {
        return VerdictType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
