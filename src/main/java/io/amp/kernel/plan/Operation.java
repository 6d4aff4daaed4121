package io.amp.kernel.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Closed operation vocabulary of the plan IR. Adding an operation means extending this enum
 * and the scheduler's dispatch switch.
 */
public enum Operation {
    CALL("call", true),
    MAP("map", true),
    REDUCE("reduce", true),
    BRANCH("branch", false),
    ASSERT("assert", false),
    SPAWN("spawn", false),
    MEMORY_READ("mem.read", true, "memory-read", "memory_read"),
    MEMORY_WRITE("mem.write", true, "memory-write", "memory_write"),
    VERIFY("verify", true),
    RETRY("retry", true);

    private final String wireName;
    private final boolean invokesTool;
    private final List<String> aliases;

    Operation(String wireName, boolean invokesTool, String... aliases) {
        this.wireName = wireName;
        this.invokesTool = invokesTool;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean invokesTool() {
        return invokesTool;
    }

    public boolean hasConfiguredTool() {
        return this == MEMORY_READ || this == MEMORY_WRITE || this == VERIFY;
    }

    @JsonCreator
    public static Operation fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Operation must not be blank");
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var op : values()) {
            if (op.wireName.equals(normalized) || op.aliases.contains(normalized)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unsupported operation: " + value);
    }
}
