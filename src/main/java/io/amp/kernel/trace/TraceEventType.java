package io.amp.kernel.trace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TraceEventType {
    STEP_START("step-start"),
    STEP_END("step-end"),
    TOOL_INVOKE("tool-invoke"),
    CONSTRAINT_CHECK("constraint-check"),
    POLICY_VIOLATION("policy-violation"),
    EVIDENCE_CHECK("evidence-check"),
    MEMORY_OP("memory-op"),
    CAPABILITY_ROUTE("capability-route"),
    PLAN_OPTIMIZER("plan-optimizer");

    private final String wireName;

    TraceEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TraceEventType fromWire(String value) {
        for (var type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trace event type: " + value);
    }
}
