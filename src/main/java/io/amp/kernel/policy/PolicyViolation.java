package io.amp.kernel.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PolicyViolation(ViolationKind kind, Severity severity, String message, Map<String, Object> details) {
    public PolicyViolation {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public PolicyViolation escalate(Severity newSeverity) {
        return new PolicyViolation(kind, newSeverity, message, details);
    }

    public Map<String, Object> toData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("rule", kind.wireName());
        data.put("severity", severity.wireName());
        data.put("message", message);
        if (!details.isEmpty()) {
            data.put("details", details);
        }
        return data;
    }
}
