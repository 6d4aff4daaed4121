package io.amp.kernel.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

public record Halt(RunStatus status, String reason, String nodeId, String message) {
    public Map<String, Object> toData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("status", status.wireName());
        data.put("reason", reason);
        data.put("node", nodeId);
        data.put("message", message);
        return data;
    }
}
