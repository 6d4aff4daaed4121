package io.amp.kernel.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

public record NodeFailure(String nodeId, String code, String message) {
    public Map<String, Object> toData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("node", nodeId);
        data.put("code", code);
        data.put("message", message);
        return data;
    }
}
