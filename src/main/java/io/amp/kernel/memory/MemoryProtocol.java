package io.amp.kernel.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.amp.kernel.error.ToolInvocationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Request and response shapes of the memory tool: {@code {"operation": "read|write|forget", "key": ...}}
 * answered by {@code {"success": ..., "entry"|"value": ..., "message": ...}}.
 */
public final class MemoryProtocol {
    public static final String DEFAULT_TTL = "P90D";
    private static final ObjectMapper JSON = new ObjectMapper();

    private MemoryProtocol() {}

    public static Map<String, Object> readRequest(String key) {
        var request = new LinkedHashMap<String, Object>();
        request.put("operation", "read");
        request.put("key", key);
        return request;
    }

    public static Map<String, Object> forgetRequest(String key) {
        var request = new LinkedHashMap<String, Object>();
        request.put("operation", "forget");
        request.put("key", key);
        return request;
    }

    public static Map<String, Object> writeRequest(MemoryEntry entry) {
        var request = new LinkedHashMap<String, Object>();
        request.put("operation", "write");
        request.put("key", entry.key());
        request.put("value", entry.value());
        request.put("provenance", entry.provenance());
        request.put("confidence", entry.confidence());
        request.put("ttl", entry.ttl() == null ? DEFAULT_TTL : entry.ttl());
        return request;
    }

    public static MemoryEntry entryFromArgs(String key, Map<String, Object> args, String defaultTtl) {
        var provenance = new ArrayList<String>();
        var raw = args.get("provenance");
        if (raw instanceof Collection<?> list) {
            list.forEach(item -> provenance.add(String.valueOf(item)));
        } else if (raw instanceof String str && !str.isBlank()) {
            provenance.add(str);
        }
        var confidence = args.get("confidence") instanceof Number number ? number.doubleValue() : null;
        var ttl = args.get("ttl") instanceof String str && !str.isBlank() ? str : defaultTtl;
        return new MemoryEntry(key, args.get("value"), provenance, confidence, ttl, Instant.now().toString());
    }

    public static Optional<MemoryEntry> parseRead(String key, Object output) {
        if (!(output instanceof Map<?, ?> map)) {
            return output == null ? Optional.empty() : Optional.of(new MemoryEntry(key, output, null, null, null, null));
        }
        if (Boolean.FALSE.equals(map.get("success"))) {
            return Optional.empty();
        }
        if (map.get("entry") instanceof Map<?, ?> entry) {
            return Optional.of(JSON.convertValue(entry, MemoryEntry.class));
        }
        if (map.containsKey("value")) {
            return Optional.ofNullable(map.get("value")).map(value -> new MemoryEntry(key, value, null, null, null, null));
        }
        return Optional.empty();
    }

    public static Map<String, Object> requireSuccess(String tool, String operation, Object output) {
        var response = new LinkedHashMap<String, Object>();
        if (output instanceof Map<?, ?> map) {
            if (Boolean.FALSE.equals(map.get("success"))) {
                throw new ToolInvocationException(tool, "Memory " + operation + " failed: " + map.get("message"), false);
            }
            map.forEach((k, v) -> response.put(String.valueOf(k), v));
        }
        return response;
    }
}
