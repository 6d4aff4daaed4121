package io.amp.kernel.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Node(
    @JsonProperty("id") String id,
    @JsonProperty("op") Operation op,
    @JsonProperty("tool") String tool,
    @JsonProperty("capability") String capability,
    @JsonProperty("args") Map<String, Object> args,
    @JsonProperty("bind") Map<String, String> bind,
    @JsonProperty("out") Map<String, String> out
) {
    public Node {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        bind = bind == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bind));
        out = out == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(out));
    }

    public static Node call(String id, String tool, Map<String, Object> args) {
        return new Node(id, Operation.CALL, tool, null, args, null, null);
    }

    public Object arg(String name) {
        return args.get(name);
    }

    @JsonIgnore
    public boolean hasTool() {
        return tool != null && !tool.isBlank();
    }

    @JsonIgnore
    public boolean hasCapability() {
        return capability != null && !capability.isBlank();
    }

    @JsonIgnore
    public String target() {
        if (hasTool()) {
            return tool;
        }
        return hasCapability() ? "capability:" + capability : op.wireName();
    }
}
