package io.amp.kernel.tools;

import java.util.List;
import java.util.Optional;

public interface ToolRegistry {
    List<RegisteredTool> snapshot();

    default Optional<RegisteredTool> lookup(String name) {
        return snapshot().stream().filter(tool -> tool.name().equals(name)).findFirst();
    }

    default List<RegisteredTool> lookupCapability(String capability) {
        return snapshot().stream().filter(tool -> tool.spec().advertises(capability)).toList();
    }
}
