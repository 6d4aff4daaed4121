package io.amp.kernel.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class StaticToolRegistry implements ToolRegistry {
    private final List<RegisteredTool> tools = new CopyOnWriteArrayList<>();

    public StaticToolRegistry() {}

    public StaticToolRegistry(List<RegisteredTool> initial) {
        initial.forEach(this::register);
    }

    /**
     * Registers a tool, replacing an earlier entry with the same name in place so registration
     * order stays stable.
     */
    public synchronized StaticToolRegistry register(RegisteredTool tool) {
        for (int i = 0; i < tools.size(); i++) {
            if (tools.get(i).name().equals(tool.name())) {
                tools.set(i, tool);
                return this;
            }
        }
        tools.add(tool);
        return this;
    }

    public StaticToolRegistry register(ToolSpec spec, String address) {
        return register(new RegisteredTool(spec, address));
    }

    public synchronized void unregister(String name) {
        tools.removeIf(tool -> tool.name().equals(name));
    }

    @Override
    public List<RegisteredTool> snapshot() {
        return List.copyOf(new ArrayList<>(tools));
    }
}
