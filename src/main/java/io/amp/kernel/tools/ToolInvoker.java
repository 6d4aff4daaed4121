package io.amp.kernel.tools;

import java.util.Map;

@FunctionalInterface
public interface ToolInvoker {
    /**
     * @param tool resolved tool contract and address
     * @param args fully resolved arguments
     * @param stepId trace step id of the invocation (node id, or {@code node#i} for map elements)
     */
    ToolResponse invoke(RegisteredTool tool, Map<String, Object> args, String stepId);
}
