package io.amp.kernel.tools;

public record ToolResponse(Object output, ReportedUsage reportedUsage, Long latencyOverrideMs) {
    public static ToolResponse of(Object output) {
        return new ToolResponse(output, null, null);
    }

    public static ToolResponse of(Object output, ReportedUsage usage) {
        return new ToolResponse(output, usage, null);
    }
}
