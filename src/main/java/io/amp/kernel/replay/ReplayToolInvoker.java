package io.amp.kernel.replay;

import io.amp.kernel.error.ToolInvocationException;
import io.amp.kernel.tools.RegisteredTool;
import io.amp.kernel.tools.ReportedUsage;
import io.amp.kernel.tools.ToolInvoker;
import io.amp.kernel.tools.ToolResponse;
import io.amp.kernel.trace.TraceEvent;
import io.amp.kernel.trace.TraceEventType;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

public final class ReplayToolInvoker implements ToolInvoker {
    private final Map<String, Deque<TraceEvent>> recorded = new ConcurrentHashMap<>();

    public ReplayToolInvoker(List<TraceEvent> events) {
        for (var event : events) {
            if (event.eventType() == TraceEventType.TOOL_INVOKE) {
                recorded.computeIfAbsent(event.stepId(), k -> new ConcurrentLinkedDeque<>()).add(event);
            }
        }
    }

    @Override
    public ToolResponse invoke(RegisteredTool tool, Map<String, Object> args, String stepId) {
        var queue = recorded.get(stepId);
        var event = queue == null ? null : queue.poll();
        if (event == null) {
            throw new ToolInvocationException(tool.name(), "No recorded invocation of " + tool.name() + " for step " + stepId, false);
        }
        var recordedTool = event.data("tool");
        if (recordedTool != null && !tool.name().equals(recordedTool)) {
            throw new ToolInvocationException(tool.name(),
                "Step " + stepId + " recorded a call to " + recordedTool + " but replay resolved " + tool.name(), false);
        }
        var error = event.data("error");
        if (error != null) {
            var message = event.data("message") == null ? String.valueOf(error) : String.valueOf(event.data("message"));
            throw new ToolInvocationException(tool.name(), message, "tool_timeout".equals(error));
        }
        var latency = event.data("latency_ms") instanceof Number number ? Long.valueOf(number.longValue()) : null;
        var usage = new ReportedUsage(event.costUsd(), event.tokensIn(), event.tokensOut());
        return new ToolResponse(event.data("output"), usage, latency);
    }

    public int unconsumed() {
        return recorded.values().stream().mapToInt(Deque::size).sum();
    }
}
