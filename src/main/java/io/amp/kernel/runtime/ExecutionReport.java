package io.amp.kernel.runtime;

import io.amp.kernel.budget.BudgetSnapshot;
import io.amp.kernel.trace.TraceEvent;
import io.amp.kernel.trace.TraceEventType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ExecutionReport(
    String planId,
    RunStatus status,
    Map<String, NodeState> states,
    Map<String, Object> outputs,
    List<NodeFailure> failures,
    Halt halt,
    BudgetSnapshot budget,
    List<TraceEvent> events
) {
    public ExecutionReport {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        failures = List.copyOf(failures);
        events = List.copyOf(events);
    }

    public NodeState state(String nodeId) {
        return states.get(nodeId);
    }

    public Object output(String nodeId) {
        return outputs.get(nodeId);
    }

    public Optional<Halt> haltReason() {
        return Optional.ofNullable(halt);
    }

    public List<TraceEvent> events(TraceEventType type) {
        return events.stream().filter(event -> event.eventType() == type).toList();
    }

    public List<TraceEvent> events(String stepId) {
        return events.stream().filter(event -> stepId.equals(event.stepId())).toList();
    }

    public Map<String, Object> toData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("plan_id", planId);
        data.put("status", status.wireName());
        var nodeStates = new LinkedHashMap<String, Object>();
        states.forEach((id, state) -> nodeStates.put(id, state.wireName()));
        data.put("nodes", nodeStates);
        data.put("outputs", outputs);
        data.put("failures", failures.stream().map(NodeFailure::toData).toList());
        if (halt != null) {
            data.put("halt", halt.toData());
        }
        data.put("budget", budget.toData());
        data.put("trace_events", events.size());
        return data;
    }
}
