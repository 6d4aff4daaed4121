package io.amp.kernel.replay;

import io.amp.kernel.config.KernelSettings;
import io.amp.kernel.plan.Plan;
import io.amp.kernel.runtime.Scheduler;
import io.amp.kernel.tools.ToolSpecCache;
import io.amp.kernel.trace.TraceEvent;
import io.amp.kernel.trace.TraceEventType;
import io.amp.kernel.trace.TraceSigner;
import io.amp.kernel.trace.TraceSink;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-runs a plan against a recorded trace and checks that scheduling decisions repeat: every step
 * must produce the same sequence of event types and every node must end in the same state.
 * Tool outputs, usage and latency come from the recording, so no tool is contacted.
 */
public final class TraceReplayer {
    private static final Logger log = LoggerFactory.getLogger(TraceReplayer.class);

    private final ToolSpecCache tools;
    private final KernelSettings settings;

    public TraceReplayer(ToolSpecCache tools, KernelSettings settings) {
        this.tools = Objects.requireNonNull(tools, "tools");
        this.settings = settings == null ? KernelSettings.defaults() : settings;
    }

    public ReplayResult replay(Plan plan, Map<String, Object> inputs, List<TraceEvent> recorded) {
        var planId = recorded.isEmpty() ? "replay" : recorded.get(0).planId();
        var invoker = new ReplayToolInvoker(recorded);
        var scheduler = new Scheduler(tools, invoker, settings, TraceSigner.ephemeral());
        var report = scheduler.execute(planId, plan, inputs, TraceSink.NOOP);

        var mismatches = new ArrayList<String>();
        var expected = sequences(recorded);
        var actual = sequences(report.events());
        var steps = new LinkedHashSet<String>();
        steps.addAll(expected.keySet());
        steps.addAll(actual.keySet());
        for (var step : steps) {
            var want = expected.getOrDefault(step, List.of());
            var got = actual.getOrDefault(step, List.of());
            if (!want.equals(got)) {
                mismatches.add("step " + step + ": recorded " + want + " but replay produced " + got);
            }
        }
        var recordedOutcomes = outcomes(recorded);
        var replayedOutcomes = outcomes(report.events());
        for (var nodeId : plan.nodeIds()) {
            var want = recordedOutcomes.get(nodeId);
            var got = replayedOutcomes.get(nodeId);
            if (!Objects.equals(want, got)) {
                mismatches.add("node " + nodeId + ": recorded " + want + " but replay ended " + got);
            }
        }
        if (invoker.unconsumed() > 0) {
            mismatches.add(invoker.unconsumed() + " recorded invocation(s) were never replayed");
        }
        if (mismatches.isEmpty()) {
            log.info("Replay of plan {} reproduced {} event(s)", planId, recorded.size());
        } else {
            log.warn("Replay of plan {} diverged: {}", planId, mismatches);
        }
        return new ReplayResult(mismatches.isEmpty(), mismatches, report);
    }

    private static Map<String, List<String>> sequences(List<TraceEvent> events) {
        var sequences = new LinkedHashMap<String, List<String>>();
        for (var event : events) {
            sequences.computeIfAbsent(event.stepId(), k -> new ArrayList<>()).add(event.eventType().wireName());
        }
        return sequences;
    }

    private static Map<String, Object> outcomes(List<TraceEvent> events) {
        var outcomes = new LinkedHashMap<String, Object>();
        for (var event : events) {
            if (event.eventType() == TraceEventType.STEP_END) {
                outcomes.put(event.stepId(), event.data("status"));
            }
        }
        return outcomes;
    }
}
