package io.amp.kernel.runtime;

import io.amp.kernel.budget.BudgetTracker;
import io.amp.kernel.config.KernelSettings;
import io.amp.kernel.error.ArgumentResolutionException;
import io.amp.kernel.expr.PathLookup;
import io.amp.kernel.expr.VariableResolver;
import io.amp.kernel.plan.Node;
import io.amp.kernel.plan.Plan;
import io.amp.kernel.plan.Reference;
import io.amp.kernel.tools.ToolSpecCache;
import io.amp.kernel.trace.TraceEmitter;
import io.amp.kernel.trace.TraceEventType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one plan run: variables, node states, failures, budget and trace. Owned by exactly one
 * execution and never shared across runs.
 */
public final class ExecutionContext {
    private final Plan plan;
    private final ToolSpecCache tools;
    private final KernelSettings settings;
    private final BudgetTracker budget;
    private final TraceEmitter trace;
    private final Map<String, Object> variables = new LinkedHashMap<>();
    private final Map<String, NodeState> states = new ConcurrentHashMap<>();
    private final List<NodeFailure> failures = new ArrayList<>();
    private final AtomicReference<Halt> halt = new AtomicReference<>();

    public ExecutionContext(Plan plan, ToolSpecCache tools, KernelSettings settings, BudgetTracker budget, TraceEmitter trace) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.tools = Objects.requireNonNull(tools, "tools");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.trace = Objects.requireNonNull(trace, "trace");
        for (var node : plan.nodes()) {
            states.put(node.id(), NodeState.PENDING);
        }
    }

    public Plan plan() {
        return plan;
    }

    public ToolSpecCache tools() {
        return tools;
    }

    public KernelSettings settings() {
        return settings;
    }

    public BudgetTracker budget() {
        return budget;
    }

    public TraceEmitter trace() {
        return trace;
    }

    public String planId() {
        return trace.planId();
    }

    public synchronized void bindInputs(Map<String, Object> inputs) {
        inputs.forEach((key, value) -> variables.put(key, VariableResolver.copy(value)));
    }

    public synchronized Map<String, Object> scope() {
        return new LinkedHashMap<>(variables);
    }

    /**
     * Publishes {@code output} under the node id and under each {@code out} name. An {@code out}
     * selector of {@code $} (or empty) names the whole output; anything else is a path into it.
     */
    public void publish(Node node, Object output) {
        var values = new LinkedHashMap<String, Object>();
        values.put(node.id(), output);
        for (var entry : node.out().entrySet()) {
            values.put(entry.getKey(), select(output, entry.getValue(), node.id()));
        }
        synchronized (this) {
            variables.putAll(values);
        }
    }

    private static Object select(Object output, String selector, String nodeId) {
        if (selector == null || selector.isBlank() || Reference.SIGIL.equals(selector.trim())) {
            return output;
        }
        var path = selector.trim();
        if (path.startsWith("$.")) {
            path = path.substring(2);
        } else if (path.startsWith(Reference.SIGIL)) {
            path = path.substring(1);
        }
        var expression = "$out" + (path.startsWith("[") ? "" : ".") + path;
        var reference = Reference.tryParse(expression)
            .orElseThrow(() -> new ArgumentResolutionException("Invalid out selector '" + selector + "' on node " + nodeId, selector));
        var scope = new LinkedHashMap<String, Object>();
        scope.put("out", output);
        return PathLookup.strict(scope, reference);
    }

    public NodeState state(String nodeId) {
        return states.getOrDefault(nodeId, NodeState.PENDING);
    }

    public boolean transition(String nodeId, NodeState from, NodeState to) {
        return states.replace(nodeId, from, to);
    }

    public void setState(String nodeId, NodeState state) {
        states.put(nodeId, state);
    }

    public Map<String, NodeState> states() {
        var ordered = new LinkedHashMap<String, NodeState>();
        for (var node : plan.nodes()) {
            ordered.put(node.id(), states.get(node.id()));
        }
        return ordered;
    }

    public boolean skip(String nodeId, String reason) {
        if (!states.replace(nodeId, NodeState.PENDING, NodeState.SKIPPED)
            && !states.replace(nodeId, NodeState.READY, NodeState.SKIPPED)) {
            return false;
        }
        var data = new LinkedHashMap<String, Object>();
        data.put("status", NodeState.SKIPPED.wireName());
        data.put("reason", reason);
        trace.emit(nodeId, TraceEventType.STEP_END, data);
        return true;
    }

    public synchronized void recordFailure(NodeFailure failure) {
        failures.add(failure);
    }

    public synchronized List<NodeFailure> failures() {
        return List.copyOf(failures);
    }

    public boolean halt(Halt reason) {
        return halt.compareAndSet(null, reason);
    }

    public Optional<Halt> haltReason() {
        return Optional.ofNullable(halt.get());
    }

    public boolean isHalted() {
        return halt.get() != null;
    }
}
