package io.amp.kernel.plan;

import io.amp.kernel.error.PlanValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class PlanValidator {
    public static final Set<String> MAP_LOCALS = Set.of("item", "index");
    public static final Set<Operation> RETRYABLE = Set.of(
        Operation.CALL, Operation.MAP, Operation.REDUCE, Operation.VERIFY, Operation.MEMORY_READ, Operation.MEMORY_WRITE);

    private PlanValidator() {}

    public static void validate(Plan plan) {
        validate(plan, null);
    }

    public static void validate(Plan plan, Collection<String> knownTools) {
        validate(plan, knownTools, null);
    }

    /**
     * @param knownTools names available in the registry snapshot, or {@code null} to skip the tool check
     * @param inputNames initial variables of the run, or {@code null} to skip the reference check
     * @throws PlanValidationException listing every problem found
     */
    public static void validate(Plan plan, Collection<String> knownTools, Collection<String> inputNames) {
        var problems = new ArrayList<String>();
        if (plan == null || plan.nodes().isEmpty()) {
            throw new PlanValidationException(List.of("Plan cannot be empty"));
        }
        validateSignals(plan, problems);

        var ids = new HashSet<String>();
        for (var node : plan.nodes()) {
            if (node == null || node.id() == null || node.id().isBlank()) {
                problems.add("Node id must not be blank");
                continue;
            }
            if (!ids.add(node.id())) {
                problems.add("Duplicate node ID: " + node.id());
            }
            validateNode(node, knownTools, problems, node.id());
        }
        if (!problems.isEmpty()) {
            throw new PlanValidationException(problems);
        }

        for (var edge : plan.edges()) {
            if (edge == null || !ids.contains(edge.from())) {
                problems.add("Edge references non-existent 'from' node: " + (edge == null ? null : edge.from()));
            } else if (!ids.contains(edge.to())) {
                problems.add("Edge references non-existent 'to' node: " + edge.to());
            } else if (edge.from().equals(edge.to())) {
                problems.add("Edge forms a self-loop on node: " + edge.from());
            }
        }
        validateOutputs(plan, problems);
        if (inputNames != null) {
            validateReferences(plan, inputNames, problems);
        }
        for (var node : plan.nodes()) {
            validateControlArgs(plan, node, problems);
        }
        if (problems.isEmpty() && DependencyGraph.of(plan).layers().isEmpty()) {
            problems.add("Plan contains a dependency cycle");
        }
        if (!problems.isEmpty()) {
            throw new PlanValidationException(problems);
        }
    }

    private static void validateSignals(Plan plan, List<String> problems) {
        var signals = plan.signals();
        if (signals.risk() != null && (signals.risk() < 0.0 || signals.risk() > 1.0)) {
            problems.add("Invalid risk value: " + signals.risk() + ", must be between 0.0 and 1.0");
        }
        if (signals.costCapUsd() != null && signals.costCapUsd() < 0.0) {
            problems.add("cost_cap_usd must not be negative");
        }
        if (signals.latencyBudgetMs() != null && signals.latencyBudgetMs() < 0) {
            problems.add("latency_budget_ms must not be negative");
        }
        var stop = plan.stopConditions();
        if (stop.maxNodes() != null && stop.maxNodes() < 0) {
            problems.add("max_nodes must not be negative");
        }
        if (stop.minConfidence() != null && (stop.minConfidence() < 0.0 || stop.minConfidence() > 1.0)) {
            problems.add("min_confidence must be between 0.0 and 1.0");
        }
    }

    private static void validateNode(Node node, Collection<String> knownTools, List<String> problems, String path) {
        if (node.op() == null) {
            problems.add("Node " + path + " has no op");
            return;
        }
        if (node.op().invokesTool() && !node.op().hasConfiguredTool() && !node.hasTool() && !node.hasCapability()) {
            problems.add("Node " + path + " requires either a tool or capability");
        }
        if (node.hasTool() && node.hasCapability()) {
            problems.add("Node " + path + " must declare exactly one of tool or capability");
        }
        if (node.hasTool() && knownTools != null && !knownTools.contains(node.tool())) {
            problems.add("Node " + path + " references unknown tool: " + node.tool());
        }
        if (node.op() == Operation.SPAWN) {
            validateSpawnTasks(node, knownTools, problems, path);
        }
    }

    private static void validateSpawnTasks(Node node, Collection<String> knownTools, List<String> problems, String path) {
        if (!(node.arg("tasks") instanceof List<?> tasks) || tasks.isEmpty()) {
            problems.add("Spawn node " + path + " requires a non-empty 'tasks' list");
            return;
        }
        var childIds = new HashSet<String>();
        for (var raw : tasks) {
            if (!(raw instanceof Map<?, ?> map)) {
                problems.add("Spawn node " + path + " has a task that is not an object");
                continue;
            }
            Node child;
            try {
                child = PlanLoader.nodeFromMap(map);
            } catch (PlanValidationException ex) {
                problems.add(ex.getMessage());
                continue;
            }
            if (child.id() == null || child.id().isBlank()) {
                problems.add("Spawn node " + path + " has a task without id");
                continue;
            }
            if (!childIds.add(child.id())) {
                problems.add("Spawn node " + path + " has duplicate task id: " + child.id());
            }
            if (child.op() == Operation.BRANCH || child.op() == Operation.SPAWN) {
                problems.add("Spawn task " + path + "/" + child.id() + " cannot use op " + child.op().wireName());
            }
            validateNode(child, knownTools, problems, path + "/" + child.id());
        }
    }

    private static void validateOutputs(Plan plan, List<String> problems) {
        var owners = new LinkedHashMap<String, String>();
        Set<String> ids = new HashSet<>(plan.nodeIds());
        for (var node : plan.nodes()) {
            for (var alias : node.out().keySet()) {
                if (ids.contains(alias) && !alias.equals(node.id())) {
                    problems.add("Output name '" + alias + "' of node " + node.id() + " shadows a node id");
                }
                var previous = owners.putIfAbsent(alias, node.id());
                if (previous != null && !previous.equals(node.id())) {
                    problems.add("Output name '" + alias + "' is published by both " + previous + " and " + node.id());
                }
            }
        }
        for (var node : plan.nodes()) {
            for (var reference : DependencyGraph.references(node)) {
                if (reference.root().equals(node.id()) || node.out().containsKey(reference.root())) {
                    problems.add("Node " + node.id() + " references its own output: " + reference.expression());
                }
            }
        }
    }

    private static void validateReferences(Plan plan, Collection<String> inputNames, List<String> problems) {
        var producers = DependencyGraph.producers(plan);
        for (var node : plan.nodes()) {
            var locals = new HashSet<>(node.bind().keySet());
            if (node.op() == Operation.MAP || node.op() == Operation.RETRY) {
                locals.addAll(MAP_LOCALS);
                if (node.arg("as") instanceof String alias) {
                    locals.add(alias);
                }
                if (node.op() == Operation.RETRY && node.arg("args") instanceof Map<?, ?> nested
                    && nested.get("as") instanceof String alias) {
                    locals.add(alias);
                }
            }
            for (var reference : DependencyGraph.references(node)) {
                var root = reference.root();
                if (!producers.containsKey(root) && !inputNames.contains(root) && !locals.contains(root)) {
                    problems.add("Node " + node.id() + " references unknown output: " + reference.expression());
                }
            }
        }
    }

    private static void validateControlArgs(Plan plan, Node node, List<String> problems) {
        switch (node.op()) {
            case BRANCH -> {
                if (!(node.arg("condition") instanceof String)) {
                    problems.add("Branch node " + node.id() + " requires a 'condition' expression");
                }
                var successors = plan.successors(node.id());
                for (var key : List.of("then", "else")) {
                    for (var target : targets(node.arg(key))) {
                        if (!successors.contains(target)) {
                            problems.add("Branch node " + node.id() + " '" + key + "' target " + target + " is not one of its successors");
                        }
                    }
                }
            }
            case ASSERT -> {
                if (node.arg("condition") == null && node.arg("evidence") == null && node.arg("require_citations") == null) {
                    problems.add("Assert node " + node.id() + " requires 'condition', 'evidence' or 'require_citations'");
                }
            }
            case MAP, REDUCE -> {
                if (node.arg("items") == null && node.arg("collection") == null) {
                    problems.add("Node " + node.id() + " (" + node.op().wireName() + ") requires an 'items' argument");
                }
            }
            case RETRY -> {
                if (node.arg("op") != null) {
                    Operation child;
                    try {
                        child = Operation.fromWire(String.valueOf(node.arg("op")));
                    } catch (IllegalArgumentException ex) {
                        problems.add("Retry node " + node.id() + ": " + ex.getMessage());
                        break;
                    }
                    if (!RETRYABLE.contains(child)) {
                        problems.add("Retry node " + node.id() + " cannot wrap op " + child.wireName());
                    }
                }
            }
            case MEMORY_READ, MEMORY_WRITE -> {
                if (node.arg("key") == null) {
                    problems.add("Memory node " + node.id() + " requires a 'key' argument");
                }
            }
            default -> {
                // no control arguments
            }
        }
    }

    public static List<String> targets(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof Collection<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(String.valueOf(raw));
    }
}
