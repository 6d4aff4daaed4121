package io.amp.kernel.runtime;

import io.amp.kernel.error.ArgumentResolutionException;
import io.amp.kernel.error.AssertionFailedException;
import io.amp.kernel.error.KernelException;
import io.amp.kernel.error.ToolInvocationException;
import io.amp.kernel.evidence.Evidence;
import io.amp.kernel.evidence.EvidenceBelowThresholdException;
import io.amp.kernel.evidence.EvidenceVerifier;
import io.amp.kernel.expr.ConditionEvaluator;
import io.amp.kernel.expr.VariableResolver;
import io.amp.kernel.memory.MemoryProtocol;
import io.amp.kernel.plan.Node;
import io.amp.kernel.plan.Operation;
import io.amp.kernel.plan.PlanLoader;
import io.amp.kernel.plan.PlanValidator;
import io.amp.kernel.policy.Citations;
import io.amp.kernel.policy.PolicyEngine;
import io.amp.kernel.policy.PolicyViolation;
import io.amp.kernel.trace.TraceEventType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the body of a single node. One exhaustive switch dispatches every {@link Operation}; tool-backed
 * operations go through the {@link InvocationPipeline}.
 */
final class NodeExecutor {
    private static final Logger log = LoggerFactory.getLogger(NodeExecutor.class);

    private static final Set<String> MAP_CONTROL_KEYS = Set.of("items", "collection", "as");
    private static final Set<String> RETRY_CONTROL_KEYS = Set.of("max_attempts", "attempts", "backoff_ms", "backoff", "multiplier", "op", "args");

    private final ExecutionContext ctx;
    private final InvocationPipeline pipeline;
    private final ExecutorService fanoutPool;

    NodeExecutor(ExecutionContext ctx, InvocationPipeline pipeline, ExecutorService fanoutPool) {
        this.ctx = ctx;
        this.pipeline = pipeline;
        this.fanoutPool = fanoutPool;
    }

    Object execute(Node node, String stepId) {
        var scope = scopeFor(node, ctx.scope());
        return dispatch(node, stepId, scope, RetryPolicy.NONE);
    }

    private Object dispatch(Node node, String stepId, Map<String, Object> scope, RetryPolicy retry) {
        return switch (node.op()) {
            case CALL -> RetryDecorator.execute(retry, stepId, attempt -> call(node, stepId, scope));
            case MAP -> map(node, stepId, scope, retry);
            case REDUCE -> RetryDecorator.execute(retry, stepId, attempt -> reduce(node, stepId, scope));
            case BRANCH -> branch(node, scope);
            case ASSERT -> assertion(node, stepId, scope);
            case SPAWN -> spawn(node, stepId, scope);
            case MEMORY_READ -> RetryDecorator.execute(retry, stepId, attempt -> memoryRead(node, stepId, scope));
            case MEMORY_WRITE -> memoryWrite(node, stepId, scope, retry);
            case VERIFY -> RetryDecorator.execute(retry, stepId, attempt -> verify(node, stepId, scope));
            case RETRY -> retry(node, stepId, scope);
        };
    }

    private static Map<String, Object> scopeFor(Node node, Map<String, Object> base) {
        var scope = new LinkedHashMap<>(base);
        for (var entry : node.bind().entrySet()) {
            scope.put(entry.getKey(), VariableResolver.resolve(entry.getValue(), scope));
        }
        return scope;
    }

    private Object call(Node node, String stepId, Map<String, Object> scope) {
        var args = VariableResolver.resolveArgs(node.args(), scope);
        return pipeline.invoke(node, stepId, args).output();
    }

    private Object map(Node node, String stepId, Map<String, Object> scope, RetryPolicy retry) {
        var items = items(node, scope);
        var alias = node.arg("as") instanceof String name && !name.isBlank() ? name : "item";
        var template = without(node.args(), MAP_CONTROL_KEYS);
        var futures = new ArrayList<Future<Object>>(items.size());
        for (int index = 0; index < items.size(); index++) {
            var elementScope = new LinkedHashMap<>(scope);
            elementScope.put(alias, items.get(index));
            elementScope.put("item", items.get(index));
            elementScope.put("index", index);
            var elementStep = stepId + "#" + index;
            var element = items.get(index);
            futures.add(fanoutPool.submit(() -> {
                var args = VariableResolver.resolveArgs(template, elementScope);
                args.putIfAbsent(alias, element);
                return RetryDecorator.execute(retry, elementStep, attempt -> pipeline.invoke(node, elementStep, args).output());
            }));
        }
        // results keep input order; every element is awaited before the first failure is reported
        var results = new ArrayList<Object>(items.size());
        RuntimeException failure = null;
        for (var future : futures) {
            try {
                results.add(await(future));
            } catch (RuntimeException ex) {
                if (failure == null || isRunFatal(ex) && !isRunFatal(failure)) {
                    failure = ex;
                }
                results.add(null);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    private Object reduce(Node node, String stepId, Map<String, Object> scope) {
        var items = items(node, scope);
        var args = VariableResolver.resolveArgs(without(node.args(), Set.of("items", "collection")), scope);
        args.put("items", items);
        return pipeline.invoke(node, stepId, args).output();
    }

    private List<Object> items(Node node, Map<String, Object> scope) {
        var raw = node.arg("items") != null ? node.arg("items") : node.arg("collection");
        var resolved = VariableResolver.resolve(raw, scope);
        if (!(resolved instanceof List<?> list)) {
            throw new ArgumentResolutionException("Node " + node.id() + " expects 'items' to resolve to a list, got "
                + (resolved == null ? "null" : resolved.getClass().getSimpleName()), String.valueOf(raw));
        }
        return new ArrayList<>(list);
    }

    private Object branch(Node node, Map<String, Object> scope) {
        var condition = String.valueOf(node.arg("condition"));
        var taken = ConditionEvaluator.evaluate(condition, scope);
        var successors = ctx.plan().successors(node.id());
        var thenTargets = PlanValidator.targets(node.arg("then"));
        var elseTargets = PlanValidator.targets(node.arg("else"));
        if (node.arg("then") == null) {
            thenTargets = successors.stream().filter(id -> !elseTargets.contains(id)).toList();
        }
        var finalThen = thenTargets;
        var chosen = taken ? thenTargets : node.arg("else") == null
            ? successors.stream().filter(id -> !finalThen.contains(id)).toList()
            : elseTargets;
        for (var successor : successors) {
            if (!chosen.contains(successor)) {
                ctx.skip(successor, "branch not taken");
            }
        }
        log.debug("Branch {} evaluated {} -> {}", node.id(), taken, chosen);
        var output = new LinkedHashMap<String, Object>();
        output.put("condition", condition);
        output.put("taken", taken);
        output.put("chosen", chosen);
        return output;
    }

    private Object assertion(Node node, String stepId, Map<String, Object> scope) {
        var output = new LinkedHashMap<String, Object>();
        if (node.arg("condition") != null) {
            var condition = String.valueOf(node.arg("condition"));
            if (!ConditionEvaluator.evaluate(condition, scope)) {
                throw new AssertionFailedException(node.id(), condition);
            }
            output.put("condition", condition);
        }
        if (node.arg("evidence") != null) {
            var raw = VariableResolver.resolve(node.arg("evidence"), scope);
            var min = node.arg("min_confidence") instanceof Number number
                ? Double.valueOf(number.doubleValue())
                : ctx.plan().stopConditions().minConfidence();
            output.put("confidence", gateEvidence(node, stepId, raw, min, true));
        }
        var requirement = node.arg("require_citations");
        if (requirement != null && !Boolean.FALSE.equals(requirement)) {
            var subject = Boolean.TRUE.equals(requirement) ? node.arg("subject") : requirement;
            var citations = Citations.extract(VariableResolver.resolve(subject, scope));
            var violation = PolicyEngine.checkCitations(node.id(), citations);
            if (violation.isPresent()) {
                pipeline.emitViolation(stepId, violation.get());
                throw new AssertionFailedException(node.id(), violation.get().message());
            }
            output.put("citations", citations);
        }
        output.put("passed", true);
        return output;
    }

    private Object spawn(Node node, String stepId, Map<String, Object> scope) {
        var tasks = new ArrayList<Node>();
        if (node.arg("tasks") instanceof List<?> raw) {
            for (var item : raw) {
                if (item instanceof Map<?, ?> map) {
                    tasks.add(PlanLoader.nodeFromMap(map));
                }
            }
        }
        boolean failFast = "first_failure".equals(node.arg("join"));
        var completion = new ExecutorCompletionService<Map.Entry<String, Object>>(fanoutPool);
        var futures = new ArrayList<Future<Map.Entry<String, Object>>>();
        for (var child : tasks) {
            var childStep = stepId + "/" + child.id();
            futures.add(completion.submit(() -> Map.entry(child.id(), runChild(child, childStep, scope))));
        }
        var outputs = new LinkedHashMap<String, Object>();
        tasks.forEach(child -> outputs.put(child.id(), null));
        RuntimeException failure = null;
        for (int done = 0; done < futures.size(); done++) {
            try {
                var entry = await(completion.take());
                outputs.put(entry.getKey(), entry.getValue());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                throw new KernelException("interrupted", "Interrupted while joining spawn " + node.id(), null, ex);
            } catch (RuntimeException ex) {
                if (failure == null || isRunFatal(ex) && !isRunFatal(failure)) {
                    failure = ex;
                }
                if (failFast) {
                    log.debug("Spawn {} cancelling remaining tasks after first failure", node.id());
                    futures.forEach(future -> future.cancel(true));
                    break;
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return outputs;
    }

    private Object runChild(Node child, String childStep, Map<String, Object> parentScope) {
        var startData = new LinkedHashMap<String, Object>();
        startData.put("op", child.op().wireName());
        startData.put("target", child.target());
        ctx.trace().emit(childStep, TraceEventType.STEP_START, startData);
        try {
            var output = dispatch(child, childStep, scopeFor(child, parentScope), RetryPolicy.NONE);
            var endData = new LinkedHashMap<String, Object>();
            endData.put("status", NodeState.COMPLETED.wireName());
            ctx.trace().emit(childStep, TraceEventType.STEP_END, endData);
            return output;
        } catch (KernelException ex) {
            var endData = new LinkedHashMap<String, Object>();
            endData.put("status", NodeState.FAILED.wireName());
            endData.put("error", ex.code());
            endData.put("message", ex.getMessage());
            ctx.trace().emit(childStep, TraceEventType.STEP_END, endData);
            throw ex;
        }
    }

    private Object memoryRead(Node node, String stepId, Map<String, Object> scope) {
        var key = key(node, scope);
        var outcome = pipeline.invoke(node, stepId, MemoryProtocol.readRequest(key));
        var entry = MemoryProtocol.parseRead(key, outcome.output());
        var data = new LinkedHashMap<String, Object>();
        data.put("operation", "read");
        data.put("key", key);
        data.put("tool", outcome.tool().name());
        data.put("found", entry.isPresent());
        ctx.trace().emit(stepId, TraceEventType.MEMORY_OP, data);
        return entry.map(found -> found.value()).orElse(null);
    }

    /**
     * Write-acceptance rules run before any attempt, so a rejected write never reaches the store.
     */
    private Object memoryWrite(Node node, String stepId, Map<String, Object> scope, RetryPolicy retry) {
        var key = key(node, scope);
        var args = VariableResolver.resolveArgs(node.args(), scope);
        if (Boolean.TRUE.equals(args.get("forget"))) {
            return RetryDecorator.execute(retry, stepId, attempt -> {
                var outcome = pipeline.invoke(node, stepId, MemoryProtocol.forgetRequest(key));
                var response = MemoryProtocol.requireSuccess(outcome.tool().name(), "forget", outcome.output());
                emitMemoryOp(stepId, "forget", key, outcome.tool().name(), null);
                return response;
            });
        }
        var violations = PolicyEngine.checkMemoryWrite(key, args);
        if (!violations.isEmpty()) {
            for (var violation : violations) {
                log.warn("{}: memory write rejected: {}", stepId, violation.message());
                pipeline.emitViolation(stepId, violation);
            }
            var output = new LinkedHashMap<String, Object>();
            output.put("accepted", false);
            output.put("key", key);
            output.put("reasons", violations.stream().map(PolicyViolation::message).toList());
            return output;
        }
        var entry = MemoryProtocol.entryFromArgs(key, args, ctx.settings().memoryDefaultTtl());
        return RetryDecorator.execute(retry, stepId, attempt -> {
            var outcome = pipeline.invoke(node, stepId, MemoryProtocol.writeRequest(entry));
            var response = MemoryProtocol.requireSuccess(outcome.tool().name(), "write", outcome.output());
            var details = new LinkedHashMap<String, Object>();
            details.put("accepted", true);
            details.put("confidence", entry.confidence());
            details.put("ttl", entry.ttl());
            details.put("provenance", entry.provenance());
            emitMemoryOp(stepId, "write", key, outcome.tool().name(), details);
            var output = new LinkedHashMap<String, Object>();
            output.put("accepted", true);
            output.put("key", key);
            response.forEach(output::putIfAbsent);
            return output;
        });
    }

    private void emitMemoryOp(String stepId, String operation, String key, String tool, Map<String, Object> details) {
        var data = new LinkedHashMap<String, Object>();
        data.put("operation", operation);
        data.put("key", key);
        data.put("tool", tool);
        if (details != null) {
            data.putAll(details);
        }
        ctx.trace().emit(stepId, TraceEventType.MEMORY_OP, data);
    }

    private static String key(Node node, Map<String, Object> scope) {
        var key = VariableResolver.resolve(node.arg("key"), scope);
        if (!(key instanceof String str) || str.isBlank()) {
            throw new ArgumentResolutionException("Memory node " + node.id() + " needs a non-empty string key", String.valueOf(node.arg("key")));
        }
        return str;
    }

    private Object verify(Node node, String stepId, Map<String, Object> scope) {
        var args = VariableResolver.resolveArgs(without(node.args(), Set.of("advisory", "min_confidence")), scope);
        var outcome = pipeline.invoke(node, stepId, args);
        var stopThreshold = ctx.plan().stopConditions().minConfidence();
        var threshold = node.arg("min_confidence") instanceof Number number ? Double.valueOf(number.doubleValue()) : stopThreshold;
        boolean guarded = stopThreshold != null && !Boolean.TRUE.equals(node.arg("advisory"));
        Evidence evidence;
        try {
            evidence = Evidence.fromOutput(outcome.output());
        } catch (IllegalArgumentException ex) {
            throw new ToolInvocationException(outcome.tool().name(), "Malformed evidence from " + outcome.tool().name() + ": " + ex.getMessage(), false, ex);
        }
        var summary = EvidenceVerifier.summarize(evidence);
        var confidence = EvidenceVerifier.gatingConfidence(outcome.output(), summary);
        checkEvidence(node, stepId, confidence, threshold, guarded, summary.toData());

        var output = new LinkedHashMap<String, Object>();
        if (outcome.output() instanceof Map<?, ?> map) {
            map.forEach((k, v) -> output.put(String.valueOf(k), v));
        }
        output.put("confidence", confidence);
        output.put("summary", summary.toData());
        return output;
    }

    private double gateEvidence(Node node, String stepId, Object raw, Double threshold, boolean guarded) {
        Evidence evidence;
        try {
            evidence = Evidence.fromOutput(raw);
        } catch (IllegalArgumentException ex) {
            throw new ArgumentResolutionException("Node " + node.id() + " has malformed evidence: " + ex.getMessage(),
                String.valueOf(node.arg("evidence")));
        }
        var summary = EvidenceVerifier.summarize(evidence);
        var confidence = EvidenceVerifier.gatingConfidence(raw, summary);
        checkEvidence(node, stepId, confidence, threshold, guarded, summary.toData());
        return confidence;
    }

    private void checkEvidence(Node node, String stepId, double confidence, Double threshold, boolean guarded, Map<String, Object> summary) {
        var violation = PolicyEngine.checkEvidence(node.id(), confidence, threshold, guarded);
        var data = new LinkedHashMap<String, Object>();
        data.put("confidence", confidence);
        data.put("min_confidence", threshold);
        data.put("guarded", guarded);
        data.put("ok", violation.isEmpty());
        if (violation.isPresent()) {
            data.put("error", "EvidenceBelowThreshold");
        }
        data.put("summary", summary);
        ctx.trace().emit(stepId, TraceEventType.EVIDENCE_CHECK, data);
        if (violation.isEmpty()) {
            return;
        }
        pipeline.emitViolation(stepId, violation.get());
        if (guarded) {
            throw new EvidenceBelowThresholdException(node.id(), confidence, threshold);
        }
        log.warn("{}: {}", stepId, violation.get().message());
    }

    private Object retry(Node node, String stepId, Map<String, Object> scope) {
        var controls = new LinkedHashMap<String, Object>();
        for (var key : RETRY_CONTROL_KEYS) {
            if (node.args().containsKey(key) && !"args".equals(key)) {
                controls.put(key, VariableResolver.resolve(node.arg(key), scope));
            }
        }
        var policy = RetryPolicy.from(controls, ctx.settings().retry());
        var childOp = node.arg("op") == null ? Operation.CALL : Operation.fromWire(String.valueOf(node.arg("op")));
        if (!PlanValidator.RETRYABLE.contains(childOp)) {
            throw new ArgumentResolutionException("Retry node " + node.id() + " cannot wrap op " + childOp.wireName(), String.valueOf(node.arg("op")));
        }
        var childArgs = childArgs(node);
        var child = new Node(node.id(), childOp, node.tool(), node.capability(), childArgs, null, null);
        log.debug("Retry {} wraps {} with up to {} attempt(s)", node.id(), childOp.wireName(), policy.maxAttempts());
        return dispatch(child, stepId, scope, policy);
    }

    static Map<String, Object> childArgs(Node node) {
        if (node.arg("args") instanceof Map<?, ?> explicit) {
            var copy = new LinkedHashMap<String, Object>();
            explicit.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return without(node.args(), RETRY_CONTROL_KEYS);
    }

    private static Map<String, Object> without(Map<String, Object> args, Set<String> keys) {
        var copy = new LinkedHashMap<String, Object>();
        args.forEach((key, value) -> {
            if (!keys.contains(key)) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    static boolean isRunFatal(Throwable error) {
        return switch (Failures.classify(error)) {
            case HALT, FAIL_RUN -> true;
            case FAIL_NODE -> false;
        };
    }

    private static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new KernelException("interrupted", "Interrupted while waiting for a task", null, ex);
        } catch (ExecutionException ex) {
            var cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new KernelException("internal", String.valueOf(cause), null, cause);
        }
    }
}
