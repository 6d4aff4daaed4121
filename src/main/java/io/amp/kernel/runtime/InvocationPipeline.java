package io.amp.kernel.runtime;

import io.amp.kernel.budget.BudgetExceededException;
import io.amp.kernel.budget.ConstraintChecker;
import io.amp.kernel.budget.Usage;
import io.amp.kernel.error.ConstraintViolationException;
import io.amp.kernel.error.KernelException;
import io.amp.kernel.error.RoutingException;
import io.amp.kernel.error.ToolInvocationException;
import io.amp.kernel.plan.Node;
import io.amp.kernel.plan.Operation;
import io.amp.kernel.policy.Citations;
import io.amp.kernel.policy.PolicyEngine;
import io.amp.kernel.policy.PolicyViolation;
import io.amp.kernel.policy.PolicyViolationException;
import io.amp.kernel.route.CapabilityRouter;
import io.amp.kernel.tools.RegisteredTool;
import io.amp.kernel.tools.ToolInvoker;
import io.amp.kernel.tools.ToolResponse;
import io.amp.kernel.trace.TraceEventType;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One tool invocation with its fixed pre/post steps: route, pre-flight (budget headroom, input size,
 * {@code deny_if}), timed call, budget update, trace, budget verdict, attribution check.
 */
final class InvocationPipeline {
    private static final Logger log = LoggerFactory.getLogger(InvocationPipeline.class);

    private final ExecutionContext ctx;
    private final ToolInvoker invoker;
    private final ExecutorService ioPool;

    InvocationPipeline(ExecutionContext ctx, ToolInvoker invoker, ExecutorService ioPool) {
        this.ctx = ctx;
        this.invoker = invoker;
        this.ioPool = ioPool;
    }

    record Outcome(RegisteredTool tool, Object output, List<String> citations, Usage usage) {}

    Outcome invoke(Node node, String stepId, Map<String, Object> args) {
        var tool = target(node, stepId, args);
        preflight(tool, stepId, args);
        return call(tool, stepId, args);
    }

    RegisteredTool target(Node node, String stepId, Map<String, Object> args) {
        if (node.hasCapability()) {
            try {
                var decision = CapabilityRouter.route(node.capability(), ctx.tools(), ctx.budget().snapshot(), args);
                ctx.trace().emit(stepId, TraceEventType.CAPABILITY_ROUTE, decision.toData());
                return decision.selected();
            } catch (RoutingException ex) {
                var data = new LinkedHashMap<String, Object>();
                data.put("capability", node.capability());
                data.put("error", "RoutingError");
                data.put("message", ex.getMessage());
                ctx.trace().emit(stepId, TraceEventType.CAPABILITY_ROUTE, data);
                throw ex;
            }
        }
        var name = node.hasTool() ? node.tool() : configuredTool(node.op());
        return ctx.tools().get(name)
            .orElseThrow(() -> new ToolInvocationException(name, "Tool " + name + " is not in the registry snapshot", false));
    }

    private String configuredTool(Operation op) {
        return switch (op) {
            case MEMORY_READ, MEMORY_WRITE -> ctx.settings().memoryTool();
            case VERIFY -> ctx.settings().verifyTool();
            default -> throw new ToolInvocationException(op.wireName(), "Operation " + op.wireName() + " needs a tool or capability", false);
        };
    }

    private void preflight(RegisteredTool tool, String stepId, Map<String, Object> args) {
        var spec = tool.spec();
        try {
            ConstraintChecker.preflight(spec, args, ctx.budget());
        } catch (BudgetExceededException ex) {
            emitCheck(stepId, "preflight", tool, "BudgetExceeded", ex.getMessage(), ex.verdict().toData());
            throw ex;
        } catch (ConstraintViolationException ex) {
            emitCheck(stepId, "preflight", tool, "ConstraintViolation", ex.getMessage(), null);
            throw ex;
        }
        var denied = PolicyEngine.checkDenyRules(spec, args);
        if (denied.isPresent()) {
            emitCheck(stepId, "preflight", tool, "PolicyViolation", denied.get().message(), null);
            emitViolation(stepId, denied.get());
            throw new PolicyViolationException(denied.get());
        }
        emitCheck(stepId, "preflight", tool, null, null, null);
    }

    private Outcome call(RegisteredTool tool, String stepId, Map<String, Object> args) {
        var spec = tool.spec();
        long started = System.nanoTime();
        ToolResponse response = null;
        KernelException failure = null;
        try {
            response = invokeWithTimeout(tool, stepId, args);
        } catch (KernelException ex) {
            failure = ex;
        }
        long wallClockMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        Usage usage;
        var data = new LinkedHashMap<String, Object>();
        data.put("tool", tool.name());
        data.put("args", args);
        if (response != null) {
            var reported = response.reportedUsage();
            double cost = reported != null && reported.costUsd() != null ? reported.costUsd() : spec.estimatedCostUsd();
            long tokensIn = reported != null && reported.tokensIn() != null ? reported.tokensIn() : ConstraintChecker.estimateTokens(args);
            long tokensOut = reported != null && reported.tokensOut() != null
                ? reported.tokensOut()
                : ConstraintChecker.estimateTokens(response.output());
            long latency = response.latencyOverrideMs() != null ? response.latencyOverrideMs() : wallClockMs;
            usage = new Usage(cost, latency, tokensIn, tokensOut);
            data.put("output", response.output());
        } else {
            usage = new Usage(0.0, wallClockMs, ConstraintChecker.estimateTokens(args), 0L);
            data.put("error", failure.code());
            data.put("message", failure.getMessage());
        }
        data.put("latency_ms", usage.latencyMs());

        var verdict = ctx.budget().record(usage);
        var citations = response == null ? List.<String>of() : Citations.extract(response.output());
        ctx.trace().emit(stepId, TraceEventType.TOOL_INVOKE, data, usage.costUsd(), usage.tokensIn(), usage.tokensOut(),
            citations.isEmpty() ? null : citations);

        if (verdict.exceeded()) {
            emitCheck(stepId, "budget", tool, "BudgetExceeded", null, verdict.toData());
            throw new BudgetExceededException(verdict);
        }
        if (failure != null) {
            throw failure;
        }

        var attribution = PolicyEngine.checkAttribution(spec, citations, false);
        if (attribution.isPresent()) {
            log.warn("{}: {}", stepId, attribution.get().message());
            emitViolation(stepId, attribution.get());
        }
        return new Outcome(tool, response.output(), citations, usage);
    }

    private ToolResponse invokeWithTimeout(RegisteredTool tool, String stepId, Map<String, Object> args) {
        var timeout = tool.spec().constraints().timeoutMs() != null
            ? Duration.ofMillis(tool.spec().constraints().timeoutMs())
            : ctx.settings().defaultTimeout();
        var future = CompletableFuture.supplyAsync(() -> invoker.invoke(tool, args, stepId), ioPool);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ToolInvocationException(tool.name(), "Tool " + tool.name() + " timed out after " + timeout.toMillis() + " ms", true, ex);
        } catch (ExecutionException ex) {
            var cause = ex.getCause();
            if (cause instanceof KernelException kernel) {
                throw kernel;
            }
            throw new ToolInvocationException(tool.name(), "Tool " + tool.name() + " failed: " + cause, false, cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ToolInvocationException(tool.name(), "Interrupted while calling " + tool.name(), false, ex);
        }
    }

    private void emitCheck(String stepId, String kind, RegisteredTool tool, String error, String message, Map<String, Object> details) {
        var data = new LinkedHashMap<String, Object>();
        data.put("kind", kind);
        data.put("tool", tool.name());
        data.put("ok", error == null);
        if (error != null) {
            data.put("error", error);
        }
        if (message != null) {
            data.put("message", message);
        }
        if (details != null) {
            data.putAll(details);
        }
        ctx.trace().emit(stepId, TraceEventType.CONSTRAINT_CHECK, data);
    }

    void emitViolation(String stepId, PolicyViolation violation) {
        ctx.trace().emit(stepId, TraceEventType.POLICY_VIOLATION, violation.toData());
    }
}
