package io.amp.kernel.runtime;

import io.amp.kernel.budget.BudgetTracker;
import io.amp.kernel.budget.ConstraintChecker;
import io.amp.kernel.config.KernelSettings;
import io.amp.kernel.error.KernelException;
import io.amp.kernel.optimizer.ExecutionOrder;
import io.amp.kernel.optimizer.PlanOptimizer;
import io.amp.kernel.plan.DependencyGraph;
import io.amp.kernel.plan.Node;
import io.amp.kernel.plan.Plan;
import io.amp.kernel.plan.PlanValidator;
import io.amp.kernel.tools.ToolInvoker;
import io.amp.kernel.tools.ToolSpecCache;
import io.amp.kernel.trace.TraceEmitter;
import io.amp.kernel.trace.TraceEventType;
import io.amp.kernel.trace.TraceSigner;
import io.amp.kernel.trace.TraceSink;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes validated plans. Nodes are admitted in optimizer order as soon as their own dependencies
 * have completed, so work overlaps across wave boundaries; at most {@code max_parallelism} nodes run
 * at once. A run-fatal error stops admission, lets in-flight nodes finish and skips the rest.
 *
 * <p>A scheduler can serve many runs concurrently; each run gets its own {@link ExecutionContext}
 * and a private copy of the tool cache taken when the run starts.
 */
public final class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger(1);

    public static final String PLAN_STEP = "plan";
    public static final String SUMMARY_STEP = "budget_summary";

    private final ToolSpecCache tools;
    private final ToolInvoker invoker;
    private final KernelSettings settings;
    private final TraceSigner signer;

    public Scheduler(ToolSpecCache tools, ToolInvoker invoker, KernelSettings settings, TraceSigner signer) {
        this.tools = Objects.requireNonNull(tools, "tools");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.settings = settings == null ? KernelSettings.defaults() : settings;
        this.signer = signer == null ? TraceSigner.ephemeral() : signer;
    }

    public ExecutionReport execute(Plan plan, Map<String, Object> inputs) {
        return execute(UUID.randomUUID().toString(), plan, inputs, TraceSink.NOOP);
    }

    /**
     * @throws io.amp.kernel.error.PlanValidationException before anything runs when the plan is invalid
     */
    public ExecutionReport execute(String planId, Plan plan, Map<String, Object> inputs, TraceSink sink) {
        var initial = inputs == null ? Map.<String, Object>of() : inputs;
        PlanValidator.validate(plan, tools.names(), initial.keySet());

        var runTools = new ToolSpecCache(tools.snapshot());
        var trace = new TraceEmitter(planId, signer, sink);
        var ctx = new ExecutionContext(plan, runTools, settings, BudgetTracker.forSignals(plan.signals()), trace);
        ctx.bindInputs(initial);

        var order = PlanOptimizer.optimize(plan, runTools);
        traceOptimization(ctx, order);
        log.info("Executing plan {} ({} node(s) in {} wave(s))", planId, plan.nodes().size(), order.waves().size());

        var workers = Executors.newFixedThreadPool(settings.maxParallelism(), threadFactory("amp-node"));
        var io = Executors.newCachedThreadPool(threadFactory("amp-io"));
        var fanout = Executors.newCachedThreadPool(threadFactory("amp-fanout"));
        try {
            var executor = new NodeExecutor(ctx, new InvocationPipeline(ctx, invoker, io), fanout);
            admit(ctx, order, executor, workers);
        } finally {
            workers.shutdown();
            fanout.shutdown();
            io.shutdown();
        }
        return finish(ctx);
    }

    private void traceOptimization(ExecutionContext ctx, ExecutionOrder order) {
        var data = new LinkedHashMap<String, Object>();
        data.put("waves", order.waves());
        data.put("reorderings", order.reorderings().size());
        ctx.trace().emit(PLAN_STEP, TraceEventType.PLAN_OPTIMIZER, data);
        for (var reordering : order.reorderings()) {
            ctx.trace().emit(PLAN_STEP, TraceEventType.PLAN_OPTIMIZER, reordering.toData());
        }
        var estimate = ConstraintChecker.estimate(ctx.plan(), ctx.tools());
        ctx.trace().emit(PLAN_STEP, TraceEventType.CONSTRAINT_CHECK, estimate.toData());
        if (!estimate.withinCaps()) {
            log.warn("Plan {} is estimated at ${} / {} ms, above its declared caps", ctx.planId(), estimate.costUsd(), estimate.latencyMs());
        }
    }

    private void admit(ExecutionContext ctx, ExecutionOrder order, NodeExecutor executor, ExecutorService workers) {
        var graph = DependencyGraph.of(ctx.plan());
        var completion = new ExecutorCompletionService<String>(workers);
        var maxNodes = ctx.plan().stopConditions().maxNodes();
        int admitted = 0;
        int inFlight = 0;
        // a stop condition ends admission but lets admitted nodes run; it is recorded once they drain
        Halt limit = null;
        while (true) {
            boolean progressed = true;
            while (progressed && !ctx.isHalted() && limit == null) {
                progressed = false;
                for (var nodeId : order.flatOrder()) {
                    if (ctx.isHalted()) {
                        break;
                    }
                    if (ctx.state(nodeId) != NodeState.PENDING) {
                        continue;
                    }
                    var blocker = blockedBy(ctx, graph, nodeId);
                    if (blocker != null) {
                        progressed |= ctx.skip(nodeId, "dependency " + blocker + " " + ctx.state(blocker).wireName());
                        continue;
                    }
                    if (!ready(ctx, graph, nodeId)) {
                        continue;
                    }
                    if (maxNodes != null && admitted >= maxNodes) {
                        limit = new Halt(RunStatus.HALTED, "stop_condition", nodeId, "max_nodes " + maxNodes + " reached");
                        log.warn("Plan {} reached max_nodes {}; not admitting {}", ctx.planId(), maxNodes, nodeId);
                        break;
                    }
                    if (!ctx.transition(nodeId, NodeState.PENDING, NodeState.READY)) {
                        continue;
                    }
                    var node = ctx.plan().node(nodeId).orElseThrow();
                    var wave = order.waveOf(nodeId);
                    completion.submit(() -> {
                        runNode(ctx, executor, node, wave);
                        return nodeId;
                    });
                    admitted++;
                    inFlight++;
                }
            }
            if (inFlight == 0) {
                break;
            }
            awaitOne(completion);
            inFlight--;
        }
        if (limit != null) {
            ctx.halt(limit);
        }
    }

    private static String blockedBy(ExecutionContext ctx, DependencyGraph graph, String nodeId) {
        for (var dependency : graph.predecessors(nodeId)) {
            var state = ctx.state(dependency);
            if (state == NodeState.FAILED || state == NodeState.SKIPPED) {
                return dependency;
            }
        }
        return null;
    }

    private static boolean ready(ExecutionContext ctx, DependencyGraph graph, String nodeId) {
        return graph.predecessors(nodeId).stream().allMatch(dependency -> ctx.state(dependency) == NodeState.COMPLETED);
    }

    private static void awaitOne(ExecutorCompletionService<String> completion) {
        try {
            completion.take().get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new KernelException("interrupted", "Interrupted while waiting for plan nodes", null, ex);
        } catch (ExecutionException ex) {
            // runNode handles every exception itself; anything reaching here is an Error
            log.error("Node task terminated abnormally", ex.getCause());
        }
    }

    private void runNode(ExecutionContext ctx, NodeExecutor executor, Node node, int wave) {
        var nodeId = node.id();
        if (ctx.isHalted()) {
            ctx.skip(nodeId, "run halted");
            return;
        }
        if (!ctx.transition(nodeId, NodeState.READY, NodeState.RUNNING)) {
            return;
        }
        var start = new LinkedHashMap<String, Object>();
        start.put("op", node.op().wireName());
        start.put("target", node.target());
        start.put("wave", wave);
        ctx.trace().emit(nodeId, TraceEventType.STEP_START, start);
        log.debug("Node {} started ({})", nodeId, node.target());
        try {
            var output = executor.execute(node, nodeId);
            ctx.publish(node, output);
            ctx.setState(nodeId, NodeState.COMPLETED);
            var end = new LinkedHashMap<String, Object>();
            end.put("status", NodeState.COMPLETED.wireName());
            ctx.trace().emit(nodeId, TraceEventType.STEP_END, end);
            log.debug("Node {} completed", nodeId);
        } catch (KernelException ex) {
            fail(ctx, nodeId, ex);
        } catch (RuntimeException ex) {
            log.error("Node {} failed unexpectedly", nodeId, ex);
            fail(ctx, nodeId, ex);
        }
    }

    private void fail(ExecutionContext ctx, String nodeId, RuntimeException error) {
        var code = Failures.code(error);
        var message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        ctx.setState(nodeId, NodeState.FAILED);
        ctx.recordFailure(new NodeFailure(nodeId, code, message));
        var end = new LinkedHashMap<String, Object>();
        end.put("status", NodeState.FAILED.wireName());
        end.put("error", code);
        end.put("message", message);
        ctx.trace().emit(nodeId, TraceEventType.STEP_END, end);
        switch (Failures.classify(error)) {
            case HALT -> {
                if (ctx.halt(new Halt(RunStatus.HALTED, code, nodeId, message))) {
                    log.warn("Plan {} halted at {}: {}", ctx.planId(), nodeId, message);
                }
            }
            case FAIL_RUN -> {
                if (ctx.halt(new Halt(RunStatus.FAILED, code, nodeId, message))) {
                    log.warn("Plan {} failed at {}: {}", ctx.planId(), nodeId, message);
                }
            }
            case FAIL_NODE -> log.warn("Node {} failed ({}): {}", nodeId, code, message);
        }
    }

    private ExecutionReport finish(ExecutionContext ctx) {
        for (var nodeId : ctx.plan().nodeIds()) {
            var state = ctx.state(nodeId);
            if (state == NodeState.PENDING || state == NodeState.READY) {
                ctx.skip(nodeId, ctx.isHalted() ? "run halted" : "unreachable");
            }
        }
        var halt = ctx.haltReason().orElse(null);
        RunStatus status;
        if (halt != null) {
            status = halt.status();
        } else if (!ctx.failures().isEmpty()) {
            status = RunStatus.FAILED;
        } else {
            status = RunStatus.COMPLETED;
        }

        var budget = ctx.budget().snapshot();
        var summary = new LinkedHashMap<String, Object>();
        summary.put("kind", SUMMARY_STEP);
        summary.put("status", status.wireName());
        summary.putAll(budget.toData());
        if (halt != null) {
            summary.put("halt", halt.toData());
        }
        var totals = budget.totals();
        ctx.trace().emit(SUMMARY_STEP, TraceEventType.CONSTRAINT_CHECK, summary,
            totals.costUsd(), totals.tokensIn(), totals.tokensOut(), null);
        log.info("Plan {} finished {} (cost ${}, latency {} ms, {} invocation(s))",
            ctx.planId(), status.wireName(), totals.costUsd(), totals.latencyMs(), budget.invocations());

        var outputs = new LinkedHashMap<String, Object>();
        var scope = ctx.scope();
        for (var nodeId : ctx.plan().nodeIds()) {
            if (ctx.state(nodeId) == NodeState.COMPLETED) {
                outputs.put(nodeId, scope.get(nodeId));
            }
        }
        return new ExecutionReport(ctx.planId(), status, ctx.states(), outputs, ctx.failures(), halt, budget, ctx.trace().events());
    }

    private static ThreadFactory threadFactory(String prefix) {
        return runnable -> {
            var thread = new Thread(runnable);
            thread.setName(prefix + "-" + THREAD_SEQ.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
