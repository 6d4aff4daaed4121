package io.amp.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.amp.kernel.support.KernelTestSupport;
import io.amp.kernel.support.KernelTestSupport.FakeToolInvoker;
import io.amp.kernel.trace.TraceEvent;
import io.amp.kernel.trace.TraceEventType;
import io.amp.kernel.trace.TraceSigner;
import io.amp.kernel.trace.TraceVerifier;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * End-to-end runs of the research pipeline (search, verify, remember) against scripted tools.
 */
class SchedulerScenarioTest {
    private static final String PIPELINE = """
        {
          "signals": {"latency_budget_ms": 60000, "cost_cap_usd": %s},
          "nodes": [
            {"id": "search", "op": "call", "tool": "doc.search.local", "args": {"query": "$question", "k": 3}},
            {"id": "verify", "op": "verify", "tool": "ground.verify", "args": {"claims": "$search.results"}},
            {"id": "remember", "op": "memory-write", "tool": "mesh.mem.sqlite",
             "args": {"key": "answer", "value": "$search.results", "confidence": 0.9, "provenance": ["doc-1"]}}
          ],
          "edges": [{"from": "search", "to": "verify"}, {"from": "verify", "to": "remember"}],
          "stop_conditions": {"min_confidence": 0.8}
        }
        """;

    private static final Map<String, Object> INPUTS = Map.of("question", "What is the capital of France?");

    private static io.amp.kernel.tools.ToolSpecCache pipelineTools() {
        return KernelTestSupport.cache(
            KernelTestSupport.tool("doc.search.local", 0.001, 300, "search"),
            KernelTestSupport.tool("ground.verify", 0.002, 500, "verify"),
            KernelTestSupport.tool("mesh.mem.sqlite", 0.0, 20, "memory"));
    }

    private static FakeToolInvoker pipelineInvoker(double verifyConfidence) {
        return new FakeToolInvoker()
            .respond("doc.search.local", Map.of("results", List.of(
                Map.of("id", "doc-1", "title", "Paris", "url", "https://docs.example/paris"))))
            .respond("ground.verify", Map.of(
                "claims", List.of("c1"),
                "supports", List.of(Map.of("claim_id", "c1", "source", "doc-1", "confidence", verifyConfidence)),
                "verdicts", List.of(Map.of("claim_id", "c1", "verdict", "supported", "confidence", verifyConfidence)),
                "confidence", verifyConfidence))
            .respond("mesh.mem.sqlite", Map.of("success", true));
    }

    @Test
    void happyPathCompletesAndStoresTheAnswer() {
        var invoker = pipelineInvoker(0.91);
        var report = KernelTestSupport.scheduler(pipelineTools(), invoker)
            .execute(KernelTestSupport.plan(PIPELINE.formatted("1.0")), INPUTS);

        assertEquals(RunStatus.COMPLETED, report.status());
        assertTrue(report.states().values().stream().allMatch(state -> state == NodeState.COMPLETED));
        var memoryOps = report.events(TraceEventType.MEMORY_OP);
        assertEquals(1, memoryOps.size());
        assertEquals("write", memoryOps.get(0).data("operation"));
        assertEquals("What is the capital of France?", invoker.calls("doc.search.local").get(0).args().get("query"));
        assertEquals("write", invoker.calls("mesh.mem.sqlite").get(0).args().get("operation"));
        assertEquals(0.91, ((Map<?, ?>) report.output("verify")).get("confidence"));
        assertEquals(Map.of("accepted", true, "key", "answer", "success", true), report.output("remember"));
        assertEquals(0.003, report.budget().totals().costUsd(), 1e-9);
        assertTrue(TraceVerifier.verify(report.events(), TraceSigner.fromSecret(KernelTestSupport.SIGNING_KEY)).valid());
    }

    @Test
    void costCapBelowFirstCallHaltsAndSkipsTheRest() {
        var invoker = pipelineInvoker(0.91);
        var report = KernelTestSupport.scheduler(pipelineTools(), invoker)
            .execute(KernelTestSupport.plan(PIPELINE.formatted("0.0005")), INPUTS);

        assertEquals(RunStatus.HALTED, report.status());
        assertEquals("budget_exceeded", report.haltReason().orElseThrow().reason());
        assertEquals(NodeState.FAILED, report.state("search"));
        assertEquals(NodeState.SKIPPED, report.state("verify"));
        assertEquals(NodeState.SKIPPED, report.state("remember"));
        assertTrue(invoker.calls("ground.verify").isEmpty());

        var searchEvents = report.events("search");
        int invokeIndex = indexOf(searchEvents, event -> event.eventType() == TraceEventType.TOOL_INVOKE);
        int overrunIndex = indexOf(searchEvents, event -> event.isError("BudgetExceeded"));
        assertTrue(invokeIndex >= 0 && overrunIndex > invokeIndex);
        assertEquals("cost_usd", searchEvents.get(overrunIndex).data("dimension"));
    }

    @Test
    void lowConfidenceVerificationFailsTheRunBeforeMemoryWrite() {
        var invoker = pipelineInvoker(0.40);
        var report = KernelTestSupport.scheduler(pipelineTools(), invoker)
            .execute(KernelTestSupport.plan(PIPELINE.formatted("1.0")), INPUTS);

        assertEquals(RunStatus.FAILED, report.status());
        assertEquals("evidence_below_threshold", report.haltReason().orElseThrow().reason());
        assertEquals(NodeState.FAILED, report.state("verify"));
        assertEquals(NodeState.SKIPPED, report.state("remember"));
        assertTrue(invoker.calls("mesh.mem.sqlite").isEmpty());
        assertTrue(report.events(TraceEventType.EVIDENCE_CHECK).stream().anyMatch(event -> event.isError("EvidenceBelowThreshold")));
        assertTrue(report.events(TraceEventType.MEMORY_OP).isEmpty());
    }

    @Test
    void capabilityIsRoutedToTheCheapestTool() {
        var cache = KernelTestSupport.cache(
            KernelTestSupport.tool("search.premium", 0.0005, 200, "search"),
            KernelTestSupport.tool("search.basic", 0.0001, 200, "search"));
        var invoker = new FakeToolInvoker()
            .respond("search.basic", Map.of("results", List.of()))
            .respond("search.premium", Map.of("results", List.of()));
        var plan = KernelTestSupport.plan("""
            {"nodes": [{"id": "find", "op": "call", "capability": "search", "args": {"query": "$question"}}]}
            """);

        var report = KernelTestSupport.scheduler(cache, invoker).execute(plan, INPUTS);

        assertEquals(RunStatus.COMPLETED, report.status());
        assertEquals(1, invoker.calls().size());
        assertEquals("search.basic", invoker.calls().get(0).tool());
        var route = report.events(TraceEventType.CAPABILITY_ROUTE).get(0);
        assertEquals("search.basic", route.data("selected"));
        var rejected = (List<?>) route.data("rejected");
        assertEquals(1, rejected.size());
        assertEquals("search.premium", ((Map<?, ?>) rejected.get(0)).get("tool"));
        assertEquals("cost too high", ((Map<?, ?>) rejected.get(0)).get("reason"));
    }

    @Test
    void everyRunEndsWithABudgetSummary() {
        var report = KernelTestSupport.scheduler(pipelineTools(), pipelineInvoker(0.91))
            .execute(KernelTestSupport.plan(PIPELINE.formatted("1.0")), INPUTS);

        var events = report.events();
        var first = events.get(0);
        var last = events.get(events.size() - 1);
        assertEquals(Scheduler.PLAN_STEP, first.stepId());
        assertEquals(TraceEventType.PLAN_OPTIMIZER, first.eventType());
        assertEquals(Scheduler.SUMMARY_STEP, last.stepId());
        assertEquals("completed", last.data("status"));
        assertEquals(3, last.data("invocations"));
        for (int i = 0; i < events.size(); i++) {
            assertEquals(i, events.get(i).seq());
        }
    }

    private static int indexOf(List<TraceEvent> events, java.util.function.Predicate<TraceEvent> predicate) {
        for (int i = 0; i < events.size(); i++) {
            if (predicate.test(events.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
