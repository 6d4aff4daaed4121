package io.amp.kernel.replay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.amp.kernel.error.ToolInvocationException;
import io.amp.kernel.plan.PlanLoader;
import io.amp.kernel.runtime.RunStatus;
import io.amp.kernel.support.KernelTestSupport;
import io.amp.kernel.support.KernelTestSupport.FakeToolInvoker;
import io.amp.kernel.trace.TraceEvent;
import io.amp.kernel.trace.TraceReader;
import io.amp.kernel.trace.TraceWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TraceReplayerTest {
    private static final io.amp.kernel.tools.ToolSpecCache TOOLS = KernelTestSupport.cache(
        KernelTestSupport.tool("doc.search.local", 0.001, 300, "search"),
        KernelTestSupport.tool("ground.verify", 0.002, 500, "verify"),
        KernelTestSupport.tool("mesh.mem.sqlite", 0.0, 20, "memory"));

    private static final Map<String, Object> INPUTS = Map.of("question", "capital of France");

    @TempDir
    Path tempDir;

    private List<TraceEvent> record() {
        var invoker = new FakeToolInvoker()
            .respond("doc.search.local", Map.of("results", List.of(Map.of("id", "doc-1", "url", "https://docs.example/paris"))))
            .respond("ground.verify", Map.of(
                "claims", List.of("c1"),
                "supports", List.of(Map.of("claim_id", "c1", "source", "doc-1", "confidence", 0.9)),
                "verdicts", List.of(Map.of("claim_id", "c1", "verdict", "supported", "confidence", 0.9))))
            .respond("mesh.mem.sqlite", Map.of("success", true));
        var plan = PlanLoader.loadFromFile(KernelTestSupport.resource("plans", "research.json"));
        var report = KernelTestSupport.scheduler(TOOLS, invoker).execute(plan, INPUTS);
        assertEquals(RunStatus.COMPLETED, report.status());
        return report.events();
    }

    @Test
    void replayReproducesRecordedDecisionsWithoutContactingTools() throws Exception {
        var file = tempDir.resolve("run.ndjson");
        try (var writer = new TraceWriter(file)) {
            record().forEach(writer::accept);
        }
        var recorded = TraceReader.read(file);
        var plan = PlanLoader.loadFromFile(KernelTestSupport.resource("plans", "research.json"));

        var result = new TraceReplayer(TOOLS, KernelTestSupport.settings()).replay(plan, INPUTS, recorded);

        assertTrue(result.matches(), () -> String.join("\n", result.mismatches()));
        assertEquals(RunStatus.COMPLETED, result.report().status());
        assertEquals(0.003, result.report().budget().totals().costUsd(), 1e-9);
        assertEquals(recorded.get(0).planId(), result.report().planId());
        assertTrue(Files.size(file) > 0);
    }

    @Test
    void changedPlanIsReportedAsDivergence() {
        var recorded = record();
        var shorter = KernelTestSupport.plan("""
            {"signals": {"latency_budget_ms": 60000, "cost_cap_usd": 1.0},
             "nodes": [
               {"id": "search", "op": "call", "tool": "doc.search.local", "args": {"query": "$question", "k": 3}},
               {"id": "verify", "op": "verify", "tool": "ground.verify", "args": {"claims": "$search.results"}}
             ],
             "edges": [{"from": "search", "to": "verify"}],
             "stop_conditions": {"min_confidence": 0.7}}
            """);

        var result = new TraceReplayer(TOOLS, KernelTestSupport.settings()).replay(shorter, INPUTS, recorded);

        assertFalse(result.matches());
        assertTrue(result.mismatches().stream().anyMatch(m -> m.startsWith("step remember")));
        assertTrue(result.mismatches().stream().anyMatch(m -> m.contains("never replayed")));
    }

    @Test
    void replayInvokerServesRecordingsPerStepInOrder() {
        var recorded = record();
        var invoker = new ReplayToolInvoker(recorded);
        var search = TOOLS.get("doc.search.local").orElseThrow();

        var response = invoker.invoke(search, Map.of(), "search");

        assertEquals(Map.of("results", List.of(Map.of("id", "doc-1", "url", "https://docs.example/paris"))), response.output());
        assertEquals(0.001, response.reportedUsage().costUsd());
        assertEquals(1L, response.latencyOverrideMs());
        assertThrows(ToolInvocationException.class, () -> invoker.invoke(search, Map.of(), "search"));
        assertThrows(ToolInvocationException.class, () -> invoker.invoke(search, Map.of(), "verify"));
        // the mismatched "verify" lookup still consumed its recording; only "remember" is left
        assertEquals(1, invoker.unconsumed());
    }
}
