package io.amp.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.amp.kernel.support.KernelTestSupport;
import io.amp.kernel.support.KernelTestSupport.FakeToolInvoker;
import io.amp.kernel.tools.RegisteredTool;
import io.amp.kernel.trace.TraceReader;
import io.amp.kernel.trace.TraceSigner;
import io.amp.kernel.trace.TraceVerifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KernelRunnerTest {
    @TempDir
    Path tempDir;

    private static List<RegisteredTool> tools() {
        return List.of(
            KernelTestSupport.tool("doc.search.local", 0.001, 300, "search"),
            KernelTestSupport.tool("ground.verify", 0.002, 500, "verify"),
            KernelTestSupport.tool("mesh.mem.sqlite", 0.0, 20, "memory"));
    }

    private static FakeToolInvoker invoker() {
        return new FakeToolInvoker()
            .respond("doc.search.local", Map.of("results", List.of(Map.of("id", "doc-1"))))
            .respond("ground.verify", Map.of(
                "claims", List.of("c1"),
                "supports", List.of(Map.of("claim_id", "c1", "source", "doc-1", "confidence", 0.95)),
                "verdicts", List.of(Map.of("claim_id", "c1", "verdict", "supported", "confidence", 0.95))))
            .respond("mesh.mem.sqlite", Map.of("success", true));
    }

    @Test
    void runsLocalPlanAndWritesSignedTrace() throws Exception {
        var config = tempDir.resolve("amp.toml");
        Files.writeString(config, "[kernel]\nsigning_key = \"runner-key\"\n");
        var traceFile = tempDir.resolve("out").resolve("trace.ndjson");

        var result = new KernelRunner().run(KernelRunConfiguration.builder()
            .planTarget(PlanTarget.forLocal(KernelTestSupport.resource("plans", "research.json")))
            .inputPayload("{\"question\": \"capital of France\"}")
            .configFile(config)
            .traceOut(traceFile)
            .tools(tools())
            .invoker(invoker())
            .build());

        assertEquals(RunResult.Status.COMPLETED, result.status(), () -> result.toPrettyJson());
        assertEquals("completed", result.metadata().get("status"));
        assertEquals(traceFile.toString(), result.metadata().get("trace_file"));
        var events = TraceReader.read(traceFile);
        assertEquals(result.metadata().get("trace_events"), events.size());
        assertTrue(TraceVerifier.verify(events, TraceSigner.fromSecret("runner-key")).valid());
        assertEquals("completed", result.toSerializableMap().get("status"));
    }

    @Test
    void unreadablePlanIsReportedAsFailure() {
        var missing = tempDir.resolve("missing.json");

        var result = new KernelRunner().run(KernelRunConfiguration.builder()
            .planTarget(PlanTarget.forLocal(missing))
            .configFile(tempDir.resolve("absent.toml"))
            .tools(tools())
            .invoker(invoker())
            .build());

        assertEquals(RunResult.Status.FAILED, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("validation", result.metadata().get("code"));
        assertTrue(String.valueOf(result.metadata().get("error")).contains("missing.json"));
    }

    @Test
    void invalidPlanNeverRuns() throws Exception {
        var plan = tempDir.resolve("cyclic.json");
        Files.writeString(plan, """
            {"nodes": [
              {"id": "a", "op": "call", "tool": "doc.search.local"},
              {"id": "b", "op": "call", "tool": "doc.search.local"}
            ],
            "edges": [{"from": "a", "to": "b"}, {"from": "b", "to": "a"}]}
            """);
        var tools = invoker();

        var result = new KernelRunner().run(KernelRunConfiguration.builder()
            .planTarget(PlanTarget.forLocal(plan))
            .configFile(tempDir.resolve("absent.toml"))
            .tools(tools())
            .invoker(tools)
            .build());

        assertEquals(RunResult.Status.FAILED, result.status());
        assertEquals("validation", result.metadata().get("code"));
        assertTrue(tools.calls().isEmpty());
    }

    @Test
    void budgetHaltMapsToHaltedExitCode() throws Exception {
        var plan = tempDir.resolve("tight.yaml");
        Files.writeString(plan, String.join("\n",
            "signals:",
            "  cost_cap_usd: 0.0005",
            "nodes:",
            "  - id: search",
            "    op: call",
            "    tool: doc.search.local",
            "    args:",
            "      query: $question",
            ""));

        var result = new KernelRunner().run(KernelRunConfiguration.builder()
            .planTarget(PlanTarget.forLocal(plan))
            .inputPayload("{\"question\": \"q\"}")
            .configFile(tempDir.resolve("absent.toml"))
            .tools(tools())
            .invoker(invoker())
            .build());

        assertEquals(RunResult.Status.HALTED, result.status());
        assertEquals(2, result.status().exitCode());
    }
}
