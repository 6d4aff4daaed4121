package io.amp.kernel.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.amp.kernel.error.PlanValidationException;
import io.amp.kernel.support.KernelTestSupport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PlanLoaderTest {
    @Test
    void loadsJsonPlanFromFile() {
        var plan = PlanLoader.loadFromFile(KernelTestSupport.resource("plans", "research.json"));

        assertEquals(List.of("search", "verify", "remember"), plan.nodeIds());
        assertEquals(Operation.MEMORY_WRITE, plan.node("remember").orElseThrow().op());
        assertEquals(1.0, plan.signals().costCapUsd());
        assertEquals(60000L, plan.signals().latencyBudgetMs());
        assertEquals(0.7, plan.stopConditions().minConfidence());
        assertEquals(List.of("verify"), plan.successors("search"));
    }

    @Test
    void loadsYamlPlanWithOperationAliases() {
        var plan = PlanLoader.loadFromFile(KernelTestSupport.resource("plans", "research.yaml"));

        assertEquals(Operation.MEMORY_READ, plan.node("recall").orElseThrow().op());
        assertEquals("$question", plan.node("search").orElseThrow().arg("query"));
        assertEquals(0.5, plan.signals().costCapUsd());
    }

    @Test
    void missingSectionsDefaultToEmpty() {
        var plan = PlanLoader.parseJson("{\"nodes\": [{\"id\": \"a\", \"op\": \"assert\", \"args\": {\"condition\": \"true\"}}]}");

        assertEquals(Signals.NONE, plan.signals());
        assertEquals(StopConditions.NONE, plan.stopConditions());
        assertTrue(plan.edges().isEmpty());
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(PlanValidationException.class, () -> PlanLoader.parseJson("{\"nodes\": ["));
        var unknownOp = assertThrows(PlanValidationException.class,
            () -> PlanLoader.parseJson("{\"nodes\": [{\"id\": \"a\", \"op\": \"teleport\"}]}"));
        assertEquals("validation", unknownOp.code());
    }

    @Test
    void convertsInlineTaskDefinitions() {
        var node = PlanLoader.nodeFromMap(Map.of("id", "child", "op", "call", "tool", "t", "args", Map.of("x", 1)));

        assertEquals("child", node.id());
        assertEquals(Operation.CALL, node.op());
        assertEquals(1, node.arg("x"));
    }

    @Test
    void serializesWireNames() {
        var plan = PlanLoader.parseYaml("nodes:\n  - id: w\n    op: memory_write\n    args: {key: k}\n");

        assertTrue(PlanLoader.toJson(plan).contains("\"op\":\"mem.write\""));
    }
}
