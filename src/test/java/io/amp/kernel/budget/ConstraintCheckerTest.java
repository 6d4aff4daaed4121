package io.amp.kernel.budget;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.amp.kernel.error.ConstraintViolationException;
import io.amp.kernel.support.KernelTestSupport;
import io.amp.kernel.tools.ToolSpec;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConstraintCheckerTest {
    @Test
    void rejectsInputsAboveTokenLimit() {
        var tool = KernelTestSupport.tool("tiny", new ToolSpec.Constraints(10L, 0.01, 5L, null, null, null), null, null);

        assertDoesNotThrow(() -> ConstraintChecker.preflight(tool.spec(), Map.of("q", "hi"), new BudgetTracker(null, null)));
        var ex = assertThrows(ConstraintViolationException.class,
            () -> ConstraintChecker.preflight(tool.spec(), Map.of("q", "a much longer question than five tokens"), new BudgetTracker(null, null)));
        assertEquals("constraint_violation", ex.code());
    }

    @Test
    void rejectsCallsWithoutHeadroom() {
        var tool = KernelTestSupport.tool("search", 0.01, 10);
        var tracker = new BudgetTracker(0.05, null);
        tracker.record(new Usage(0.05, 0, 0, 0));

        var ex = assertThrows(BudgetExceededException.class, () -> ConstraintChecker.preflight(tool.spec(), Map.of(), tracker));
        assertEquals(BudgetDimension.COST_USD, ex.verdict().dimension());
    }

    @Test
    void explainsWhyDeclaredCostDoesNotFit() {
        var tool = KernelTestSupport.tool("pricey", 0.50, 10);
        var snapshot = new BudgetTracker(0.10, null).snapshot();

        assertEquals("exceeds remaining cost budget", ConstraintChecker.exceedsRemaining(tool.spec(), snapshot).orElseThrow());
    }

    @Test
    void estimatesTokensAtFourCharactersEach() {
        assertEquals(0L, ConstraintChecker.estimateTokens(null));
        assertEquals(2L, ConstraintChecker.estimateTokens("12345678"));
        assertEquals(3L, ConstraintChecker.estimateTokens("123456789"));
    }

    @Test
    void estimatesWholePlanAgainstCaps() {
        var cache = KernelTestSupport.cache(
            KernelTestSupport.tool("search", 0.02, 300),
            KernelTestSupport.tool("llm.cheap", 0.01, 900, "summarize"),
            KernelTestSupport.tool("llm.big", 0.20, 400, "summarize"));
        var plan = KernelTestSupport.plan("{\"signals\": {\"cost_cap_usd\": 0.025, \"latency_budget_ms\": 5000},"
            + "\"nodes\": [{\"id\": \"a\", \"op\": \"call\", \"tool\": \"search\"},"
            + "{\"id\": \"b\", \"op\": \"call\", \"capability\": \"summarize\"}]}");

        var estimate = ConstraintChecker.estimate(plan, cache);

        assertEquals(0.03, estimate.costUsd(), 1e-9);
        assertEquals(1200L, estimate.latencyMs());
        assertTrue(estimate.exceedsCost());
        assertFalse(estimate.exceedsLatency());
        assertEquals("plan_estimate", estimate.toData().get("kind"));
    }
}
