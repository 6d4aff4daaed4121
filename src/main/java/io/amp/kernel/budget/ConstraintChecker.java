package io.amp.kernel.budget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.amp.kernel.error.ConstraintViolationException;
import io.amp.kernel.plan.Plan;
import io.amp.kernel.tools.ToolSpec;
import io.amp.kernel.tools.ToolSpecCache;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class ConstraintChecker {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int CHARS_PER_TOKEN = 4;

    private ConstraintChecker() {}

    /**
     * @throws BudgetExceededException when the run has no headroom left
     * @throws ConstraintViolationException when the arguments exceed {@code input_tokens_max}
     */
    public static void preflight(ToolSpec spec, Map<String, Object> args, BudgetTracker tracker) {
        var exhaustion = tracker.exhaustion();
        if (exhaustion.isPresent()) {
            throw new BudgetExceededException(exhaustion.get());
        }
        var maxTokens = spec.constraints().inputTokensMax();
        if (maxTokens != null) {
            var estimated = estimateTokens(args);
            if (estimated > maxTokens) {
                throw new ConstraintViolationException(spec.name(),
                    "Input too large for " + spec.name() + ": ~" + estimated + " tokens > input_tokens_max " + maxTokens);
            }
        }
    }

    public static Optional<String> exceedsRemaining(ToolSpec spec, BudgetSnapshot snapshot) {
        var costHeadroom = snapshot.costHeadroomUsd();
        if (costHeadroom != null && spec.estimatedCostUsd() > costHeadroom) {
            return Optional.of("exceeds remaining cost budget");
        }
        var latencyHeadroom = snapshot.latencyHeadroomMs();
        if (latencyHeadroom != null && spec.estimatedLatencyMs() > latencyHeadroom) {
            return Optional.of("exceeds remaining latency budget");
        }
        return Optional.empty();
    }

    public static long estimateTokens(Object value) {
        if (value == null) {
            return 0L;
        }
        String text;
        if (value instanceof String str) {
            text = str;
        } else {
            try {
                text = JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                text = String.valueOf(value);
            }
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static PlanEstimate estimate(Plan plan, ToolSpecCache cache) {
        double cost = 0.0;
        long latency = 0L;
        for (var node : plan.nodes()) {
            Optional<ToolSpec> spec = Optional.empty();
            if (node.hasTool()) {
                spec = cache.get(node.tool()).map(tool -> tool.spec());
            } else if (node.hasCapability()) {
                spec = cache.withCapability(node.capability()).stream()
                    .map(tool -> tool.spec())
                    .min(Comparator.comparingDouble(ToolSpec::estimatedCostUsd));
            }
            if (spec.isPresent()) {
                cost += spec.get().estimatedCostUsd();
                latency += spec.get().estimatedLatencyMs();
            }
        }
        var signals = plan.signals();
        return new PlanEstimate(cost, latency,
            signals.costCapUsd() != null && cost > signals.costCapUsd(),
            signals.latencyBudgetMs() != null && latency > signals.latencyBudgetMs());
    }

    public record PlanEstimate(double costUsd, long latencyMs, boolean exceedsCost, boolean exceedsLatency) {
        public boolean withinCaps() {
            return !exceedsCost && !exceedsLatency;
        }

        public Map<String, Object> toData() {
            var data = new LinkedHashMap<String, Object>();
            data.put("kind", "plan_estimate");
            data.put("estimated_cost_usd", costUsd);
            data.put("estimated_latency_ms", latencyMs);
            data.put("exceeds_cost_cap", exceedsCost);
            data.put("exceeds_latency_budget", exceedsLatency);
            return data;
        }
    }
}
