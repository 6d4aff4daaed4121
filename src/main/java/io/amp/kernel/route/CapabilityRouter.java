package io.amp.kernel.route;

import io.amp.kernel.budget.BudgetSnapshot;
import io.amp.kernel.budget.ConstraintChecker;
import io.amp.kernel.error.RoutingException;
import io.amp.kernel.tools.RegisteredTool;
import io.amp.kernel.tools.ToolSpecCache;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a capability tag to one concrete tool: candidates that do not fit the remaining budget or
 * their own input limits are discarded, then the cheapest wins, then the fastest, then the first registered.
 * The same snapshot and headroom always yield the same choice.
 */
public final class CapabilityRouter {
    private static final Logger log = LoggerFactory.getLogger(CapabilityRouter.class);

    private static final Comparator<RegisteredTool> PREFERENCE = Comparator
        .comparingDouble((RegisteredTool tool) -> tool.spec().estimatedCostUsd())
        .thenComparingLong(tool -> tool.spec().estimatedLatencyMs());

    private CapabilityRouter() {}

    public static RouteDecision route(String capability, ToolSpecCache cache, BudgetSnapshot budget, Map<String, Object> args) {
        var candidates = cache.withCapability(capability);
        if (candidates.isEmpty()) {
            throw new RoutingException(capability, "No registered tool provides capability '" + capability + "'");
        }
        var rejected = new ArrayList<RouteDecision.Rejection>();
        var viable = new ArrayList<RegisteredTool>();
        for (var candidate : candidates) {
            var reason = preflightProblem(candidate, budget, args);
            if (reason == null) {
                viable.add(candidate);
            } else {
                rejected.add(rejection(candidate, reason));
            }
        }
        if (viable.isEmpty()) {
            throw new RoutingException(capability, "No tool for capability '" + capability + "' passes pre-flight: "
                + rejected.stream().map(r -> r.tool() + " (" + r.reason() + ")").toList());
        }
        // List.sort is stable, so registration order breaks remaining ties
        var ranked = new ArrayList<>(viable);
        ranked.sort(PREFERENCE);
        var selected = ranked.get(0);
        var losers = new ArrayList<RouteDecision.Rejection>();
        for (var candidate : candidates) {
            if (candidate == selected) {
                continue;
            }
            var prior = rejected.stream().filter(r -> r.tool().equals(candidate.name())).findFirst();
            losers.add(prior.orElseGet(() -> rejection(candidate, comparisonReason(selected, candidate))));
        }
        log.debug("Capability {} routed to {} ({} alternative(s) rejected)", capability, selected.name(), losers.size());
        return new RouteDecision(capability, selected, losers);
    }

    private static String preflightProblem(RegisteredTool candidate, BudgetSnapshot budget, Map<String, Object> args) {
        var budgetProblem = ConstraintChecker.exceedsRemaining(candidate.spec(), budget);
        if (budgetProblem.isPresent()) {
            return budgetProblem.get();
        }
        var maxTokens = candidate.spec().constraints().inputTokensMax();
        if (maxTokens != null && args != null && ConstraintChecker.estimateTokens(args) > maxTokens) {
            return "input exceeds input_tokens_max";
        }
        return null;
    }

    private static String comparisonReason(RegisteredTool selected, RegisteredTool candidate) {
        if (candidate.spec().estimatedCostUsd() > selected.spec().estimatedCostUsd()) {
            return "cost too high";
        }
        if (candidate.spec().estimatedLatencyMs() > selected.spec().estimatedLatencyMs()) {
            return "latency too high";
        }
        return "registered later";
    }

    private static RouteDecision.Rejection rejection(RegisteredTool tool, String reason) {
        return new RouteDecision.Rejection(tool.name(), reason, tool.spec().estimatedCostUsd(), tool.spec().estimatedLatencyMs());
    }

}
