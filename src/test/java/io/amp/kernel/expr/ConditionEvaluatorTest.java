package io.amp.kernel.expr;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.amp.kernel.error.ArgumentResolutionException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConditionEvaluatorTest {
    private static final Map<String, Object> SCOPE = Map.of(
        "verify", Map.of("confidence", 0.82, "label", "supported"),
        "search", Map.of("results", List.of(Map.of("title", "Paris")), "total", 3),
        "flag", true
    );

    @Test
    void comparesNumbersAcrossReferencesAndLiterals() {
        assertTrue(ConditionEvaluator.evaluate("$verify.confidence >= 0.8", SCOPE));
        assertFalse(ConditionEvaluator.evaluate("$verify.confidence > 0.9", SCOPE));
        assertTrue(ConditionEvaluator.evaluate("search.total == 3", SCOPE));
    }

    @Test
    void combinesWithBooleanOperators() {
        assertTrue(ConditionEvaluator.evaluate("$flag && ($search.total < 5 || false)", SCOPE));
        assertTrue(ConditionEvaluator.evaluate("not $missing and $verify.label == 'supported'", SCOPE));
        assertFalse(ConditionEvaluator.evaluate("!$flag", SCOPE));
    }

    @Test
    void supportsContainsAndMatches() {
        assertTrue(ConditionEvaluator.evaluate("$verify.label contains 'port'", SCOPE));
        assertTrue(ConditionEvaluator.evaluate("$search.results[0].title matches '^Par'", SCOPE));
    }

    @Test
    void missingPathsAreFalsyAndNeverSatisfyOrdering() {
        assertFalse(ConditionEvaluator.evaluate("$search.results[5].title", SCOPE));
        assertFalse(ConditionEvaluator.evaluate("$nothing.here >= 0", SCOPE));
        assertTrue(ConditionEvaluator.evaluate("$nothing == null", SCOPE));
    }

    @Test
    void malformedConditionsAreResolutionErrors() {
        assertThrows(ArgumentResolutionException.class, () -> ConditionEvaluator.evaluate("($flag", SCOPE));
        assertThrows(ArgumentResolutionException.class, () -> ConditionEvaluator.evaluate("'open", SCOPE));
        assertThrows(ArgumentResolutionException.class, () -> ConditionEvaluator.evaluate(" ", SCOPE));
    }
}
