package io.amp.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.amp.kernel.config.KernelSettings;
import io.amp.kernel.error.AssertionFailedException;
import io.amp.kernel.error.ToolInvocationException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {
    private static final KernelSettings.RetrySettings DEFAULTS = new KernelSettings.RetrySettings(3, Duration.ofMillis(100), 2.0);

    @Test
    void backoffGrowsByMultiplier() {
        var policy = RetryPolicy.from(Map.of(), DEFAULTS);

        assertEquals(3, policy.maxAttempts());
        assertEquals(100L, policy.intervals().apply(1));
        assertEquals(200L, policy.intervals().apply(2));
        assertEquals(400L, policy.intervals().apply(3));
        assertEquals(0L, new RetryPolicy(3, Duration.ZERO, 2.0).intervals().apply(2));
    }

    @Test
    void nodeArgumentsOverrideDefaults() {
        var policy = RetryPolicy.from(Map.of("attempts", 5, "backoff", "1s", "multiplier", 1.5), DEFAULTS);

        assertEquals(new RetryPolicy(5, Duration.ofSeconds(1), 1.5), policy);
        assertEquals(Duration.ofMillis(10), RetryPolicy.from(Map.of("backoff_ms", 10), DEFAULTS).backoff());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.from(Map.of("multiplier", 0.5), DEFAULTS));
    }

    @Test
    void retriesOnlyToolInvocationErrors() {
        var policy = new RetryPolicy(3, Duration.ZERO, 1.0);
        var calls = new AtomicInteger();

        var result = RetryDecorator.execute(policy, "step", attempt -> {
            calls.incrementAndGet();
            if (attempt < 3) {
                throw new ToolInvocationException("t", "boom", attempt == 1);
            }
            return "attempt " + attempt;
        });

        assertEquals("attempt 3", result);
        assertEquals(3, calls.get());

        var assertions = new AtomicInteger();
        assertThrows(AssertionFailedException.class, () -> RetryDecorator.execute(policy, "step", attempt -> {
            assertions.incrementAndGet();
            throw new AssertionFailedException("n", "false");
        }));
        assertEquals(1, assertions.get());
    }

    @Test
    void exhaustionRethrowsTheLastError() {
        var policy = new RetryPolicy(2, Duration.ZERO, 1.0);

        var ex = assertThrows(ToolInvocationException.class, () -> RetryDecorator.execute(policy, "step", attempt -> {
            throw new ToolInvocationException("t", "attempt " + attempt, false);
        }));

        assertEquals("attempt 2", ex.getMessage());
    }
}
