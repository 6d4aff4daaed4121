package io.amp.kernel.runtime;

import io.amp.kernel.config.KernelSettings;
import io.amp.kernel.shared.DurationParser;
import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import java.util.Map;

public record RetryPolicy(int maxAttempts, Duration backoff, double multiplier) {
    public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, 1.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max_attempts must be at least 1");
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    /**
     * Reads {@code max_attempts}, {@code backoff_ms} or {@code backoff}, and {@code multiplier} from a
     * {@code retry} node's arguments, falling back to the configured defaults.
     */
    public static RetryPolicy from(Map<String, Object> args, KernelSettings.RetrySettings defaults) {
        int attempts = defaults.maxAttempts();
        if (args.get("max_attempts") instanceof Number number) {
            attempts = number.intValue();
        } else if (args.get("attempts") instanceof Number number) {
            attempts = number.intValue();
        }
        var backoff = defaults.backoff();
        if (args.get("backoff_ms") instanceof Number number) {
            backoff = Duration.ofMillis(number.longValue());
        } else if (args.get("backoff") instanceof String raw) {
            backoff = DurationParser.parse(raw).orElse(backoff);
        }
        double multiplier = args.get("multiplier") instanceof Number number ? number.doubleValue() : defaults.multiplier();
        return new RetryPolicy(attempts, backoff, multiplier);
    }

    /**
     * Delay in milliseconds after a failed attempt: {@code backoff * multiplier^(attempt - 1)}.
     */
    public IntervalFunction intervals() {
        if (backoff.isZero()) {
            return attempt -> 0L;
        }
        return IntervalFunction.ofExponentialBackoff(backoff, multiplier);
    }
}
