package io.amp.kernel.runtime;

import io.amp.kernel.error.ToolInvocationException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator over one invocation: re-runs it on {@link ToolInvocationException} until it succeeds or
 * the attempts are exhausted. Every other error escapes on the first attempt.
 */
public final class RetryDecorator {
    private static final Logger log = LoggerFactory.getLogger(RetryDecorator.class);

    private RetryDecorator() {}

    /**
     * @param invocation receives the 1-based attempt number
     */
    public static <T> T execute(RetryPolicy policy, String label, IntFunction<T> invocation) {
        if (policy.maxAttempts() == 1) {
            return invocation.apply(1);
        }
        var retry = Retry.of(label, config(policy));
        retry.getEventPublisher().onRetry(event -> log.warn("{} failed on attempt {}/{} ({}); retrying in {} ms",
            label, event.getNumberOfRetryAttempts(), policy.maxAttempts(),
            event.getLastThrowable().getMessage(), event.getWaitInterval().toMillis()));
        var attempt = new AtomicInteger();
        return Retry.decorateSupplier(retry, () -> invocation.apply(attempt.incrementAndGet())).get();
    }

    static RetryConfig config(RetryPolicy policy) {
        return RetryConfig.custom()
            .maxAttempts(policy.maxAttempts())
            .intervalFunction(policy.intervals())
            .retryExceptions(ToolInvocationException.class)
            .build();
    }
}
