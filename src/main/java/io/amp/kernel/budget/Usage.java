package io.amp.kernel.budget;

public record Usage(double costUsd, long latencyMs, long tokensIn, long tokensOut) {
    public static final Usage ZERO = new Usage(0.0, 0L, 0L, 0L);

    public Usage plus(Usage other) {
        return new Usage(
            costUsd + other.costUsd,
            latencyMs + other.latencyMs,
            tokensIn + other.tokensIn,
            tokensOut + other.tokensOut
        );
    }
}
