package io.amp.kernel.optimizer;

public record NodeEstimate(String nodeId, double costUsd, long latencyMs) {
    public double score() {
        return costUsd * latencyMs;
    }
}
