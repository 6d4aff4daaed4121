package io.amp.kernel.evidence;

import io.amp.kernel.error.KernelException;
import java.util.Locale;
import java.util.Map;

public final class EvidenceBelowThresholdException extends KernelException {
    private final double confidence;
    private final double threshold;

    public EvidenceBelowThresholdException(String nodeId, double confidence, double threshold) {
        super("evidence_below_threshold",
            String.format(Locale.ROOT, "Evidence confidence %.2f below min_confidence %.2f in node %s", confidence, threshold, nodeId),
            Map.of("node", nodeId, "confidence", confidence, "min_confidence", threshold));
        this.confidence = confidence;
        this.threshold = threshold;
    }

    public double confidence() {
        return confidence;
    }

    public double threshold() {
        return threshold;
    }
}
