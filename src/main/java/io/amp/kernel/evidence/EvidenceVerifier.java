package io.amp.kernel.evidence;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Optional;

public final class EvidenceVerifier {
    public static final double MAX_CONTRADICTION_RATIO = 0.5;

    private EvidenceVerifier() {}

    public static EvidenceSummary summarize(Evidence evidence) {
        var accumulators = new LinkedHashMap<String, ClaimAccumulator>();
        for (var claim : evidence.claims()) {
            accumulators.computeIfAbsent(claim, k -> new ClaimAccumulator());
        }
        for (var support : evidence.supports()) {
            var acc = accumulators.computeIfAbsent(support.claimId(), k -> new ClaimAccumulator());
            acc.supports++;
            acc.add(support.confidence());
        }
        for (var contradiction : evidence.contradicts()) {
            var acc = accumulators.computeIfAbsent(contradiction.claimId(), k -> new ClaimAccumulator());
            acc.contradictions++;
            acc.add(contradiction.confidence());
        }

        int supported = 0;
        int contradicted = 0;
        int needsCitation = 0;
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = 0.0;
        for (var verdict : evidence.verdicts()) {
            switch (verdict.verdict()) {
                case SUPPORTED -> supported++;
                case CONTRADICTED -> contradicted++;
                case NEUTRAL -> {
                    // counted in the total only
                }
            }
            if (verdict.needsCitation()) {
                needsCitation++;
            }
            sum += verdict.confidence();
            min = Math.min(min, verdict.confidence());
            max = Math.max(max, verdict.confidence());
            accumulators.computeIfAbsent(verdict.claimId(), k -> new ClaimAccumulator()).add(verdict.confidence());
        }
        int total = evidence.verdicts().size();
        var perClaim = new LinkedHashMap<String, ClaimSummary>();
        accumulators.forEach((claim, acc) -> perClaim.put(claim, acc.summary()));
        return new EvidenceSummary(
            total,
            supported,
            contradicted,
            total > 0 ? sum / total : 0.0,
            total > 0 ? min : 0.0,
            max,
            needsCitation,
            perClaim
        );
    }

    /**
     * First reason the evidence may not back a stored fact: mean confidence below {@code minConfidence},
     * a claim without support, or more than half of the verdicts contradicted.
     */
    public static Optional<String> storageProblem(Evidence evidence, double minConfidence) {
        var summary = summarize(evidence);
        if (summary.meanConfidence() < minConfidence) {
            return Optional.of(String.format(Locale.ROOT, "Insufficient evidence confidence: %.2f < required %.2f",
                summary.meanConfidence(), minConfidence));
        }
        for (var entry : summary.perClaim().entrySet()) {
            if (entry.getValue().supports() == 0) {
                return Optional.of("Claim " + entry.getKey() + " is missing supporting evidence");
            }
        }
        if (summary.totalClaims() > 0) {
            double ratio = (double) summary.contradictedClaims() / summary.totalClaims();
            if (ratio > MAX_CONTRADICTION_RATIO) {
                return Optional.of(String.format(Locale.ROOT, "Too many contradictions: ratio %.2f > threshold %.2f",
                    ratio, MAX_CONTRADICTION_RATIO));
            }
        }
        return Optional.empty();
    }

    public static double gatingConfidence(Object output, EvidenceSummary summary) {
        return Evidence.reportedConfidence(output).orElse(summary.meanConfidence());
    }

    private static final class ClaimAccumulator {
        int supports;
        int contradictions;
        double sum;
        int count;
        double min;
        double max;

        void add(double value) {
            sum += value;
            count++;
            min = count == 1 ? value : Math.min(min, value);
            max = count == 1 ? value : Math.max(max, value);
        }

        ClaimSummary summary() {
            return new ClaimSummary(
                supports,
                contradictions,
                count > 0 ? sum / count : null,
                count > 0 ? max : null,
                count > 0 ? min : null
            );
        }
    }
}
