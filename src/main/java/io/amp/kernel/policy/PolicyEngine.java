package io.amp.kernel.policy;

import io.amp.kernel.evidence.Evidence;
import io.amp.kernel.evidence.EvidenceVerifier;
import io.amp.kernel.tools.ToolSpec;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    public static final double MIN_WRITE_CONFIDENCE = 0.8;

    private PolicyEngine() {}

    /**
     * Write-acceptance rules: confidence at least {@value #MIN_WRITE_CONFIDENCE}, non-empty provenance,
     * and, when the write carries {@code evidence}, evidence that is fit for storage.
     * Any violation means the write must not reach the store.
     */
    public static List<PolicyViolation> checkMemoryWrite(String key, Map<String, Object> args) {
        var violations = new ArrayList<PolicyViolation>();
        var confidence = args.get("confidence") instanceof Number number ? number.doubleValue() : null;
        if (confidence == null || confidence < MIN_WRITE_CONFIDENCE) {
            var message = confidence == null
                ? "Memory write for '" + key + "' has no confidence"
                : String.format(Locale.ROOT, "Memory write confidence %.2f below required %.2f for '%s'", confidence, MIN_WRITE_CONFIDENCE, key);
            violations.add(new PolicyViolation(ViolationKind.LOW_WRITE_CONFIDENCE, Severity.BLOCKING, message,
                details("key", key, "confidence", confidence, "required", MIN_WRITE_CONFIDENCE)));
        }
        if (!hasProvenance(args.get("provenance"))) {
            violations.add(new PolicyViolation(ViolationKind.MISSING_PROVENANCE, Severity.BLOCKING,
                "Memory write for '" + key + "' has no provenance", details("key", key)));
        }
        var rawEvidence = args.get("evidence");
        if (rawEvidence != null) {
            String problem;
            try {
                problem = EvidenceVerifier.storageProblem(Evidence.fromOutput(rawEvidence), MIN_WRITE_CONFIDENCE).orElse(null);
            } catch (IllegalArgumentException ex) {
                problem = "Malformed evidence: " + ex.getMessage();
            }
            if (problem != null) {
                violations.add(new PolicyViolation(ViolationKind.EVIDENCE_UNFIT_FOR_STORAGE, Severity.BLOCKING, problem,
                    details("key", key)));
            }
        }
        return violations;
    }

    public static Optional<PolicyViolation> checkDenyRules(ToolSpec spec, Map<String, Object> args) {
        for (var expression : spec.policy().denyIf()) {
            var rule = new DenyRule(expression);
            if (rule.matches(args)) {
                log.warn("deny_if rule '{}' of {} matched; call not issued", expression, spec.name());
                return Optional.of(new PolicyViolation(ViolationKind.DENY_IF_MATCH, Severity.BLOCKING,
                    "Call to " + spec.name() + " denied by rule: " + expression,
                    details("tool", spec.name(), "rule", expression)));
            }
        }
        return Optional.empty();
    }

    public static Optional<PolicyViolation> checkAttribution(ToolSpec spec, List<String> citations, boolean asserted) {
        if (!spec.attributionRequired() || !citations.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PolicyViolation(ViolationKind.CITATION_REQUIRED,
            asserted ? Severity.RUN_FATAL : Severity.ADVISORY,
            "Output of " + spec.name() + " requires attribution but carries no citations",
            details("tool", spec.name())));
    }

    /**
     * Citation requirement of an {@code assert} node. Always run-fatal.
     */
    public static Optional<PolicyViolation> checkCitations(String nodeId, List<String> citations) {
        if (!citations.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PolicyViolation(ViolationKind.CITATION_REQUIRED, Severity.RUN_FATAL,
            "Node " + nodeId + " asserts citations but none were found", details("node", nodeId)));
    }

    public static Optional<PolicyViolation> checkEvidence(String nodeId, double confidence, Double minConfidence, boolean guarded) {
        if (minConfidence == null || confidence >= minConfidence) {
            return Optional.empty();
        }
        return Optional.of(new PolicyViolation(ViolationKind.EVIDENCE_BELOW_THRESHOLD,
            guarded ? Severity.RUN_FATAL : Severity.ADVISORY,
            String.format(Locale.ROOT, "Evidence confidence %.2f below min_confidence %.2f in node %s", confidence, minConfidence, nodeId),
            details("node", nodeId, "confidence", confidence, "min_confidence", minConfidence)));
    }

    private static boolean hasProvenance(Object raw) {
        if (raw instanceof Collection<?> list) {
            return list.stream().anyMatch(item -> item != null && !String.valueOf(item).isBlank());
        }
        return raw instanceof String str && !str.isBlank();
    }

    private static Map<String, Object> details(Object... pairs) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            map.put(String.valueOf(pairs[i]), pairs[i + 1]);
        }
        return map;
    }
}
