package io.amp.kernel.policy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ViolationKind {
    LOW_WRITE_CONFIDENCE("memory_write_confidence"),
    MISSING_PROVENANCE("missing_provenance"),
    EVIDENCE_UNFIT_FOR_STORAGE("evidence_unfit_for_storage"),
    EVIDENCE_BELOW_THRESHOLD("evidence_below_threshold"),
    DENY_IF_MATCH("deny_if"),
    CITATION_REQUIRED("citation_required");

    private final String wireName;

    ViolationKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
