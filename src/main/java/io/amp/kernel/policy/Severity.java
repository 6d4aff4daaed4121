package io.amp.kernel.policy;

import java.util.Locale;

public enum Severity {
    /** Recorded; execution continues unchanged. */
    ADVISORY,
    /** The guarded operation is not performed; the node decides its own outcome. */
    BLOCKING,
    /** Halts admission of new nodes for the whole run. */
    RUN_FATAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
