package io.amp.kernel.runtime;

import java.util.Locale;

public enum RunStatus {
    COMPLETED,
    FAILED,
    HALTED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
