package io.amp.kernel.replay;

import io.amp.kernel.runtime.ExecutionReport;
import java.util.List;

public record ReplayResult(boolean matches, List<String> mismatches, ExecutionReport report) {
    public ReplayResult {
        mismatches = List.copyOf(mismatches);
    }
}
