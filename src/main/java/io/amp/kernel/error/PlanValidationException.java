package io.amp.kernel.error;

import java.util.List;

public final class PlanValidationException extends KernelException {
    private final List<String> problems;

    public PlanValidationException(List<String> problems) {
        super("validation", "Plan validation failed: " + String.join("; ", problems), List.copyOf(problems));
        this.problems = List.copyOf(problems);
    }

    public PlanValidationException(String message, Throwable cause) {
        super("validation", message, null, cause);
        this.problems = List.of(message);
    }

    public List<String> problems() {
        return problems;
    }
}
