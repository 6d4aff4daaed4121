package io.amp.kernel.policy;

import io.amp.kernel.error.KernelException;

public final class PolicyViolationException extends KernelException {
    private final PolicyViolation violation;

    public PolicyViolationException(PolicyViolation violation) {
        super("policy_violation", violation.message(), violation.toData());
        this.violation = violation;
    }

    public PolicyViolation violation() {
        return violation;
    }

    public boolean isRunFatal() {
        return violation.severity() == Severity.RUN_FATAL;
    }
}
