package io.amp.kernel.runtime;

import io.amp.kernel.budget.BudgetExceededException;
import io.amp.kernel.error.AssertionFailedException;
import io.amp.kernel.error.KernelException;
import io.amp.kernel.error.RoutingException;
import io.amp.kernel.evidence.EvidenceBelowThresholdException;
import io.amp.kernel.policy.PolicyViolationException;

final class Failures {
    enum Disposition {
        /** Stop admission; run ends {@code halted}. */
        HALT,
        /** Stop admission; run ends {@code failed}. */
        FAIL_RUN,
        /** Only the node fails; dependents are skipped. */
        FAIL_NODE
    }

    private Failures() {}

    static Disposition classify(Throwable error) {
        if (error instanceof BudgetExceededException) {
            return Disposition.HALT;
        }
        if (error instanceof PolicyViolationException violation) {
            return violation.isRunFatal() ? Disposition.HALT : Disposition.FAIL_NODE;
        }
        if (error instanceof AssertionFailedException
            || error instanceof EvidenceBelowThresholdException
            || error instanceof RoutingException) {
            return Disposition.FAIL_RUN;
        }
        return Disposition.FAIL_NODE;
    }

    static String code(Throwable error) {
        return error instanceof KernelException kernel && kernel.code() != null ? kernel.code() : "internal";
    }
}
