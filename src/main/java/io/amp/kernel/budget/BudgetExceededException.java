package io.amp.kernel.budget;

import io.amp.kernel.error.KernelException;
import java.util.Locale;

public final class BudgetExceededException extends KernelException {
    private final BudgetVerdict verdict;

    public BudgetExceededException(BudgetVerdict verdict) {
        super("budget_exceeded", String.format(Locale.ROOT, "Budget exceeded on %s: %.4f > %.4f (overrun %.4f)",
            verdict.dimension().wireName(), verdict.total(), verdict.cap(), verdict.overrun()), verdict.toData());
        this.verdict = verdict;
    }

    public BudgetVerdict verdict() {
        return verdict;
    }
}
