package io.amp.kernel.budget;

import io.amp.kernel.plan.Signals;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cumulative telemetry of one run. Every read and update goes through a single lock so
 * near-simultaneous completions never lose an update.
 */
public final class BudgetTracker {
    private final ReentrantLock lock = new ReentrantLock();
    private final Double costCapUsd;
    private final Long latencyBudgetMs;
    private Usage totals = Usage.ZERO;
    private int invocations;

    public BudgetTracker(Double costCapUsd, Long latencyBudgetMs) {
        this.costCapUsd = costCapUsd;
        this.latencyBudgetMs = latencyBudgetMs;
    }

    public static BudgetTracker forSignals(Signals signals) {
        return new BudgetTracker(signals.costCapUsd(), signals.latencyBudgetMs());
    }

    public BudgetVerdict record(Usage usage) {
        lock.lock();
        try {
            totals = totals.plus(usage);
            invocations++;
            return evaluate();
        } finally {
            lock.unlock();
        }
    }

    public BudgetVerdict check() {
        lock.lock();
        try {
            return evaluate();
        } finally {
            lock.unlock();
        }
    }

    public Optional<BudgetVerdict> exhaustion() {
        lock.lock();
        try {
            if (costCapUsd != null && totals.costUsd() >= costCapUsd) {
                return Optional.of(BudgetVerdict.exceeded(BudgetDimension.COST_USD, totals.costUsd(), costCapUsd));
            }
            if (latencyBudgetMs != null && totals.latencyMs() >= latencyBudgetMs) {
                return Optional.of(BudgetVerdict.exceeded(BudgetDimension.LATENCY_MS, totals.latencyMs(), latencyBudgetMs));
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public BudgetSnapshot snapshot() {
        lock.lock();
        try {
            return new BudgetSnapshot(totals, costCapUsd, latencyBudgetMs, invocations);
        } finally {
            lock.unlock();
        }
    }

    private BudgetVerdict evaluate() {
        if (costCapUsd != null && totals.costUsd() > costCapUsd) {
            return BudgetVerdict.exceeded(BudgetDimension.COST_USD, totals.costUsd(), costCapUsd);
        }
        if (latencyBudgetMs != null && totals.latencyMs() > latencyBudgetMs) {
            return BudgetVerdict.exceeded(BudgetDimension.LATENCY_MS, totals.latencyMs(), latencyBudgetMs);
        }
        return BudgetVerdict.WITHIN;
    }
}
