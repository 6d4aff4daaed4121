package io.amp.kernel.budget;

public enum BudgetDimension {
    COST_USD("cost_usd"),
    LATENCY_MS("latency_ms");

    private final String wireName;

    BudgetDimension(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
