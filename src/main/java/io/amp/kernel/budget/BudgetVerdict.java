package io.amp.kernel.budget;

import java.util.LinkedHashMap;
import java.util.Map;

public record BudgetVerdict(boolean exceeded, BudgetDimension dimension, double total, double cap, double overrun) {
    public static final BudgetVerdict WITHIN = new BudgetVerdict(false, null, 0.0, 0.0, 0.0);

    public static BudgetVerdict exceeded(BudgetDimension dimension, double total, double cap) {
        return new BudgetVerdict(true, dimension, total, cap, total - cap);
    }

    public Map<String, Object> toData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("exceeded", exceeded);
        if (exceeded) {
            data.put("dimension", dimension.wireName());
            data.put("total", total);
            data.put("cap", cap);
            data.put("overrun", overrun);
        }
        return data;
    }
}
