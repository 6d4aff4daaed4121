package io.amp.kernel.optimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record ExecutionOrder(List<List<String>> waves, List<Reordering> reorderings, Map<String, NodeEstimate> estimates) {
    public ExecutionOrder {
        waves = waves.stream().map(List::copyOf).toList();
        reorderings = List.copyOf(reorderings);
        estimates = Map.copyOf(estimates);
    }

    public List<String> flatOrder() {
        var order = new ArrayList<String>();
        waves.forEach(order::addAll);
        return order;
    }

    public int waveOf(String nodeId) {
        for (int i = 0; i < waves.size(); i++) {
            if (waves.get(i).contains(nodeId)) {
                return i;
            }
        }
        return -1;
    }
}
