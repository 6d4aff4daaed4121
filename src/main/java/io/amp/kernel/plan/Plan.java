package io.amp.kernel.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Plan(
    @JsonProperty("signals") Signals signals,
    @JsonProperty("nodes") List<Node> nodes,
    @JsonProperty("edges") List<Edge> edges,
    @JsonProperty("stop_conditions") StopConditions stopConditions
) {
    public Plan {
        signals = signals == null ? Signals.NONE : signals;
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        stopConditions = stopConditions == null ? StopConditions.NONE : stopConditions;
    }

    public Optional<Node> node(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    public List<String> successors(String id) {
        var result = new ArrayList<String>();
        for (var edge : edges) {
            if (edge.from().equals(id) && !result.contains(edge.to())) {
                result.add(edge.to());
            }
        }
        return result;
    }

    @JsonIgnore
    public List<String> nodeIds() {
        return nodes.stream().map(Node::id).toList();
    }
}
