package io.amp.kernel.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.amp.kernel.support.KernelTestSupport;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DependencyGraphTest {
    private static final Plan PLAN = KernelTestSupport.plan("{\"nodes\": ["
        + "{\"id\": \"search\", \"op\": \"call\", \"tool\": \"s\", \"out\": {\"docs\": \"$.results\"}},"
        + "{\"id\": \"weather\", \"op\": \"call\", \"tool\": \"w\"},"
        + "{\"id\": \"summarize\", \"op\": \"call\", \"tool\": \"x\", \"args\": {\"text\": \"$docs[0].body\"}},"
        + "{\"id\": \"report\", \"op\": \"call\", \"tool\": \"r\"}],"
        + "\"edges\": [{\"from\": \"summarize\", \"to\": \"report\"}, {\"from\": \"weather\", \"to\": \"report\"}]}");

    @Test
    void referencesToOutNamesAreDependencies() {
        var graph = DependencyGraph.of(PLAN);

        assertEquals(Set.of("search"), graph.predecessors("summarize"));
        assertEquals(Set.of("summarize", "weather"), graph.predecessors("report"));
        assertEquals("search", DependencyGraph.producers(PLAN).get("docs"));
    }

    @Test
    void layersFollowDependencies() {
        var layers = DependencyGraph.of(PLAN).layers().orElseThrow();

        assertEquals(List.of(List.of("search", "weather"), List.of("summarize"), List.of("report")), layers);
    }

    @Test
    void collectsEmbeddedReferencesButNotEscapedDollars() {
        var refs = Reference.collect(List.of("$verify.confidence >= 0.8", "$$literal", "plain"));

        assertEquals(1, refs.size());
        assertEquals("verify", refs.get(0).root());
        assertEquals(List.of("confidence"), refs.get(0).segments());
    }
}
