package io.amp.kernel.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CitationsTest {
    @Test
    void readsExplicitCitationLists() {
        assertEquals(List.of("doc-1", "doc-2"), Citations.extract(Map.of("citations", List.of("doc-1", "doc-2"))));
    }

    @Test
    void readsSourcesOfResultItems() {
        var output = Map.of("results", List.of(
            Map.of("title", "A", "url", "https://a.example"),
            Map.of("title", "B", "source", "doc-b"),
            Map.of("title", "C", "url", "https://a.example")));

        assertEquals(List.of("https://a.example", "doc-b"), Citations.extract(output));
    }

    @Test
    void plainValuesCarryNoCitations() {
        assertTrue(Citations.extract("just text").isEmpty());
        assertTrue(Citations.extract(null).isEmpty());
    }
}
