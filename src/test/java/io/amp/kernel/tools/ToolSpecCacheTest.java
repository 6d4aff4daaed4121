package io.amp.kernel.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.amp.kernel.support.KernelTestSupport;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolSpecCacheTest {
    @Test
    void keepsRegistrationOrderAndFirstDuplicate() {
        var first = KernelTestSupport.tool("search", 0.01, 100, "search");
        var cache = KernelTestSupport.cache(first,
            KernelTestSupport.tool("verify", 0.02, 200, "verify"),
            KernelTestSupport.tool("search", 0.50, 900, "search"));

        assertEquals(List.of("search", "verify"), cache.names());
        assertEquals(first, cache.get("search").orElseThrow());
        assertTrue(cache.get("absent").isEmpty());
    }

    @Test
    void snapshotTakenBeforeRefreshIsUnaffected() {
        var registry = new StaticToolRegistry()
            .register(KernelTestSupport.tool("a", 0.01, 10, "x"));
        var cache = ToolSpecCache.from(registry);
        var before = cache.snapshot();

        registry.register(KernelTestSupport.tool("b", 0.01, 10, "x"));
        cache.refresh(registry);

        assertEquals(1, before.size());
        assertEquals(2, cache.withCapability("x").size());
        assertFalse(cache.isStale(Duration.ofMinutes(5)));
    }

    @Test
    void staticRegistryReplacesInPlace() {
        var registry = new StaticToolRegistry()
            .register(KernelTestSupport.tool("a", 0.01, 10))
            .register(KernelTestSupport.tool("b", 0.01, 10))
            .register(KernelTestSupport.tool("a", 0.05, 10));

        assertEquals(List.of("a", "b"), registry.snapshot().stream().map(RegisteredTool::name).toList());
        assertEquals(0.05, registry.lookup("a").orElseThrow().spec().estimatedCostUsd());

        registry.unregister("a");
        assertEquals(1, registry.snapshot().size());
    }
}
