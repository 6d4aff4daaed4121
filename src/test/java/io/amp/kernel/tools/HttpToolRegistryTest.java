package io.amp.kernel.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.amp.kernel.error.ToolInvocationException;
import io.amp.kernel.support.StubToolServer;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpToolRegistryTest {
    private StubToolServer server;

    @BeforeEach
    void startServer() {
        server = new StubToolServer()
            .json("/spec/search", Map.of("name", "search", "capabilities", List.of("search")))
            .json("/spec/verify", Map.of("name", "verify", "capabilities", List.of("verify")));
    }

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void listsToolsFromRegistryThenFetchesContracts() {
        server.json("/tools", Map.of("tools", List.of(
            Map.of("name", "search", "url", server.baseUrl()),
            Map.of("name", "verify", "endpoint", server.baseUrl()),
            Map.of("name", "nameless"))));

        var tools = new HttpToolRegistry(URI.create(server.baseUrl() + "/"), Duration.ofSeconds(5)).snapshot();

        assertEquals(List.of("search", "verify"), tools.stream().map(RegisteredTool::name).toList());
        assertEquals(server.baseUrl(), tools.get(0).address());
    }

    @Test
    void fixedEndpointTableKeepsItsOrder() {
        var endpoints = new LinkedHashMap<String, String>();
        endpoints.put("verify", server.baseUrl());
        endpoints.put("search", server.baseUrl());

        var cache = ToolSpecCache.from(new HttpToolRegistry(endpoints, Duration.ofSeconds(5)));

        assertEquals(List.of("verify", "search"), cache.names());
        assertEquals("search", cache.withCapability("search").get(0).name());
    }

    @Test
    void unreachableSpecFailsTheSnapshot() {
        var registry = new HttpToolRegistry(Map.of("missing", server.baseUrl()), Duration.ofSeconds(5));

        assertThrows(ToolInvocationException.class, registry::snapshot);
    }
}
