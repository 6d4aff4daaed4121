package io.amp.kernel.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.amp.kernel.error.ToolInvocationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MemoryProtocolTest {
    @Test
    void writeRequestCarriesEntryAndTtl() {
        var entry = MemoryProtocol.entryFromArgs("answer",
            Map.of("value", "42", "confidence", 0.9, "provenance", "doc-1"), "P90D");

        var request = MemoryProtocol.writeRequest(entry);

        assertEquals("write", request.get("operation"));
        assertEquals("answer", request.get("key"));
        assertEquals("42", request.get("value"));
        assertEquals(List.of("doc-1"), request.get("provenance"));
        assertEquals(0.9, request.get("confidence"));
        assertEquals("P90D", request.get("ttl"));
    }

    @Test
    void explicitTtlWins() {
        var entry = MemoryProtocol.entryFromArgs("k", Map.of("value", 1, "ttl", "P7D"), "P90D");

        assertEquals("P7D", entry.ttl());
    }

    @Test
    void readAndForgetRequests() {
        assertEquals(Map.of("operation", "read", "key", "k"), MemoryProtocol.readRequest("k"));
        assertEquals(Map.of("operation", "forget", "key", "k"), MemoryProtocol.forgetRequest("k"));
    }

    @Test
    void parsesEntryOrBareValue() {
        var fromEntry = MemoryProtocol.parseRead("k", Map.of("success", true,
            "entry", Map.of("key", "k", "value", "v", "confidence", 0.95, "provenance", List.of("doc-1"))));
        var fromValue = MemoryProtocol.parseRead("k", Map.of("value", 7));

        assertEquals("v", fromEntry.orElseThrow().value());
        assertEquals(List.of("doc-1"), fromEntry.orElseThrow().provenance());
        assertEquals(7, fromValue.orElseThrow().value());
    }

    @Test
    void missingKeyReadsAsEmpty() {
        assertTrue(MemoryProtocol.parseRead("k", Map.of("success", false, "message", "not found")).isEmpty());
        assertTrue(MemoryProtocol.parseRead("k", null).isEmpty());
        assertTrue(MemoryProtocol.parseRead("k", Map.of("success", true)).isEmpty());
    }

    @Test
    void failedWriteIsToolError() {
        var ex = assertThrows(ToolInvocationException.class,
            () -> MemoryProtocol.requireSuccess("mesh.mem.sqlite", "write", Map.of("success", false, "message", "disk full")));

        assertEquals("tool_invocation", ex.code());
        assertTrue(ex.getMessage().contains("disk full"));
        assertEquals(Map.of("success", true), MemoryProtocol.requireSuccess("mesh.mem.sqlite", "write", Map.of("success", true)));
    }
}
