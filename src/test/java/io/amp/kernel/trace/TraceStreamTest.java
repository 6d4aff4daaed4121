package io.amp.kernel.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TraceStreamTest {
    @TempDir
    Path tempDir;

    @Test
    void writtenTraceReadsBackAndVerifies() throws Exception {
        var signer = TraceSigner.fromSecret("stream-key");
        var file = tempDir.resolve("nested").resolve("trace.ndjson");
        try (var writer = new TraceWriter(file)) {
            var emitter = new TraceEmitter("plan-7", signer, writer);
            emitter.emit("a", TraceEventType.STEP_START, Map.of("op", "call"));
            emitter.emit("a", TraceEventType.TOOL_INVOKE, Map.of("tool", "search", "latency_ms", 12), 0.01, 3L, 9L, List.of("doc-1"));
            emitter.emit("a", TraceEventType.STEP_END, Map.of("status", "succeeded", "output", Map.of("score", 0.5)));
        }

        var lines = Files.readAllLines(file);
        var events = TraceReader.read(file);

        assertEquals(3, lines.size());
        assertTrue(lines.get(1).contains("\"event_type\":\"tool-invoke\""));
        assertEquals(3, events.size());
        assertEquals(TraceEventType.TOOL_INVOKE, events.get(1).eventType());
        assertEquals(List.of("doc-1"), events.get(1).citations());
        assertTrue(TraceVerifier.verify(events, signer).valid());
    }

    @Test
    void blankLinesAreIgnored() {
        var signer = TraceSigner.fromSecret("stream-key");
        var emitter = new TraceEmitter("plan-8", signer, null);
        var event = emitter.emit("a", TraceEventType.STEP_START, Map.of());

        var events = TraceReader.parse("\n" + TraceWriter.toLine(event) + "\n\n");

        assertEquals(1, events.size());
        assertEquals("plan-8", events.get(0).planId());
    }

    @Test
    void malformedLineNamesItsPosition() {
        var ex = assertThrows(IllegalArgumentException.class, () -> TraceReader.parse("{}\nnot json"));

        assertTrue(ex.getMessage().contains("line 2"));
    }
}
