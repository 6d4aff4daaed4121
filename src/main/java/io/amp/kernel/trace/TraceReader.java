package io.amp.kernel.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class TraceReader {
    private static final ObjectMapper JSON = new ObjectMapper();

    private TraceReader() {}

    public static List<TraceEvent> read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static List<TraceEvent> parse(String ndjson) {
        var events = new ArrayList<TraceEvent>();
        var lines = ndjson.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                events.add(JSON.readValue(line, TraceEvent.class));
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("Malformed trace event on line " + (i + 1) + ": " + ex.getOriginalMessage(), ex);
            }
        }
        return events;
    }
}
