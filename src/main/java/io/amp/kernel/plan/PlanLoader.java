package io.amp.kernel.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.amp.kernel.error.PlanValidationException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

public final class PlanLoader {
    private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
    private static final ObjectMapper YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));

    private PlanLoader() {}

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static ObjectMapper mapper() {
        return JSON_MAPPER;
    }

    public static Plan loadFromFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            return read(in, isYaml(path.getFileName().toString()) ? YAML_MAPPER : JSON_MAPPER, path.toString());
        } catch (IOException ex) {
            throw new PlanValidationException("Failed to read plan: " + path, ex);
        }
    }

    public static Plan loadFromHttp(URI uri) {
        try {
            var client = HttpClient.newHttpClient();
            var request = HttpRequest.newBuilder(uri).GET().build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() >= 400) {
                throw new PlanValidationException("HTTP " + response.statusCode() + " while downloading plan: " + uri, null);
            }
            try (var body = response.body()) {
                return read(body, isYaml(uri.getPath()) ? YAML_MAPPER : JSON_MAPPER, uri.toString());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PlanValidationException("Interrupted while downloading plan: " + uri, ex);
        } catch (IOException ex) {
            throw new PlanValidationException("Failed to download plan: " + uri, ex);
        }
    }

    public static Plan parseJson(String json) {
        try {
            return requireNodes(JSON_MAPPER.readValue(json, Plan.class), "inline plan");
        } catch (JsonProcessingException ex) {
            throw new PlanValidationException("Malformed plan JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public static Plan parseYaml(String yaml) {
        try {
            return requireNodes(YAML_MAPPER.readValue(yaml, Plan.class), "inline plan");
        } catch (JsonProcessingException ex) {
            throw new PlanValidationException("Malformed plan YAML: " + ex.getOriginalMessage(), ex);
        }
    }

    public static Node nodeFromMap(Map<?, ?> raw) {
        try {
            return JSON_MAPPER.convertValue(raw, Node.class);
        } catch (IllegalArgumentException ex) {
            throw new PlanValidationException("Malformed inline node " + raw.get("id") + ": " + ex.getMessage(), ex);
        }
    }

    public static String toJson(Plan plan) {
        try {
            return JSON_MAPPER.writeValueAsString(plan);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize plan", ex);
        }
    }

    private static Plan read(InputStream in, ObjectMapper mapper, String source) throws IOException {
        try {
            return requireNodes(mapper.readValue(in, Plan.class), source);
        } catch (JsonProcessingException ex) {
            throw new PlanValidationException("Malformed plan " + source + ": " + ex.getOriginalMessage(), ex);
        }
    }

    private static Plan requireNodes(Plan plan, String source) {
        if (plan == null) {
            throw new PlanValidationException("Plan document is empty: " + source, null);
        }
        return plan;
    }

    private static boolean isYaml(String name) {
        if (name == null) {
            return false;
        }
        var lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }
}
