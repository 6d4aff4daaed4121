package io.amp.kernel.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.amp.kernel.error.ToolInvocationException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry snapshot served over HTTP. {@code GET {registry}/tools} lists entries
 * ({@code [{"name": ..., "url": ...}]} or {@code {"tools": [...]}}), then each contract is fetched
 * from the tool's own spec endpoint. Without a registry URL the entries come from a fixed
 * name-to-url table, typically the {@code [[tools]]} section of the kernel settings.
 */
public final class HttpToolRegistry implements ToolRegistry {
    private static final Logger log = LoggerFactory.getLogger(HttpToolRegistry.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final URI registryUri;
    private final Map<String, String> endpoints;
    private final HttpClient client;
    private final HttpToolClient toolClient;
    private final Duration timeout;

    public HttpToolRegistry(URI registryUri, Duration timeout) {
        this(registryUri, Map.of(), timeout);
    }

    public HttpToolRegistry(Map<String, String> endpoints, Duration timeout) {
        this(null, endpoints, timeout);
    }

    private HttpToolRegistry(URI registryUri, Map<String, String> endpoints, Duration timeout) {
        this.registryUri = registryUri;
        this.endpoints = new LinkedHashMap<>(endpoints);
        this.timeout = timeout;
        this.client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
        this.toolClient = new HttpToolClient(client, timeout);
    }

    @Override
    public List<RegisteredTool> snapshot() {
        List<Map.Entry<String, String>> listing = registryUri == null ? new ArrayList<>(endpoints.entrySet()) : fetchListing();
        var tools = new ArrayList<RegisteredTool>();
        for (var entry : listing) {
            var spec = toolClient.fetchSpec(entry.getValue(), entry.getKey());
            tools.add(new RegisteredTool(spec, entry.getValue()));
        }
        log.debug("Loaded {} tool(s) from {}", tools.size(), registryUri == null ? "configured endpoints" : registryUri);
        return tools;
    }

    private List<Map.Entry<String, String>> fetchListing() {
        var base = registryUri.toString().replaceAll("/+$", "");
        var request = HttpRequest.newBuilder(URI.create(base + "/tools")).timeout(timeout).GET().build();
        JsonNode root;
        try {
            var response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new ToolInvocationException("registry", "HTTP " + response.statusCode() + " listing tools at " + request.uri(), false);
            }
            root = JSON.readTree(response.body());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ToolInvocationException("registry", "Interrupted while listing tools at " + request.uri(), false, ex);
        } catch (IOException ex) {
            throw new ToolInvocationException("registry", "Failed to list tools at " + request.uri() + ": " + ex.getMessage(), false, ex);
        }
        var items = root != null && root.has("tools") ? root.get("tools") : root;
        var listing = new ArrayList<Map.Entry<String, String>>();
        if (items == null || !items.isArray()) {
            throw new ToolInvocationException("registry", "Registry listing at " + request.uri() + " is not an array", false);
        }
        for (var item : items) {
            var name = item.path("name").asText("");
            var url = item.path("url").asText(item.path("endpoint").asText(""));
            if (name.isBlank() || url.isBlank()) {
                log.warn("Ignoring registry entry without name or url: {}", item);
                continue;
            }
            listing.add(Map.entry(name, url));
        }
        return listing;
    }
}
