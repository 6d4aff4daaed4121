package io.amp.kernel.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.amp.kernel.error.ToolInvocationException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the tool HTTP ABI: {@code GET {url}/spec/{name}} returns the contract and
 * {@code POST {url}/invoke/{name}} with {@code {"args": {...}}} returns {@code {"result": ..., "error": ...}}.
 */
public final class HttpToolClient implements ToolInvoker {
    private static final Logger log = LoggerFactory.getLogger(HttpToolClient.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpToolClient(Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), requestTimeout);
    }

    public HttpToolClient(HttpClient client, Duration requestTimeout) {
        this.client = client;
        this.requestTimeout = requestTimeout;
    }

    public ToolSpec fetchSpec(String baseUrl, String name) {
        var uri = endpoint(baseUrl, "spec", name);
        var request = HttpRequest.newBuilder(uri).timeout(requestTimeout).GET().build();
        var body = send(name, request);
        try {
            return JSON.readValue(body, ToolSpec.class);
        } catch (JsonProcessingException ex) {
            throw new ToolInvocationException(name, "Malformed tool spec from " + uri + ": " + ex.getOriginalMessage(), false, ex);
        }
    }

    @Override
    public ToolResponse invoke(RegisteredTool tool, Map<String, Object> args, String stepId) {
        var uri = endpoint(tool.address(), "invoke", tool.name());
        String payload;
        try {
            var envelope = new LinkedHashMap<String, Object>();
            envelope.put("args", args);
            payload = JSON.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            throw new ToolInvocationException(tool.name(), "Unable to encode arguments: " + ex.getOriginalMessage(), false, ex);
        }
        var request = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .build();
        log.debug("Invoking {} at {} for step {}", tool.name(), uri, stepId);
        var body = send(tool.name(), request);
        return parseInvokeResponse(tool.name(), body);
    }

    static ToolResponse parseInvokeResponse(String tool, String body) {
        JsonNode root;
        try {
            root = JSON.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new ToolInvocationException(tool, "Malformed response from " + tool + ": " + ex.getOriginalMessage(), false, ex);
        }
        if (root == null || !root.isObject()) {
            throw new ToolInvocationException(tool, "Response from " + tool + " is not a JSON object", false);
        }
        var error = root.get("error");
        if (error != null && !error.isNull()) {
            var message = error.isTextual() ? error.asText() : error.toString();
            throw new ToolInvocationException(tool, "Tool " + tool + " returned an error: " + message, false);
        }
        var result = root.get("result");
        Object output = result == null || result.isNull() ? null : JSON.convertValue(result, Object.class);
        ReportedUsage usage = null;
        var usageNode = result != null && result.isObject() ? result.get("usage") : null;
        if (usageNode == null) {
            usageNode = root.get("usage");
        }
        if (usageNode != null && usageNode.isObject()) {
            usage = JSON.convertValue(usageNode, ReportedUsage.class);
        }
        return ToolResponse.of(output, usage);
    }

    private String send(String tool, HttpRequest request) {
        try {
            var response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new ToolInvocationException(tool, "HTTP " + response.statusCode() + " from " + request.uri(), false);
            }
            return response.body();
        } catch (HttpTimeoutException ex) {
            throw new ToolInvocationException(tool, "Timed out calling " + request.uri(), true, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(tool, "Interrupted while calling " + request.uri(), false, ex);
        } catch (IOException ex) {
            throw new ToolInvocationException(tool, "Failed to call " + request.uri() + ": " + ex.getMessage(), false, ex);
        }
    }

    static URI endpoint(String baseUrl, String kind, String name) {
        var base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return URI.create(base + "/" + kind + "/" + name);
    }
}
