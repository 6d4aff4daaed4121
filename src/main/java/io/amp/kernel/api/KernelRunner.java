package io.amp.kernel.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.amp.kernel.config.KernelSettings;
import io.amp.kernel.config.KernelSettingsLoader;
import io.amp.kernel.error.KernelException;
import io.amp.kernel.plan.Plan;
import io.amp.kernel.plan.PlanLoader;
import io.amp.kernel.runtime.Scheduler;
import io.amp.kernel.tools.HttpToolClient;
import io.amp.kernel.tools.HttpToolRegistry;
import io.amp.kernel.tools.ToolRegistry;
import io.amp.kernel.tools.ToolSpecCache;
import io.amp.kernel.trace.TraceSigner;
import io.amp.kernel.trace.TraceSink;
import io.amp.kernel.trace.TraceWriter;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point for embedding the kernel: loads settings, plan and inputs, snapshots the
 * registry, runs the plan and folds the outcome into a {@link RunResult}.
 */
public final class KernelRunner {
    private static final Logger log = LoggerFactory.getLogger(KernelRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    public RunResult run(KernelRunConfiguration configuration) {
        var started = Instant.now();
        configuration.logLevel().apply();
        try {
            var settings = loadSettings(configuration);
            var plan = loadPlan(configuration.planTarget());
            var inputs = parseInputs(configuration.inputPayload());
            var registry = configuration.registry().orElseGet(() -> registryFor(settings));
            var tools = ToolSpecCache.from(registry);
            var invoker = configuration.invoker().orElseGet(() -> new HttpToolClient(settings.defaultTimeout()));
            var signer = settings.signingKey().map(TraceSigner::fromSecret).orElseGet(TraceSigner::ephemeral);
            var planId = UUID.randomUUID().toString();

            var writer = settings.traceFile().isPresent() ? new TraceWriter(settings.traceFile().get()) : null;
            try {
                var report = new Scheduler(tools, invoker, settings, signer)
                    .execute(planId, plan, inputs, writer == null ? TraceSink.NOOP : writer);
                var metadata = new LinkedHashMap<String, Object>();
                metadata.put("plan", configuration.planTarget().display());
                metadata.putAll(report.toData());
                settings.traceFile().ifPresent(path -> metadata.put("trace_file", path.toString()));
                return RunResult.of(report.status(), metadata, started);
            } finally {
                if (writer != null) {
                    writer.close();
                }
            }
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("plan", configuration.planTarget().display());
            if (ex instanceof KernelException kernel) {
                errorMeta.put("code", kernel.code());
                if (kernel.data() != null) {
                    errorMeta.put("details", kernel.data());
                }
            }
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            log.debug("Run of {} failed before completion", configuration.planTarget().display(), ex);
            return RunResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    private KernelSettings loadSettings(KernelRunConfiguration configuration) {
        var path = KernelSettingsLoader.resolvePath(configuration.configFile().orElse(null), System.getenv());
        var settings = KernelSettingsLoader.load(path);
        if (configuration.timeout().isPresent()) {
            settings = settings.withDefaultTimeout(configuration.timeout().get());
        }
        if (configuration.traceOut().isPresent()) {
            settings = settings.withTraceFile(configuration.traceOut().get());
        }
        return settings;
    }

    private Plan loadPlan(PlanTarget target) {
        return target.remoteUri()
            .map(PlanLoader::loadFromHttp)
            .orElseGet(() -> PlanLoader.loadFromFile(target.localPath().orElseThrow()));
    }

    private Map<String, Object> parseInputs(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            var parsed = JSON.readValue(payload, MAP_REF);
            return new LinkedHashMap<>(parsed);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON input payload", ex);
        }
    }

    private static ToolRegistry registryFor(KernelSettings settings) {
        if (settings.registryUrl().isPresent()) {
            return new HttpToolRegistry(URI.create(settings.registryUrl().get()), settings.defaultTimeout());
        }
        var endpoints = new LinkedHashMap<String, String>();
        settings.tools().forEach(endpoint -> endpoints.put(endpoint.name(), endpoint.url()));
        return new HttpToolRegistry(endpoints, settings.defaultTimeout());
    }
}
