package io.amp.kernel.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record KernelSettings(
    Duration defaultTimeout,
    int maxParallelism,
    Optional<String> signingKey,
    Optional<Path> traceFile,
    RetrySettings retry,
    String memoryTool,
    String memoryDefaultTtl,
    String verifyTool,
    Optional<String> registryUrl,
    List<ToolEndpoint> tools
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_PARALLELISM = 8;
    public static final String DEFAULT_MEMORY_TOOL = "mesh.mem.sqlite";
    public static final String DEFAULT_MEMORY_TTL = "P90D";
    public static final String DEFAULT_VERIFY_TOOL = "ground.verify";
    public static final List<ToolEndpoint> DEFAULT_TOOLS = List.of(
        new ToolEndpoint("doc.search.local", "http://localhost:7401"),
        new ToolEndpoint("ground.verify", "http://localhost:7402"),
        new ToolEndpoint("mesh.mem.sqlite", "http://localhost:7403")
    );

    public KernelSettings {
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(signingKey, "signingKey");
        Objects.requireNonNull(traceFile, "traceFile");
        Objects.requireNonNull(retry, "retry");
        Objects.requireNonNull(registryUrl, "registryUrl");
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("max_parallelism must be at least 1");
        }
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static KernelSettings defaults() {
        return new KernelSettings(
            DEFAULT_TIMEOUT,
            DEFAULT_PARALLELISM,
            Optional.empty(),
            Optional.empty(),
            RetrySettings.DEFAULT,
            DEFAULT_MEMORY_TOOL,
            DEFAULT_MEMORY_TTL,
            DEFAULT_VERIFY_TOOL,
            Optional.empty(),
            DEFAULT_TOOLS
        );
    }

    public KernelSettings withDefaultTimeout(Duration timeout) {
        return new KernelSettings(timeout, maxParallelism, signingKey, traceFile, retry, memoryTool, memoryDefaultTtl,
            verifyTool, registryUrl, tools);
    }

    public KernelSettings withTraceFile(Path path) {
        return new KernelSettings(defaultTimeout, maxParallelism, signingKey, Optional.ofNullable(path), retry, memoryTool,
            memoryDefaultTtl, verifyTool, registryUrl, tools);
    }

    public KernelSettings withSigningKey(String key) {
        return new KernelSettings(defaultTimeout, maxParallelism, Optional.ofNullable(key), traceFile, retry, memoryTool,
            memoryDefaultTtl, verifyTool, registryUrl, tools);
    }

    public KernelSettings withRetry(RetrySettings newRetry) {
        return new KernelSettings(defaultTimeout, maxParallelism, signingKey, traceFile, newRetry, memoryTool,
            memoryDefaultTtl, verifyTool, registryUrl, tools);
    }

    public record RetrySettings(int maxAttempts, Duration backoff, double multiplier) {
        public static final RetrySettings DEFAULT = new RetrySettings(3, Duration.ofMillis(500), 2.0);

        public RetrySettings {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("retry.max_attempts must be at least 1");
            }
            Objects.requireNonNull(backoff, "backoff");
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("retry.multiplier must be at least 1.0");
            }
        }
    }

    public record ToolEndpoint(String name, String url) {}
}
