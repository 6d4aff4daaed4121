package io.amp.kernel.api;

import io.amp.kernel.tools.RegisteredTool;
import io.amp.kernel.tools.StaticToolRegistry;
import io.amp.kernel.tools.ToolInvoker;
import io.amp.kernel.tools.ToolRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration passed to the kernel when running a plan.
 *
 * @param configFile explicit {@code amp.toml}; when empty {@code AMP_CONFIG} and the working directory are tried
 * @param registry overrides the registry derived from the settings (embedding and tests)
 * @param invoker overrides the HTTP tool client (embedding and tests)
 */
public record KernelRunConfiguration(
    PlanTarget planTarget,
    String inputPayload,
    Optional<Path> configFile,
    Optional<Path> traceOut,
    Optional<Duration> timeout,
    LogLevel logLevel,
    Optional<ToolRegistry> registry,
    Optional<ToolInvoker> invoker
) {
    public KernelRunConfiguration {
        Objects.requireNonNull(planTarget, "planTarget");
        Objects.requireNonNull(inputPayload, "inputPayload");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(traceOut, "traceOut");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(invoker, "invoker");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PlanTarget planTarget;
        private String inputPayload = "{}";
        private Optional<Path> configFile = Optional.empty();
        private Optional<Path> traceOut = Optional.empty();
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;
        private ToolRegistry registry;
        private ToolInvoker invoker;

        public Builder planTarget(PlanTarget planTarget) {
            this.planTarget = planTarget;
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder configFile(Path configFile) {
            this.configFile = Optional.ofNullable(configFile);
            return this;
        }

        public Builder traceOut(Path traceOut) {
            this.traceOut = Optional.ofNullable(traceOut);
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder registry(ToolRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder tools(List<RegisteredTool> tools) {
            this.registry = new StaticToolRegistry(tools);
            return this;
        }

        public Builder invoker(ToolInvoker invoker) {
            this.invoker = invoker;
            return this;
        }

        public KernelRunConfiguration build() {
            return new KernelRunConfiguration(
                planTarget,
                inputPayload,
                configFile,
                traceOut,
                timeout,
                logLevel,
                Optional.ofNullable(registry),
                Optional.ofNullable(invoker)
            );
        }
    }
}
