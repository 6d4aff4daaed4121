package io.amp.kernel.config;

import io.amp.kernel.shared.DurationParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

public final class KernelSettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(KernelSettingsLoader.class);

    public static final String DEFAULT_FILE = "amp.toml";
    public static final String ENV_VAR = "AMP_CONFIG";

    private KernelSettingsLoader() {}

    /**
     * Explicit path first, then {@code AMP_CONFIG}, then {@code amp.toml} in the working directory.
     */
    public static Path resolvePath(Path explicit, Map<String, String> environment) {
        if (explicit != null) {
            return explicit;
        }
        var fromEnv = environment.get(ENV_VAR);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Path.of(fromEnv.trim());
        }
        return Path.of(DEFAULT_FILE);
    }

    public static KernelSettings load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.debug("No kernel config at {}; using defaults", path);
            return KernelSettings.defaults();
        }
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read kernel config " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static KernelSettings parse(String toml) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid kernel config: " + errors);
        }
        var defaults = KernelSettings.defaults();

        var kernel = table(result, "kernel");
        var timeout = duration(kernel, "default_timeout").orElse(defaults.defaultTimeout());
        var parallelism = kernel == null || kernel.getLong("max_parallelism") == null
            ? defaults.maxParallelism()
            : Math.toIntExact(kernel.getLong("max_parallelism"));
        var signingKey = Optional.ofNullable(kernel == null ? null : kernel.getString("signing_key")).filter(s -> !s.isBlank());
        var traceFile = Optional.ofNullable(kernel == null ? null : kernel.getString("trace_file"))
            .filter(s -> !s.isBlank())
            .map(Path::of);

        var retryTable = table(result, "retry");
        var retry = defaults.retry();
        if (retryTable != null) {
            var attempts = retryTable.getLong("max_attempts");
            var multiplier = retryTable.isLong("multiplier")
                ? Double.valueOf(retryTable.getLong("multiplier"))
                : retryTable.getDouble("multiplier");
            retry = new KernelSettings.RetrySettings(
                attempts == null ? retry.maxAttempts() : Math.toIntExact(attempts),
                duration(retryTable, "backoff").orElse(retry.backoff()),
                multiplier == null ? retry.multiplier() : multiplier
            );
        }

        var memory = table(result, "memory");
        var memoryTool = string(memory, "tool").orElse(defaults.memoryTool());
        var memoryTtl = string(memory, "default_ttl").orElse(defaults.memoryDefaultTtl());
        // fail fast on a malformed TTL rather than on the first write
        DurationParser.parse(memoryTtl);
        var verifyTool = string(table(result, "verify"), "tool").orElse(defaults.verifyTool());
        var registryUrl = string(table(result, "registry"), "url");

        var tools = readTools(result.getArray("tools"));
        return new KernelSettings(
            timeout,
            parallelism,
            signingKey,
            traceFile,
            retry,
            memoryTool,
            memoryTtl,
            verifyTool,
            registryUrl,
            tools.isEmpty() ? defaults.tools() : tools
        );
    }

    private static List<KernelSettings.ToolEndpoint> readTools(TomlArray array) {
        var tools = new ArrayList<KernelSettings.ToolEndpoint>();
        if (array == null) {
            return tools;
        }
        for (int i = 0; i < array.size(); i++) {
            var entry = array.getTable(i);
            var name = entry.getString("name");
            var url = entry.getString("url");
            if (name == null || name.isBlank() || url == null || url.isBlank()) {
                throw new IllegalArgumentException("Invalid kernel config: [[tools]] entry " + (i + 1) + " needs name and url");
            }
            tools.add(new KernelSettings.ToolEndpoint(name, url));
        }
        return tools;
    }

    private static TomlTable table(TomlParseResult result, String name) {
        return result.isTable(name) ? result.getTable(name) : null;
    }

    private static Optional<String> string(TomlTable table, String key) {
        if (table == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.getString(key)).filter(s -> !s.isBlank());
    }

    private static Optional<Duration> duration(TomlTable table, String key) {
        if (table == null || !table.contains(key)) {
            return Optional.empty();
        }
        if (table.isLong(key)) {
            return Optional.of(Duration.ofMillis(table.getLong(key)));
        }
        return DurationParser.parse(table.getString(key));
    }
}
