package io.amp.kernel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.amp.kernel.support.KernelTestSupport;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KernelSettingsLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void readsEverySection() {
        var settings = KernelSettingsLoader.load(KernelTestSupport.resource("config", "amp.toml"));

        assertEquals(Duration.ofSeconds(5), settings.defaultTimeout());
        assertEquals(4, settings.maxParallelism());
        assertEquals(Optional.of("file-key"), settings.signingKey());
        assertEquals(Optional.of(Path.of("build/trace.ndjson")), settings.traceFile());
        assertEquals(new KernelSettings.RetrySettings(5, Duration.ofMillis(250), 3.0), settings.retry());
        assertEquals("kv.store", settings.memoryTool());
        assertEquals("P30D", settings.memoryDefaultTtl());
        assertEquals("facts.check", settings.verifyTool());
        assertEquals(List.of(
            new KernelSettings.ToolEndpoint("doc.search.local", "http://localhost:9001"),
            new KernelSettings.ToolEndpoint("kv.store", "http://localhost:9002")), settings.tools());
    }

    @Test
    void missingFileMeansDefaults() {
        var settings = KernelSettingsLoader.load(tempDir.resolve("absent.toml"));

        assertEquals(KernelSettings.defaults(), settings);
        assertEquals(3, settings.tools().size());
    }

    @Test
    void partialFileKeepsOtherDefaults() {
        var settings = KernelSettingsLoader.parse("[kernel]\nmax_parallelism = 2\n\n[retry]\nmultiplier = 1.5\n");

        assertEquals(2, settings.maxParallelism());
        assertEquals(KernelSettings.DEFAULT_TIMEOUT, settings.defaultTimeout());
        assertEquals(1.5, settings.retry().multiplier());
        assertEquals(3, settings.retry().maxAttempts());
        assertEquals(KernelSettings.DEFAULT_MEMORY_TOOL, settings.memoryTool());
    }

    @Test
    void numericDurationsAreMilliseconds() {
        var settings = KernelSettingsLoader.parse("[kernel]\ndefault_timeout = 1500\n");

        assertEquals(Duration.ofMillis(1500), settings.defaultTimeout());
    }

    @Test
    void explicitPathBeatsEnvironment() {
        var explicit = Path.of("custom.toml");

        assertEquals(explicit, KernelSettingsLoader.resolvePath(explicit, Map.of("AMP_CONFIG", "/etc/amp.toml")));
        assertEquals(Path.of("/etc/amp.toml"), KernelSettingsLoader.resolvePath(null, Map.of("AMP_CONFIG", "/etc/amp.toml")));
        assertEquals(Path.of("amp.toml"), KernelSettingsLoader.resolvePath(null, Map.of()));
    }

    @Test
    void malformedConfigIsRejected() {
        var ex = assertThrows(IllegalArgumentException.class, () -> KernelSettingsLoader.parse("[kernel\nmax_parallelism = "));
        assertTrue(ex.getMessage().startsWith("Invalid kernel config"));

        assertThrows(IllegalArgumentException.class, () -> KernelSettingsLoader.parse("[retry]\nmultiplier = 0.5\n"));
        assertThrows(IllegalArgumentException.class, () -> KernelSettingsLoader.parse("[memory]\ndefault_ttl = \"soon\"\n"));
        assertThrows(IllegalArgumentException.class, () -> KernelSettingsLoader.parse("[[tools]]\nname = \"x\"\n"));
    }
}
