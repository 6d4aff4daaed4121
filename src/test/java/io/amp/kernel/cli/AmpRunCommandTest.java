package io.amp.kernel.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.amp.kernel.support.StubToolServer;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class AmpRunCommandTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private StubToolServer tools;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        tools = new StubToolServer()
            .json("/spec/echo", Map.of("name", "echo", "capabilities", List.of("echo"),
                "constraints", Map.of("cost_per_call_usd", 0.001, "latency_p50_ms", 5)))
            .json("/invoke/echo", Map.of("result", Map.of("echo", "hi")));
        out = new StringWriter();
        err = new StringWriter();
        cli = Main.newCommandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        tools.close();
    }

    private Path config() throws Exception {
        var config = tempDir.resolve("amp.toml");
        Files.writeString(config, String.join("\n",
            "[kernel]",
            "signing_key = \"cli-key\"",
            "",
            "[[tools]]",
            "name = \"echo\"",
            "url = \"" + tools.baseUrl() + "\"",
            ""));
        return config;
    }

    private Path plan() throws Exception {
        var plan = tempDir.resolve("plan.json");
        Files.writeString(plan, "{\"nodes\": [{\"id\": \"say\", \"op\": \"call\", \"tool\": \"echo\", \"args\": {\"text\": \"$msg\"}}]}");
        return plan;
    }

    @Test
    void runsPlanAgainstHttpToolsAndPrintsResult() throws Exception {
        var trace = tempDir.resolve("trace.ndjson");

        int exit = cli.execute("--plan", plan().toString(), "--input", "{\"msg\": \"hi\"}",
            "--config", config().toString(), "--trace-out", trace.toString(), "--timeout", "5s");

        assertEquals(0, exit, err::toString);
        var printed = JSON.readTree(out.toString());
        assertEquals("completed", printed.path("status").asText());
        assertEquals("hi", printed.path("metadata").path("outputs").path("say").path("echo").asText());
        assertTrue(tools.requests().stream().anyMatch(request -> request.contains("POST /invoke/echo {\"args\":{\"text\":\"hi\"}}")));
        assertTrue(Files.exists(trace));
    }

    @Test
    void verifyTraceAcceptsIntactAndRejectsEditedTraces() throws Exception {
        var trace = tempDir.resolve("trace.ndjson");
        var config = config();
        assertEquals(0, cli.execute("--plan", plan().toString(), "--input", "{\"msg\": \"hi\"}",
            "--config", config.toString(), "--trace-out", trace.toString()));
        out.getBuffer().setLength(0);

        var verify = Main.newCommandLine();
        verify.setOut(new PrintWriter(out));
        assertEquals(0, verify.execute("verify-trace", trace.toString(), "--config", config.toString()));
        assertTrue(out.toString().startsWith("OK: "));

        var lines = Files.readAllLines(trace);
        lines.remove(1);
        Files.write(trace, lines);
        out.getBuffer().setLength(0);

        var recheck = Main.newCommandLine();
        recheck.setOut(new PrintWriter(out));
        assertEquals(1, recheck.execute("verify-trace", trace.toString(), "--key", "cli-key"));
        assertTrue(out.toString().startsWith("INVALID at event"));
    }

    @Test
    void missingPlanIsUsageError() {
        int exit = cli.execute("--input", "{}");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
        assertTrue(err.toString().contains("Missing required option: '--plan'"));
    }

    @Test
    void malformedInlineInputIsRejected() throws Exception {
        int exit = cli.execute("--plan", plan().toString(), "--input", "{\"msg\": ", "--config", config().toString());

        assertEquals(CommandLine.ExitCode.USAGE, exit);
        assertTrue(err.toString().contains("Invalid JSON payload"));
    }

    @Test
    void failedRunExitsWithOne() throws Exception {
        int exit = cli.execute("--plan", tempDir.resolve("nope.json").toString(), "--config", config().toString());

        assertEquals(1, exit);
        assertEquals("failed", JSON.readTree(out.toString()).path("status").asText());
    }
}
