package io.amp.kernel.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.amp.kernel.api.KernelRunConfiguration;
import io.amp.kernel.api.KernelRunner;
import io.amp.kernel.api.LogLevel;
import io.amp.kernel.api.PlanTarget;
import io.amp.kernel.api.RunResult;
import io.amp.kernel.shared.DurationParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "amp-run",
    description = "Execute an AMP plan against registered tool services.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true,
    subcommands = VerifyTraceCommand.class
)
final class AmpRunCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-p", "--plan"},
        description = "Plan file (JSON or YAML) or HTTP(S) URL.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String plan;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-",
        description = "JSON input variables; a file, inline object, or '-' for stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = "--config",
        description = "Kernel configuration file (default: $AMP_CONFIG or ./amp.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--trace-out",
        description = "Append the signed NDJSON trace to this file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path traceOut;

    @CommandLine.Option(
        names = "--log-level",
        description = "Kernel log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--timeout",
        description = "Default per-invocation timeout (e.g. 500ms, 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @Override
    public Integer call() throws Exception {
        if (plan == null || plan.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: '--plan'");
        }
        Optional<Duration> timeout = parseTimeout();
        var configuration = KernelRunConfiguration.builder()
            .planTarget(PlanTarget.parse(plan))
            .inputPayload(loadInputPayload())
            .configFile(config)
            .traceOut(traceOut)
            .timeout(timeout)
            .logLevel(resolveLogLevel())
            .build();

        RunResult result = new KernelRunner().run(configuration);
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private Optional<Duration> parseTimeout() {
        if (timeoutRaw == null || timeoutRaw.isBlank()) {
            return Optional.empty();
        }
        var parsed = DurationParser.parse(timeoutRaw);
        if (parsed.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid --timeout value: " + timeoutRaw);
        }
        return parsed;
    }

    private String loadInputPayload() {
        if (input == null || input.isBlank()) {
            return "{}";
        }
        if ("-".equals(input)) {
            String payload = readStdin();
            validateJsonPayload(payload);
            return payload;
        }
        String trimmed = input.trim();
        if (trimmed.startsWith("{")) {
            validateJsonPayload(trimmed);
            return trimmed;
        }
        Path path = Paths.get(input).toAbsolutePath().normalize();
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            validateJsonPayload(content);
            return content;
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + path);
        }
    }

    private void validateJsonPayload(String payload) {
        String trimmed = payload == null ? "" : payload.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        try {
            var node = JSON.readTree(trimmed);
            if (node != null && !node.isObject()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "JSON payload must be an object");
            }
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON payload: " + ex.getMessage());
        }
    }

    private String readStdin() {
        try {
            InputStream stdin = System.in;
            byte[] bytes = stdin.readAllBytes();
            if (bytes.length == 0) {
                return "{}";
            }
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("AMP_LOG_LEVEL");
        }
        return LogLevel.from(candidate);
    }
}
