package io.amp.kernel.cli;

import io.amp.kernel.config.KernelSettingsLoader;
import io.amp.kernel.trace.TraceReader;
import io.amp.kernel.trace.TraceSigner;
import io.amp.kernel.trace.TraceVerifier;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "verify-trace",
    description = "Verify the HMAC signature chain of a trace file.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class VerifyTraceCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "TRACE", description = "NDJSON trace file.")
    private Path trace;

    @CommandLine.Option(
        names = "--key",
        description = "Signing key (default: signing_key from the kernel configuration).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String key;

    @CommandLine.Option(
        names = "--config",
        description = "Kernel configuration file (default: $AMP_CONFIG or ./amp.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @Override
    public Integer call() throws Exception {
        String secret = key;
        if (secret == null || secret.isBlank()) {
            var settings = KernelSettingsLoader.load(KernelSettingsLoader.resolvePath(config, System.getenv()));
            secret = settings.signingKey().orElseThrow(() -> new CommandLine.ParameterException(
                spec.commandLine(), "No signing key: pass --key or set signing_key in the configuration"));
        }
        var events = TraceReader.read(trace);
        var result = TraceVerifier.verify(events, TraceSigner.fromSecret(secret));
        var out = spec.commandLine().getOut();
        if (result.valid()) {
            out.println("OK: " + result.checked() + " events verified");
            out.flush();
            return 0;
        }
        out.println("INVALID at event " + result.firstInvalidIndex() + ": " + result.reason());
        out.flush();
        return 1;
    }
}
