package io.amp.kernel.cli;

import picocli.CommandLine;

public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new AmpRunCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
