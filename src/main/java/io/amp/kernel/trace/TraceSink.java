package io.amp.kernel.trace;

@FunctionalInterface
public interface TraceSink {
    TraceSink NOOP = event -> { };

    void accept(TraceEvent event);
}
