package io.amp.kernel.trace;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-run, append-only trace log. Appends are serialized so sequence numbers are unique and
 * monotonic and each signature chains to the one before it.
 */
public final class TraceEmitter {
    private static final Logger log = LoggerFactory.getLogger(TraceEmitter.class);

    private final String planId;
    private final TraceSigner signer;
    private final TraceSink sink;
    private final List<TraceEvent> events = new ArrayList<>();
    private String lastSignature = "";
    private long nextSeq;

    public TraceEmitter(String planId, TraceSigner signer, TraceSink sink) {
        this.planId = Objects.requireNonNull(planId, "planId");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.sink = sink == null ? TraceSink.NOOP : sink;
    }

    public String planId() {
        return planId;
    }

    public TraceEvent emit(String stepId, TraceEventType type, Map<String, Object> data) {
        return emit(stepId, type, data, null, null, null, null);
    }

    public synchronized TraceEvent emit(
        String stepId,
        TraceEventType type,
        Map<String, Object> data,
        Double costUsd,
        Long tokensIn,
        Long tokensOut,
        List<String> citations
    ) {
        var unsigned = new TraceEvent(planId, nextSeq, stepId, Instant.now().toString(), type,
            costUsd, tokensIn, tokensOut, citations, null, data);
        var signed = unsigned.withSignature(signer.sign(lastSignature, unsigned));
        events.add(signed);
        lastSignature = signed.signature();
        nextSeq++;
        log.trace("trace #{} {} {}", signed.seq(), type.wireName(), stepId);
        sink.accept(signed);
        return signed;
    }

    public synchronized List<TraceEvent> events() {
        return List.copyOf(events);
    }
}
