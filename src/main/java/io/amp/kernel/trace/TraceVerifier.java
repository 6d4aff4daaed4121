package io.amp.kernel.trace;

import java.util.List;

/**
 * Re-computes the signature chain of a trace and reports the first event that does not match.
 */
public final class TraceVerifier {
    private TraceVerifier() {}

    public static Result verify(List<TraceEvent> events, TraceSigner signer) {
        var previous = "";
        for (int i = 0; i < events.size(); i++) {
            var event = events.get(i);
            if (event.seq() != i) {
                return Result.invalid(i, "expected seq " + i + " but found " + event.seq());
            }
            var expected = signer.sign(previous, event);
            if (!expected.equals(event.signature())) {
                return Result.invalid(i, "signature mismatch");
            }
            previous = event.signature();
        }
        return new Result(true, -1, null, events.size());
    }

    public record Result(boolean valid, int firstInvalidIndex, String reason, int checked) {
        static Result invalid(int index, String reason) {
            return new Result(false, index, reason, index);
        }
    }
}
