package io.amp.kernel.error;

public final class AssertionFailedException extends KernelException {
    public AssertionFailedException(String nodeId, String condition) {
        super("assertion_failed", "Assertion failed in node " + nodeId + ": " + condition, condition);
    }
}
