package io.amp.kernel.error;

public final class ConstraintViolationException extends KernelException {
    public ConstraintViolationException(String tool, String message) {
        super("constraint_violation", message, tool);
    }
}
