package io.amp.kernel.error;

public final class ArgumentResolutionException extends KernelException {
    public ArgumentResolutionException(String message, String expression) {
        super("argument_resolution", message, expression);
    }
}
