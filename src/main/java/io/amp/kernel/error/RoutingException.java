package io.amp.kernel.error;

public final class RoutingException extends KernelException {
    public RoutingException(String capability, String message) {
        super("routing", message, capability);
    }

    public String capability() {
        return (String) data();
    }
}
