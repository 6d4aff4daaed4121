package io.amp.kernel.error;

public final class ToolInvocationException extends KernelException {
    private final boolean timeout;

    public ToolInvocationException(String tool, String message, boolean timeout) {
        this(tool, message, timeout, null);
    }

    public ToolInvocationException(String tool, String message, boolean timeout, Throwable cause) {
        super(timeout ? "tool_timeout" : "tool_invocation", message, tool, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }

    public String tool() {
        return (String) data();
    }
}
