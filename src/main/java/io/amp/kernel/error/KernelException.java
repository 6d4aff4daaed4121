package io.amp.kernel.error;

/**
 * Base exception carrying a stable error code and optional structured data for trace records.
 */
public class KernelException extends RuntimeException {
    private final String code;
    private final Object data;

    public KernelException(String code, String message, Object data) {
        this(code, message, data, null);
    }

    public KernelException(String code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
