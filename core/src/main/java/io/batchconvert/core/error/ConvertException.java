package io.batchconvert.core.error;

import java.util.Objects;

/**
 * Abstract base for all batch-convert exceptions. Never thrown directly; every concrete subclass
 * is bound to exactly one {@link ErrorCode}.
 */
public abstract class ConvertException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;

    protected ConvertException(ErrorCode code, String message) {
        super(message != null ? message : code.description());
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    protected ConvertException(ErrorCode code, String message, Throwable cause) {
        super(message != null ? message : code.description(), cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    /** The error code of this failure. */
    public ErrorCode code() {
        return code;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** Renders the failure as {@code [CODE] detail}, the form used in batch reports. */
    public String describe() {
        return "[" + code.name() + "] " + getMessage();
    }
}
