package io.batchconvert.core.error;

/**
 * Thrown by a {@link io.batchconvert.core.spi.Transposer} when a transform payload cannot be
 * parsed. Raised while reading a job file it aborts the entire batch.
 */
public final class TransformOptionsException extends ConvertException {

    private static final long serialVersionUID = 1L;

    public TransformOptionsException(String message) {
        super(ErrorCode.TRANSFORM_OPTIONS_INVALID, message);
    }

    public TransformOptionsException(String message, Throwable cause) {
        super(ErrorCode.TRANSFORM_OPTIONS_INVALID, message, cause);
    }
}
