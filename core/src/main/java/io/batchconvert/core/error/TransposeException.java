package io.batchconvert.core.error;

/**
 * Thrown by a {@link io.batchconvert.core.spi.Transposer} when a transform cannot be applied to a
 * loaded document. Propagated unchanged to the batch report.
 */
public final class TransposeException extends ConvertException {

    private static final long serialVersionUID = 1L;

    public TransposeException(String message) {
        super(ErrorCode.TRANSPOSE_FAILED, message);
    }

    public TransposeException(String message, Throwable cause) {
        super(ErrorCode.TRANSPOSE_FAILED, message, cause);
    }
}
