package io.batchconvert.core.error;

/**
 * Thrown by an {@link io.batchconvert.core.spi.ExtensionRunner} when an extension fails.
 * Propagated unchanged to the batch report.
 */
public final class ExtensionException extends ConvertException {

    private static final long serialVersionUID = 1L;

    public ExtensionException(String message) {
        super(ErrorCode.EXTENSION_FAILED, message);
    }

    public ExtensionException(String message, Throwable cause) {
        super(ErrorCode.EXTENSION_FAILED, message, cause);
    }
}
