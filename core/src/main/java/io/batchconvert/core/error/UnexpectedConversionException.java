package io.batchconvert.core.error;

/** Assertion-level failure: a collaborator broke its contract (e.g. a loader returned no document). */
public final class UnexpectedConversionException extends ConvertException {

    private static final long serialVersionUID = 1L;

    public UnexpectedConversionException(String message) {
        super(ErrorCode.UNKNOWN_ERROR, message);
    }

    public UnexpectedConversionException(String message, Throwable cause) {
        super(ErrorCode.UNKNOWN_ERROR, message, cause);
    }
}
