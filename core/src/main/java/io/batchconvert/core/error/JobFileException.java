package io.batchconvert.core.error;

/**
 * Abstract parent for errors raised while reading a batch job file. These abort the whole batch
 * before any job runs. Carries the {@code source} identifying the file that caused the error.
 */
public abstract class JobFileException extends ConvertException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected JobFileException(ErrorCode code, String message, String source) {
        super(code, message);
        this.source = source;
    }

    protected JobFileException(ErrorCode code, String message, Throwable cause, String source) {
        super(code, message, cause);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
