package io.batchconvert.core.error;

/** Thrown when a batch job file is not well-formed JSON, is not an array, or has an invalid entry. */
public final class JobFileParseException extends JobFileException {

    private static final long serialVersionUID = 1L;

    public JobFileParseException(String message, String source) {
        super(ErrorCode.BATCH_JOB_FILE_FAILED_PARSE, message, source);
    }

    public JobFileParseException(String message, Throwable cause, String source) {
        super(ErrorCode.BATCH_JOB_FILE_FAILED_PARSE, message, cause, source);
    }
}
