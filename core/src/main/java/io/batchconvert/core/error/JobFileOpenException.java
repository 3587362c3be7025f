package io.batchconvert.core.error;

/** Thrown when a batch job file cannot be read. */
public final class JobFileOpenException extends JobFileException {

    private static final long serialVersionUID = 1L;

    public JobFileOpenException(String source, Throwable cause) {
        super(ErrorCode.BATCH_JOB_FILE_FAILED_OPEN, "Cannot read batch job file: " + source, cause, source);
    }
}
