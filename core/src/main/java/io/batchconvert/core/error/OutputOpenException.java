package io.batchconvert.core.error;

import java.nio.file.Path;

/** Thrown when an output file cannot be opened for writing. */
public final class OutputOpenException extends ConvertException {

    private static final long serialVersionUID = 1L;

    public OutputOpenException(Path output, Throwable cause) {
        super(ErrorCode.OUT_FILE_FAILED_OPEN, "Failed to open output file: " + output, cause);
    }

    /** For outputs that never became a valid {@link Path}. */
    public OutputOpenException(String output, Throwable cause) {
        super(ErrorCode.OUT_FILE_FAILED_OPEN, "Failed to open output file: " + output, cause);
    }
}
