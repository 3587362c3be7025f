package io.batchconvert.core.error;

import java.nio.file.Path;

/** Thrown when a writer (or a native save) fails. A partially written file is left in place. */
public final class OutputWriteException extends ConvertException {

    private static final long serialVersionUID = 1L;

    public OutputWriteException(Path output, Throwable cause) {
        super(ErrorCode.OUT_FILE_FAILED_WRITE, "Failed to write output file: " + output, cause);
    }
}
