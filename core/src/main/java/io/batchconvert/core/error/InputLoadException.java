package io.batchconvert.core.error;

import java.nio.file.Path;

/**
 * Thrown when the document loader fails for any reason. The loader's own error is kept as the
 * cause for logging but is not part of the message.
 */
public final class InputLoadException extends ConvertException {

    private static final long serialVersionUID = 1L;

    public InputLoadException(Path input, Throwable cause) {
        super(ErrorCode.IN_FILE_FAILED_LOAD, "Failed to load input file: " + input, cause);
    }
}
