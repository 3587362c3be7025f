package io.batchconvert.core.error;

/**
 * Error taxonomy shared by every conversion failure. The code, not the exception type, is what
 * ends up in aggregate batch reports and process exit decisions.
 */
public enum ErrorCode {
    BATCH_JOB_FILE_FAILED_OPEN("Failed to open batch job file"),
    BATCH_JOB_FILE_FAILED_PARSE("Failed to parse batch job file"),
    TRANSFORM_OPTIONS_INVALID("Invalid transform options"),
    CONVERT_TYPE_UNKNOWN("Unknown conversion type"),
    IN_FILE_FAILED_LOAD("Failed to load input file"),
    OUT_FILE_FAILED_OPEN("Failed to open output file"),
    OUT_FILE_FAILED_WRITE("Failed to write output file"),
    NOT_SUPPORTED("Not supported"),
    TRANSPOSE_FAILED("Failed to apply transposition"),
    EXTENSION_FAILED("Extension failed"),
    UNKNOWN_ERROR("Unknown error"),
    CONVERT_FAILED("Conversion failed"),
    CANCELLED("Cancelled before start");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    /** Short human-readable description, used when a failure carries no further detail. */
    public String description() {
        return description;
    }
}
