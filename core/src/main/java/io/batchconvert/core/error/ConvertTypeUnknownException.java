package io.batchconvert.core.error;

/** Thrown when no writer is registered for the requested output kind. */
public final class ConvertTypeUnknownException extends ConvertException {

    private static final long serialVersionUID = 1L;

    private final String kind;

    public ConvertTypeUnknownException(String kind) {
        super(ErrorCode.CONVERT_TYPE_UNKNOWN, "No writer registered for output kind '" + kind + "'");
        this.kind = kind;
    }

    /** The output kind (lower-case suffix) that had no writer. */
    public String kind() {
        return kind;
    }
}
