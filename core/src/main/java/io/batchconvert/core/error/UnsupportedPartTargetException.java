package io.batchconvert.core.error;

/** Thrown when a templated (per-part) output is requested for a kind that cannot be split into parts. */
public final class UnsupportedPartTargetException extends ConvertException {

    private static final long serialVersionUID = 1L;

    public UnsupportedPartTargetException(String kind) {
        super(ErrorCode.NOT_SUPPORTED, "Part conversion is not supported for output kind '" + kind + "'");
    }
}
