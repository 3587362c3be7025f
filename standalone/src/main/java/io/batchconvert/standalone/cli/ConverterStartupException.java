package io.batchconvert.standalone.cli;

/** Thrown when the converter cannot be assembled from the discovered plugins. */
public class ConverterStartupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConverterStartupException(String message) {
        super(message);
    }

    public ConverterStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
