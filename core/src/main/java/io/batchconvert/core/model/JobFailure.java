package io.batchconvert.core.model;

import io.batchconvert.core.error.ConvertException;
import io.batchconvert.core.error.ErrorCode;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A failed job as recorded in a {@link BatchResult}.
 *
 * @param input  input path of the failed job
 * @param output output of the failed job, in display form
 * @param code   error code of the first failure
 * @param detail error detail
 */
public record JobFailure(Path input, String output, ErrorCode code, String detail) {

    public JobFailure {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(code, "code must not be null");
        if (detail == null) {
            detail = code.description();
        }
    }

    /** Records the failure of a job from the exception that aborted it. */
    public static JobFailure of(ConversionJob job, ConvertException error) {
        return new JobFailure(job.input(), job.output().display(), error.code(), error.detail());
    }

    /** Records a failure with the given code and detail. */
    public static JobFailure of(ConversionJob job, ErrorCode code, String detail) {
        return new JobFailure(job.input(), job.output().display(), code, detail);
    }

    /** The report line for this failure. */
    public String message() {
        return "failed convert, err: [" + code.name() + "] " + detail + ", in: " + input + ", out: " + output;
    }
}
