package io.batchconvert.core.error;

import io.batchconvert.core.model.JobFailure;
import java.util.List;
import java.util.stream.Collectors;

/** Aggregate failure of a batch: one or more jobs failed. The message lists every failure, one per line. */
public final class BatchConvertException extends ConvertException {

    private static final long serialVersionUID = 1L;

    private final transient List<JobFailure> failures;

    public BatchConvertException(List<JobFailure> failures) {
        super(ErrorCode.CONVERT_FAILED, join(failures));
        this.failures = List.copyOf(failures);
    }

    /** The individual job failures, in job order. */
    public List<JobFailure> failures() {
        return failures;
    }

    private static String join(List<JobFailure> failures) {
        return failures.stream().map(JobFailure::message).collect(Collectors.joining("\n"));
    }
}
