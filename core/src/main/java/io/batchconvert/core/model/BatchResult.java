package io.batchconvert.core.model;

import io.batchconvert.core.error.BatchConvertException;
import io.batchconvert.core.error.ConvertException;
import io.batchconvert.core.error.ErrorCode;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of a batch. Exactly one of three states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: every job converted.
 * <li>{@link Type#FAILED}: the batch ran but at least one job failed; {@code failures} lists them
 * in job order.
 * <li>{@link Type#REJECTED}: the job file could not be read or parsed; no job ran.
 * </ul>
 *
 * <p>
 * Immutable.
 */
public final class BatchResult {

    /** The type of batch outcome. */
    public enum Type {
        SUCCESS,
        FAILED,
        REJECTED
    }

    private final Type type;
    private final int jobCount;
    private final List<JobFailure> failures;
    private final ConvertException rejection;

    private BatchResult(Type type, int jobCount, List<JobFailure> failures, ConvertException rejection) {
        this.type = type;
        this.jobCount = jobCount;
        this.failures = List.copyOf(failures);
        this.rejection = rejection;
    }

    /** Creates a SUCCESS result for a batch of {@code jobCount} jobs. */
    public static BatchResult success(int jobCount) {
        return new BatchResult(Type.SUCCESS, jobCount, List.of(), null);
    }

    /**
     * Creates a FAILED result.
     *
     * @throws IllegalArgumentException if {@code failures} is empty
     */
    public static BatchResult failed(int jobCount, List<JobFailure> failures) {
        Objects.requireNonNull(failures, "failures must not be null");
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("a FAILED result needs at least one failure");
        }
        return new BatchResult(Type.FAILED, jobCount, failures, null);
    }

    /** Creates a REJECTED result for a job file that could not be turned into jobs. */
    public static BatchResult rejected(ConvertException rejection) {
        Objects.requireNonNull(rejection, "rejection must not be null");
        return new BatchResult(Type.REJECTED, 0, List.of(), rejection);
    }

    public Type type() {
        return type;
    }

    public boolean isOk() {
        return type == Type.SUCCESS;
    }

    /** Number of jobs the batch contained (0 when rejected). */
    public int jobCount() {
        return jobCount;
    }

    /** Failed jobs in job order; empty unless {@code type() == FAILED}. */
    public List<JobFailure> failures() {
        return failures;
    }

    /** The job-file error, only set when {@code type() == REJECTED}. */
    public ConvertException rejection() {
        return rejection;
    }

    /**
     * Aggregate error code: {@code null} on success, {@link ErrorCode#CONVERT_FAILED} when jobs
     * failed, the job-file error's code when rejected.
     */
    public ErrorCode code() {
        return switch (type) {
            case SUCCESS -> null;
            case FAILED -> ErrorCode.CONVERT_FAILED;
            case REJECTED -> rejection.code();
        };
    }

    /** Newline-joined failure report; empty on success. */
    public String message() {
        return switch (type) {
            case SUCCESS -> "";
            case FAILED -> failures.stream().map(JobFailure::message).collect(Collectors.joining("\n"));
            case REJECTED -> rejection.getMessage();
        };
    }

    /**
     * Throws the aggregate failure if the batch did not succeed.
     *
     * @throws BatchConvertException when jobs failed
     * @throws ConvertException      the job-file error when rejected
     */
    public void throwIfFailed() {
        if (type == Type.FAILED) {
            throw new BatchConvertException(failures);
        }
        if (type == Type.REJECTED) {
            throw rejection;
        }
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "BatchResult[SUCCESS, jobs=" + jobCount + "]";
            case FAILED -> "BatchResult[FAILED, jobs=" + jobCount + ", failed=" + failures.size() + "]";
            case REJECTED -> "BatchResult[REJECTED, code=" + rejection.code() + "]";
        };
    }
}
