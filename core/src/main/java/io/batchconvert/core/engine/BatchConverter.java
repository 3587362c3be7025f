package io.batchconvert.core.engine;

import io.batchconvert.core.error.ConvertException;
import io.batchconvert.core.error.ErrorCode;
import io.batchconvert.core.error.UnexpectedConversionException;
import io.batchconvert.core.job.JobFileParser;
import io.batchconvert.core.model.BatchResult;
import io.batchconvert.core.model.ConversionJob;
import io.batchconvert.core.model.JobFailure;
import io.batchconvert.core.spi.ProgressListener;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a batch of conversion jobs and aggregates the outcome.
 *
 * <p>
 * A failing job never stops the batch: its error is recorded as a {@link JobFailure} and the
 * next job runs. The batch fails ({@link ErrorCode#CONVERT_FAILED}) if at least one job failed.
 * Errors in the job file itself (unreadable, malformed, invalid transform options) reject the
 * whole batch before any job runs.
 *
 * <p>
 * With a parallelism of 1 (the default) jobs run strictly in order on the calling thread. A
 * higher parallelism runs them on a bounded worker pool; failures are still reported in job
 * order.
 *
 * <p>
 * {@link #cancel()} is cooperative: jobs already running complete, jobs not yet started are
 * recorded as {@link ErrorCode#CANCELLED}.
 */
public final class BatchConverter {

    private static final Logger LOG = LoggerFactory.getLogger(BatchConverter.class);

    private final JobFileParser parser;
    private final ConversionDispatcher dispatcher;
    private final int parallelism;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Object listenerLock = new Object();

    /** Creates a sequential batch converter. */
    public BatchConverter(JobFileParser parser, ConversionDispatcher dispatcher) {
        this(parser, dispatcher, 1);
    }

    /**
     * Creates a batch converter.
     *
     * @param parser      job file parser
     * @param dispatcher  per-job dispatcher
     * @param parallelism maximum number of jobs converted at the same time (at least 1)
     */
    public BatchConverter(JobFileParser parser, ConversionDispatcher dispatcher, int parallelism) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    public int parallelism() {
        return parallelism;
    }

    /**
     * Parses the job file and runs every job in it.
     *
     * @param jobFile  JSON batch job file
     * @param listener progress sink, or {@code null}
     * @return the aggregate result; {@link BatchResult.Type#REJECTED} if the file could not be
     *     turned into jobs
     */
    public BatchResult run(Path jobFile, ProgressListener listener) {
        Objects.requireNonNull(jobFile, "jobFile must not be null");
        ProgressListener sink = listener != null ? listener : ProgressListener.NOOP;
        cancelled.set(false);
        notifyStart(sink);

        List<ConversionJob> jobs;
        try {
            jobs = parser.parse(jobFile);
        } catch (ConvertException e) {
            LOG.error("batch.rejected source={} code={} detail={}", jobFile, e.code(), e.getMessage());
            BatchResult result = BatchResult.rejected(e);
            notifyFinish(sink, result);
            return result;
        } catch (RuntimeException e) {
            LOG.error(
                    "batch.rejected source={} code={} detail={}",
                    jobFile,
                    ErrorCode.UNKNOWN_ERROR,
                    e.getMessage(),
                    e);
            BatchResult result = BatchResult.rejected(
                    new UnexpectedConversionException("Unexpected error reading batch job file: " + e.getMessage(), e));
            notifyFinish(sink, result);
            return result;
        }
        LOG.info("batch.parsed source={} jobs={}", jobFile, jobs.size());
        return execute(jobs, sink);
    }

    /**
     * Runs an already parsed list of jobs.
     *
     * @param jobs     jobs in execution order
     * @param listener progress sink, or {@code null}
     * @return the aggregate result
     */
    public BatchResult run(List<ConversionJob> jobs, ProgressListener listener) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        ProgressListener sink = listener != null ? listener : ProgressListener.NOOP;
        cancelled.set(false);
        notifyStart(sink);
        return execute(List.copyOf(jobs), sink);
    }

    /** Requests cancellation of the running batch. Jobs that have not started yet are skipped. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.info("batch.cancel requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private BatchResult execute(List<ConversionJob> jobs, ProgressListener sink) {
        long startNanos = System.nanoTime();
        int total = jobs.size();
        AtomicLong counter = new AtomicLong();

        JobFailure[] outcomes = parallelism > 1 && total > 1
                ? runParallel(jobs, counter, sink)
                : runSequential(jobs, counter, sink);

        List<JobFailure> failures = new ArrayList<>();
        for (JobFailure outcome : outcomes) {
            if (outcome != null) {
                failures.add(outcome);
            }
        }

        BatchResult result = failures.isEmpty() ? BatchResult.success(total) : BatchResult.failed(total, failures);
        LOG.info(
                "batch.complete jobs={} failed={} duration_ms={}",
                total,
                failures.size(),
                (System.nanoTime() - startNanos) / 1_000_000);
        notifyFinish(sink, result);
        return result;
    }

    private JobFailure[] runSequential(List<ConversionJob> jobs, AtomicLong counter, ProgressListener sink) {
        JobFailure[] outcomes = new JobFailure[jobs.size()];
        for (int i = 0; i < jobs.size(); i++) {
            outcomes[i] = runJob(jobs.get(i), counter, jobs.size(), sink);
        }
        return outcomes;
    }

    private JobFailure[] runParallel(List<ConversionJob> jobs, AtomicLong counter, ProgressListener sink) {
        int total = jobs.size();
        JobFailure[] outcomes = new JobFailure[total];
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, total), new WorkerThreadFactory());
        try {
            List<Future<JobFailure>> futures = new ArrayList<>(total);
            for (ConversionJob job : jobs) {
                futures.add(executor.submit(() -> runJob(job, counter, total, sink)));
            }
            for (int i = 0; i < total; i++) {
                outcomes[i] = await(futures.get(i), jobs.get(i));
            }
        } finally {
            executor.shutdown();
        }
        return outcomes;
    }

    private JobFailure await(Future<JobFailure> future, ConversionJob job) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            future.cancel(false);
            return JobFailure.of(job, ErrorCode.CANCELLED, "Interrupted while waiting for the job");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("job.failed input={} unexpected error", job.input(), cause);
            return JobFailure.of(job, ErrorCode.UNKNOWN_ERROR, cause.toString());
        }
    }

    /** Converts one job; returns its failure, or {@code null} on success. */
    private JobFailure runJob(ConversionJob job, AtomicLong counter, int total, ProgressListener sink) {
        if (cancelled.get()) {
            LOG.info("job.skipped input={} output={} reason=cancelled", job.input(), job.output().display());
            return JobFailure.of(job, ErrorCode.CANCELLED, null);
        }
        notifyProgress(sink, counter.incrementAndGet(), total, job.input().toString());
        try {
            dispatcher.convert(job);
            return null;
        } catch (ConvertException e) {
            LOG.warn(
                    "job.failed input={} output={} code={} detail={}",
                    job.input(),
                    job.output().display(),
                    e.code(),
                    e.getMessage());
            return JobFailure.of(job, e);
        } catch (RuntimeException e) {
            LOG.error("job.failed input={} output={} unexpected error", job.input(), job.output().display(), e);
            return JobFailure.of(job, ErrorCode.UNKNOWN_ERROR, e.toString());
        }
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they must not affect the batch.

    private void notifyStart(ProgressListener sink) {
        synchronized (listenerLock) {
            try {
                sink.start();
            } catch (RuntimeException e) {
                LOG.warn("ProgressListener.start failed", e);
            }
        }
    }

    private void notifyProgress(ProgressListener sink, long current, long total, String label) {
        synchronized (listenerLock) {
            try {
                sink.progress(current, total, label);
            } catch (RuntimeException e) {
                LOG.warn("ProgressListener.progress failed", e);
            }
        }
    }

    private void notifyFinish(ProgressListener sink, BatchResult result) {
        synchronized (listenerLock) {
            try {
                sink.finish(result);
            } catch (RuntimeException e) {
                LOG.warn("ProgressListener.finish failed", e);
            }
        }
    }

    /** Daemon worker threads named {@code batch-convert-N}. */
    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "batch-convert-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
