package io.batchconvert.core.spi;

import io.batchconvert.core.model.BatchResult;

/**
 * Progress sink for batch runs. {@link #start()} and {@link #finish(BatchResult)} are each called
 * exactly once per run; {@link #progress} once per job before it is dispatched.
 *
 * <p>
 * Calls are serialized by the runner even when jobs run in parallel. Exceptions thrown by a
 * listener are caught and logged; they do not affect the batch.
 */
public interface ProgressListener {

    /** Listener that ignores every event. */
    ProgressListener NOOP = new ProgressListener() {
        @Override
        public void start() {}

        @Override
        public void progress(long current, long total, String label) {}

        @Override
        public void finish(BatchResult result) {}
    };

    void start();

    /**
     * Called before a job is dispatched.
     *
     * @param current 1-based number of the job being started
     * @param total   number of jobs in the batch
     * @param label   input path of the job
     */
    void progress(long current, long total, String label);

    void finish(BatchResult result);
}
