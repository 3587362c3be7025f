package io.batchconvert.standalone.cli;

import io.batchconvert.core.model.BatchResult;
import io.batchconvert.core.spi.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reports batch progress through the application log. */
public final class LoggingProgressListener implements ProgressListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void start() {
        LOG.info("batch.started");
    }

    @Override
    public void progress(long current, long total, String label) {
        LOG.info("batch.progress current={} total={} label={}", current, total, label);
    }

    @Override
    public void finish(BatchResult result) {
        if (result.isOk()) {
            LOG.info("batch.finished result={} jobs={}", result.type(), result.jobCount());
        } else {
            LOG.warn(
                    "batch.finished result={} jobs={} failed={} code={}",
                    result.type(),
                    result.jobCount(),
                    result.failures().size(),
                    result.code());
        }
    }
}
