package io.batchconvert.core.spi;

import io.batchconvert.core.model.OutputTarget;
import io.batchconvert.core.model.WriterOptions;
import java.io.IOException;
import java.util.Set;

/**
 * Format-specific writer SPI (PDF, PNG, SVG, audio...). Registered in a
 * {@link io.batchconvert.core.engine.WriterRegistry} under each of its {@link #suffixes()}.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface DocumentWriter {

    /**
     * Output kinds handled by this writer, e.g. {@code "pdf"}.
     *
     * @return non-empty set of lower-case suffixes without the leading dot
     */
    Set<String> suffixes();

    /**
     * Serializes the document (or the page / part selected by {@code options}) into the target.
     *
     * @param document whole document or one part of it
     * @param target   open output; the writer must not close it
     * @param options  page and unit selection
     * @throws IOException on any write failure
     */
    void write(Document document, OutputTarget target, WriterOptions options) throws IOException;
}
