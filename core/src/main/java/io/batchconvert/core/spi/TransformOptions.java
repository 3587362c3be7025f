package io.batchconvert.core.spi;

/**
 * Marker for transform options produced by a {@link Transposer}. The core only carries them from
 * the job file to {@link Transposer#apply}; it never inspects them.
 */
public interface TransformOptions {}
