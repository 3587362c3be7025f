package io.batchconvert.core.model;

import io.batchconvert.core.spi.TransformOptions;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One normalized unit of work: one input document converted to one output (or one output per
 * part). Carries everything needed to process it in isolation.
 *
 * @param input     input document path
 * @param output    output target
 * @param transform transform options, or {@code null} for none
 */
public record ConversionJob(Path input, OutputSpec output, TransformOptions transform) {

    public ConversionJob {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }

    /** Creates a job without transform options. */
    public static ConversionJob of(Path input, OutputSpec output) {
        return new ConversionJob(input, output, null);
    }

    public boolean hasTransform() {
        return transform != null;
    }
}
