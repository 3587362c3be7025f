package io.batchconvert.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Transposition SPI: validates a job's transform payload and applies it to a loaded document.
 */
public interface Transposer {

    /**
     * Parses the {@code transpose} object of a job.
     *
     * @param options non-empty JSON object from the job file
     * @return parsed options, never {@code null}
     * @throws io.batchconvert.core.error.TransformOptionsException if the payload is invalid
     */
    TransformOptions parseOptions(JsonNode options);

    /**
     * Applies the options to the document.
     *
     * @throws io.batchconvert.core.error.TransposeException if the transform cannot be applied
     */
    void apply(LoadedDocument document, TransformOptions options);
}
