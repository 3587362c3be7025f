package io.batchconvert.core.spi;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Exports that the document backend performs end to end: it loads the input itself and writes a
 * combined result. The converter only delegates to it.
 *
 * <p>
 * Implementations MUST be thread-safe.
 */
public interface BackendExporter {

    /**
     * Writes a media bundle (audio, rendered pages and playback highlights) as one JSON file.
     *
     * @param highlightConfig optional highlight configuration, or {@code null}
     */
    void exportMedia(Path input, Path output, Path highlightConfig, Path stylePath, boolean forceMode)
            throws IOException;

    /** Writes the document's metadata (title, parts, page count...) as JSON. */
    void exportMeta(Path input, Path output, Path stylePath, boolean forceMode) throws IOException;

    /** Writes every part as native data into one JSON file. */
    void exportParts(Path input, Path output, Path stylePath, boolean forceMode) throws IOException;

    /** Writes every part as PDF into one JSON file. */
    void exportPartsPdfs(Path input, Path output, Path stylePath, boolean forceMode) throws IOException;

    /**
     * Applies the transform options and writes the transformed document and its parts as JSON.
     *
     * @param optionsJson transform options as a JSON object
     */
    void exportTranspose(Path input, Path output, String optionsJson, Path stylePath, boolean forceMode)
            throws IOException;

    /**
     * Replaces the source reference stored in the document and saves it in place.
     *
     * @param newSource new source reference, e.g. a URL
     */
    void updateSource(Path input, String newSource, boolean forceMode) throws IOException;
}
