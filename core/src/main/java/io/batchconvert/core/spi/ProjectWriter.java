package io.batchconvert.core.spi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Writer that renders a whole loaded project rather than a single document, e.g. a video of the
 * score being played back. Project writers manage their own output file.
 */
public interface ProjectWriter {

    /**
     * Output kinds handled by this writer, e.g. {@code "mp4"}.
     *
     * @return non-empty set of suffixes without the leading dot
     */
    Set<String> suffixes();

    /**
     * Renders the project to {@code output}.
     *
     * @param project the loaded project, owned by the caller
     * @param output  file to create or overwrite
     * @throws IOException on any write failure
     */
    void write(LoadedDocument project, Path output) throws IOException;
}
