package io.batchconvert.core.spi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A document loaded by a {@link DocumentLoader}. Owned by the dispatcher for the duration of one
 * job and closed when the job ends, whatever its outcome. Never shared across jobs.
 */
public interface LoadedDocument extends Document, AutoCloseable {

    /** The named parts (sub-documents) in declaration order. */
    List<? extends Document> parts();

    /**
     * Saves the document in its native format.
     *
     * @param path destination file
     * @throws IOException if the document cannot be saved
     */
    void save(Path path) throws IOException;

    /** Replaces the document's audio settings with the named sound profile. */
    void applySoundProfile(String soundProfile);

    /** Releases the document. Must not throw. */
    @Override
    void close();
}
