package io.batchconvert.core.spi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Pluggable document loading SPI. Turns an input file into a {@link LoadedDocument}.
 *
 * <p>
 * Implementations MUST be thread-safe if the batch runs with a parallelism above one.
 */
public interface DocumentLoader {

    /**
     * Loads the document at {@code input}.
     *
     * @param input     input document
     * @param stylePath optional style/template file applied after loading, or {@code null}
     * @param forceMode bypass version and compatibility checks
     * @return the loaded document, never {@code null}
     * @throws IOException on any load failure
     */
    LoadedDocument load(Path input, Path stylePath, boolean forceMode) throws IOException;

    /**
     * Output suffixes that are this tool's own save format. Outputs of these kinds are written
     * with {@link LoadedDocument#save(Path)} instead of a writer.
     */
    default Set<String> nativeSuffixes() {
        return Set.of();
    }
}
