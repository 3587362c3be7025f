package io.batchconvert.core.spi;

import java.net.URI;

/**
 * Runs an externally supplied extension against a loaded document before it is exported.
 * Extensions may mutate the document in place.
 */
public interface ExtensionRunner {

    /**
     * Performs the extension.
     *
     * @param document  the document of the current job
     * @param extension extension identifier with its query parameters
     * @throws io.batchconvert.core.error.ExtensionException if the extension fails
     */
    void perform(LoadedDocument document, URI extension);
}
