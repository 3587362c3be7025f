package io.batchconvert.core.spi;

/**
 * Read-only view of a loaded document or of one of its parts, as seen by writers. Opaque to the
 * core beyond its display name and page count.
 */
public interface Document {

    /** Display name; for a part this is the name substituted into templated outputs. */
    String name();

    /** Number of pages in the laid-out document. */
    int pageCount();
}
