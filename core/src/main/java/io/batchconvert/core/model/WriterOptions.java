package io.batchconvert.core.model;

/**
 * Per-call options handed to a {@link io.batchconvert.core.spi.DocumentWriter}. Transient, built
 * for each write.
 *
 * @param unit       whether the written document is the whole document or one part of it
 * @param pageNumber 0-based page to write, or {@code null} to write all pages
 */
public record WriterOptions(UnitType unit, Integer pageNumber) {

    /** Unit of the document handed to the writer. */
    public enum UnitType {
        WHOLE_DOCUMENT,
        PER_PART
    }

    /** No special options: the whole document, all pages. */
    public static final WriterOptions DEFAULT = new WriterOptions(UnitType.WHOLE_DOCUMENT, null);

    public WriterOptions {
        if (unit == null) {
            unit = UnitType.WHOLE_DOCUMENT;
        }
        if (pageNumber != null && pageNumber < 0) {
            throw new IllegalArgumentException("pageNumber must not be negative, got: " + pageNumber);
        }
    }

    /** Options for writing one part of a document. */
    public static WriterOptions perPart() {
        return new WriterOptions(UnitType.PER_PART, null);
    }

    /** Returns a copy of these options restricted to the given 0-based page. */
    public WriterOptions withPage(int pageIndex) {
        return new WriterOptions(unit, pageIndex);
    }
}
