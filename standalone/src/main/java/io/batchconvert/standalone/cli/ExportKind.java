package io.batchconvert.standalone.cli;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Single-document exports selectable with {@code --export} instead of a batch job file.
 */
public enum ExportKind {
    /** Whole project through a project writer, e.g. a video. */
    PROJECT("project", false),
    /** Media bundle as JSON; the argument is an optional highlight configuration file. */
    MEDIA("media", true),
    /** Document metadata as JSON. */
    META("meta", true),
    /** All parts as native data in one JSON file. */
    PARTS("parts", true),
    /** All parts as PDF in one JSON file. */
    PARTS_PDFS("parts-pdfs", true),
    /** Transformed document as JSON; the argument is the transform options object. */
    TRANSPOSE("transpose", true),
    /** Rewrites the stored source reference in place; the argument is the new source. */
    SOURCE("source", true);

    private final String option;
    private final boolean backend;

    ExportKind(String option, boolean backend) {
        this.option = option;
        this.backend = backend;
    }

    /** The value accepted by {@code --export}. */
    public String option() {
        return option;
    }

    /** Returns {@code true} if the export is performed by the backend exporter plugin. */
    public boolean requiresBackend() {
        return backend;
    }

    /** Returns {@code true} if the export writes to a separate output file. */
    public boolean hasOutput() {
        return this != SOURCE;
    }

    /**
     * Looks up an export by its option value.
     *
     * @throws IllegalArgumentException if no export has that name
     */
    public static ExportKind fromOption(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExportKind kind : values()) {
            if (kind.option.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown --export value '" + value + "', expected one of "
                + Arrays.stream(values()).map(ExportKind::option).collect(Collectors.joining(", ")));
    }
}
