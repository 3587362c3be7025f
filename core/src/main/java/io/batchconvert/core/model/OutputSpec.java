package io.batchconvert.core.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Where a job writes its result. Either a single concrete file or a template that yields one file
 * per part of the loaded document.
 *
 * <p>
 * Implementations are a sealed hierarchy. The wire form of a templated output is a path whose
 * base name (file name without its last suffix) contains {@link #PLACEHOLDER}; {@link #parse}
 * maps that string form onto the variants so that nothing downstream has to look for the marker
 * in file names again.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface OutputSpec {

    /** Marker substituted with a part's display name. */
    String PLACEHOLDER = "*";

    /** The output suffix exactly as written, without the leading dot (may be empty). */
    String suffix();

    /** Human-readable form used in logs and failure reports. */
    String display();

    /** The output kind: the lower-cased suffix, used to select a writer. */
    default String kind() {
        return suffix().toLowerCase(Locale.ROOT);
    }

    /** Returns {@code true} if this spec yields one output per part. */
    default boolean isTemplated() {
        return this instanceof Templated;
    }

    /**
     * Parses a path in wire form ({@code /} separators).
     *
     * @param path output path, possibly containing the placeholder in its base name
     * @return a {@link Templated} spec if the base name contains the placeholder, a {@link Single}
     *     spec otherwise
     * @throws java.nio.file.InvalidPathException if a single path is not valid on this platform
     */
    static OutputSpec parse(String path) {
        Objects.requireNonNull(path, "path must not be null");
        int slash = path.lastIndexOf('/');
        String fileName = path.substring(slash + 1);
        int dot = fileName.lastIndexOf('.');
        String baseName = dot >= 0 ? fileName.substring(0, dot) : fileName;
        if (!baseName.contains(PLACEHOLDER)) {
            return new Single(Path.of(path));
        }
        String suffix = dot >= 0 ? fileName.substring(dot + 1) : "";
        Path directory = null;
        if (slash == 0) {
            directory = Path.of("/");
        } else if (slash > 0) {
            directory = Path.of(path.substring(0, slash));
        }
        return new Templated(directory, baseName, suffix);
    }

    /**
     * Builds the templated spec declared by a {@code [prefix, suffix]} pair: the output becomes
     * {@code prefix + "*" + "." + suffix}. A leading dot on the suffix is tolerated.
     */
    static Templated templated(String prefix, String suffix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(suffix, "suffix must not be null");
        String bareSuffix = suffix.startsWith(".") ? suffix.substring(1) : suffix;
        if (bareSuffix.indexOf('/') >= 0 || bareSuffix.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("Output suffix must not contain a path separator: " + suffix);
        }
        return (Templated) parse(prefix + PLACEHOLDER + "." + bareSuffix);
    }

    // ── Variants ──

    /** A single concrete output file. */
    record Single(Path path) implements OutputSpec {
        public Single {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String suffix() {
            Path fileName = path.getFileName();
            if (fileName == null) {
                return "";
            }
            String name = fileName.toString();
            int dot = name.lastIndexOf('.');
            return dot >= 0 ? name.substring(dot + 1) : "";
        }

        @Override
        public String display() {
            return path.toString();
        }
    }

    /**
     * One output per part.
     *
     * @param directory   directory the part files are written to, or {@code null} for the
     *                    working directory
     * @param namePattern base name containing at least one placeholder
     * @param suffix      output suffix without the leading dot
     */
    record Templated(Path directory, String namePattern, String suffix) implements OutputSpec {
        public Templated {
            Objects.requireNonNull(namePattern, "namePattern must not be null");
            Objects.requireNonNull(suffix, "suffix must not be null");
            if (!namePattern.contains(PLACEHOLDER)) {
                throw new IllegalArgumentException(
                        "Templated output name must contain '" + PLACEHOLDER + "', got: " + namePattern);
            }
        }

        @Override
        public String display() {
            String fileName = suffix.isEmpty() ? namePattern : namePattern + "." + suffix;
            if (directory == null) {
                return fileName;
            }
            String dir = directory.toString().replace('\\', '/');
            return dir.endsWith("/") ? dir + fileName : dir + "/" + fileName;
        }
    }
}
