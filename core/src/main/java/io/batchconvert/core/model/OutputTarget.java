package io.batchconvert.core.model;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An output file opened for one write call. Carries metadata tags ({@link #META_FILE_PATH},
 * {@link #META_DIR_PATH}) that writers may read to locate sibling files.
 *
 * <p>
 * Not thread-safe; owned by a single write operation and closed by it.
 */
public final class OutputTarget implements Closeable {

    /** Metadata key holding the path of the file being written. */
    public static final String META_FILE_PATH = "file_path";

    /** Metadata key holding the path the page files of a page-by-page conversion derive from. */
    public static final String META_DIR_PATH = "dir_path";

    private final Path path;
    private final OutputStream stream;
    private final Map<String, String> meta = new LinkedHashMap<>();

    private OutputTarget(Path path, OutputStream stream) {
        this.path = path;
        this.stream = stream;
    }

    /**
     * Opens (creating or truncating) the file for writing. Missing parent directories are
     * created.
     *
     * @param path file to open
     * @return an open target
     * @throws IOException if the file or its parent directories cannot be created
     */
    public static OutputTarget open(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new OutputTarget(path, new BufferedOutputStream(Files.newOutputStream(path)));
    }

    public Path path() {
        return path;
    }

    /** The stream writers serialize into. Must not be closed by the writer. */
    public OutputStream stream() {
        return stream;
    }

    public void setMeta(String key, String value) {
        meta.put(key, value);
    }

    /** Returns the metadata value for the key, or {@code null}. */
    public String meta(String key) {
        return meta.get(key);
    }

    /** Unmodifiable view of all metadata tags. */
    public Map<String, String> metadata() {
        return Collections.unmodifiableMap(meta);
    }

    @Override
    public void close() throws IOException {
        stream.close();
    }
}
