package io.batchconvert.core.engine;

import io.batchconvert.core.spi.DocumentWriter;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of document writers, keyed by output kind (lower-case suffix). Thread-safe:
 * registration and lookup can happen concurrently.
 */
public final class WriterRegistry {

    private final Map<String, DocumentWriter> writers = new ConcurrentHashMap<>();

    /**
     * Registers a writer under every suffix it declares. A suffix that is already registered is
     * taken over by the new writer (last-write-wins).
     *
     * @param writer the writer to register
     * @throws NullPointerException     if writer or its suffix set is null
     * @throws IllegalArgumentException if the writer declares no suffix, or a blank one
     */
    public void register(DocumentWriter writer) {
        if (writer == null) {
            throw new NullPointerException("writer must not be null");
        }
        Set<String> suffixes = writer.suffixes();
        if (suffixes == null) {
            throw new NullPointerException("writer suffixes must not be null");
        }
        if (suffixes.isEmpty()) {
            throw new IllegalArgumentException(
                    "writer must declare at least one suffix: " + writer.getClass().getName());
        }
        for (String suffix : suffixes) {
            if (suffix == null || suffix.isBlank()) {
                throw new IllegalArgumentException("writer suffix must not be null or blank");
            }
        }
        suffixes.forEach(suffix -> writers.put(normalize(suffix), writer));
    }

    /**
     * Looks up the writer for an output kind.
     *
     * @param kind output suffix, with or without a leading dot, any case
     * @return the writer, or empty if none is registered
     */
    public Optional<DocumentWriter> getWriter(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(writers.get(normalize(kind)));
    }

    /** Returns {@code true} if a writer is registered for the kind. */
    public boolean hasWriter(String kind) {
        return getWriter(kind).isPresent();
    }

    /** Returns the registered kinds, sorted. */
    public Set<String> kinds() {
        return new TreeSet<>(writers.keySet());
    }

    /** Returns the number of registered kinds. */
    public int size() {
        return writers.size();
    }

    private static String normalize(String kind) {
        String bare = kind.startsWith(".") ? kind.substring(1) : kind;
        return bare.toLowerCase(Locale.ROOT);
    }
}
