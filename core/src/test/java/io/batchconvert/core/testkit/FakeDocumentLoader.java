package io.batchconvert.core.testkit;

import io.batchconvert.core.spi.DocumentLoader;
import io.batchconvert.core.spi.LoadedDocument;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Loader backed by documents registered per input path. Unknown paths fail like missing files. */
public final class FakeDocumentLoader implements DocumentLoader {

    private final Map<Path, FakeDocument> documents = new ConcurrentHashMap<>();
    private final List<Path> loaded = new CopyOnWriteArrayList<>();
    private final Set<String> nativeSuffixes;
    private volatile Path lastStylePath;
    private volatile boolean lastForceMode;

    public FakeDocumentLoader() {
        this(Set.of("mscz", "mscx"));
    }

    public FakeDocumentLoader(Set<String> nativeSuffixes) {
        this.nativeSuffixes = nativeSuffixes;
    }

    public FakeDocument register(String input, FakeDocument document) {
        documents.put(Path.of(input), document);
        return document;
    }

    @Override
    public LoadedDocument load(Path input, Path stylePath, boolean forceMode) throws IOException {
        loaded.add(input);
        lastStylePath = stylePath;
        lastForceMode = forceMode;
        FakeDocument document = documents.get(input);
        if (document == null) {
            throw new NoSuchFileException(input.toString());
        }
        return document;
    }

    @Override
    public Set<String> nativeSuffixes() {
        return nativeSuffixes;
    }

    /** Inputs in load order. */
    public List<Path> loaded() {
        return loaded;
    }

    public Path lastStylePath() {
        return lastStylePath;
    }

    public boolean lastForceMode() {
        return lastForceMode;
    }
}
