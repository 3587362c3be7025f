package io.batchconvert.standalone.testplugin;

import io.batchconvert.core.spi.DocumentLoader;
import io.batchconvert.core.spi.LoadedDocument;
import java.io.IOException;
import java.nio.file.Path;

/** Competing loader, only registered by tests that expect discovery to fail. */
public final class SecondLoader implements DocumentLoader {

    @Override
    public LoadedDocument load(Path input, Path stylePath, boolean forceMode) throws IOException {
        throw new IOException("not used");
    }
}
