package io.batchconvert.standalone.testplugin;

import io.batchconvert.core.model.OutputTarget;
import io.batchconvert.core.model.WriterOptions;
import io.batchconvert.core.spi.Document;
import io.batchconvert.core.spi.DocumentWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/** Writes the document name, plus the page number when a single page is requested. */
public final class TextWriter implements DocumentWriter {

    @Override
    public Set<String> suffixes() {
        return Set.of("txt", "tdoc");
    }

    @Override
    public void write(Document document, OutputTarget target, WriterOptions options) throws IOException {
        String text = options.pageNumber() == null
                ? document.name()
                : document.name() + " page " + (options.pageNumber() + 1);
        target.stream().write(text.getBytes(StandardCharsets.UTF_8));
    }
}
