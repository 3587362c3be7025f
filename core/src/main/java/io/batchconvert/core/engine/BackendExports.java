package io.batchconvert.core.engine;

import io.batchconvert.core.error.ConvertException;
import io.batchconvert.core.error.OutputWriteException;
import io.batchconvert.core.error.UnexpectedConversionException;
import io.batchconvert.core.model.ConverterSettings;
import io.batchconvert.core.spi.BackendExporter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates the combined JSON exports and the source update to a {@link BackendExporter}, using
 * the style and force mode of the shared {@link ConverterSettings}.
 *
 * <p>
 * Errors are mapped the same way as for regular conversions: a {@link ConvertException} raised
 * by the backend is propagated unchanged, an {@link IOException} becomes
 * {@link OutputWriteException} and any other runtime failure becomes
 * {@link UnexpectedConversionException}.
 */
public final class BackendExports {

    private static final Logger LOG = LoggerFactory.getLogger(BackendExports.class);

    private final BackendExporter backend;
    private final ConverterSettings settings;

    public BackendExports(BackendExporter backend, ConverterSettings settings) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public void exportMedia(Path input, Path output, Path highlightConfig) {
        delegate("media", input, output, () -> backend.exportMedia(
                input, output, highlightConfig, settings.stylePath(), settings.forceMode()));
    }

    public void exportMeta(Path input, Path output) {
        delegate("meta", input, output,
                () -> backend.exportMeta(input, output, settings.stylePath(), settings.forceMode()));
    }

    public void exportParts(Path input, Path output) {
        delegate("parts", input, output,
                () -> backend.exportParts(input, output, settings.stylePath(), settings.forceMode()));
    }

    public void exportPartsPdfs(Path input, Path output) {
        delegate("parts_pdfs", input, output,
                () -> backend.exportPartsPdfs(input, output, settings.stylePath(), settings.forceMode()));
    }

    /** Exports the document transformed by {@code optionsJson}, a JSON object of transform options. */
    public void exportTranspose(Path input, Path output, String optionsJson) {
        Objects.requireNonNull(optionsJson, "optionsJson must not be null");
        delegate("transpose", input, output, () -> backend.exportTranspose(
                input, output, optionsJson, settings.stylePath(), settings.forceMode()));
    }

    /** Rewrites the source reference of {@code input} in place. */
    public void updateSource(Path input, String newSource) {
        Objects.requireNonNull(newSource, "newSource must not be null");
        delegate("source_update", input, input, () -> backend.updateSource(input, newSource, settings.forceMode()));
    }

    private void delegate(String export, Path input, Path output, BackendCall call) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
        long startNanos = System.nanoTime();
        try {
            call.run();
        } catch (ConvertException e) {
            LOG.warn("backend.failed export={} input={} code={} detail={}", export, input, e.code(), e.getMessage());
            throw e;
        } catch (IOException e) {
            LOG.warn("backend.failed export={} input={} output={} detail={}", export, input, output, e.getMessage());
            throw new OutputWriteException(output, e);
        } catch (RuntimeException e) {
            LOG.error("backend.failed export={} input={} detail={}", export, input, e.getMessage(), e);
            throw new UnexpectedConversionException("Backend export '" + export + "' failed: " + e.getMessage(), e);
        }
        LOG.info(
                "backend.exported export={} input={} output={} duration_ms={}",
                export,
                input,
                output,
                (System.nanoTime() - startNanos) / 1_000_000);
    }

    @FunctionalInterface
    private interface BackendCall {
        void run() throws IOException;
    }
}
